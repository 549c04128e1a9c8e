package com.quikdb.api.reward;

import com.quikdb.core.domain.RewardType;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Content-derived reward identifiers: SHA-256 over operator, node, adjusted
 * amount, calculation time, reward type and period.
 */
@Component
public class RewardIdGenerator {

    public String generate(String operator, String nodeId, BigInteger amount,
                           Instant calculatedAt, RewardType rewardType, String period) {
        String data = String.join("|",
                operator.toLowerCase(),
                nodeId,
                amount.toString(),
                Long.toString(calculatedAt.getEpochSecond()),
                Integer.toString(calculatedAt.getNano()),
                Integer.toString(rewardType.getCode()),
                period == null ? "" : period);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
