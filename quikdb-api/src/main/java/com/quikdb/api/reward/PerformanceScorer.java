package com.quikdb.api.reward;

import com.quikdb.api.error.RewardException;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Weighted performance score shared by reward adjustment and slashing.
 *
 * overall = (uptime * 40 + performance * 35 + quality * 25) / 100, truncated.
 */
@Component
public class PerformanceScorer {

    public static final int UPTIME_WEIGHT = 40;
    public static final int PERFORMANCE_WEIGHT = 35;
    public static final int QUALITY_WEIGHT = 25;
    public static final int MAX_SCORE = 100;

    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    public int score(int uptime, int performance, int quality) {
        requireScore("uptime", uptime);
        requireScore("performance", performance);
        requireScore("quality", quality);
        return (uptime * UPTIME_WEIGHT + performance * PERFORMANCE_WEIGHT + quality * QUALITY_WEIGHT) / 100;
    }

    /**
     * Scales a base amount by a score, truncating toward zero.
     */
    public BigInteger adjust(BigInteger baseAmount, int score) {
        requireScore("overall", score);
        return baseAmount.multiply(BigInteger.valueOf(score)).divide(HUNDRED);
    }

    static void requireScore(String name, int value) {
        if (value < 0 || value > MAX_SCORE) {
            throw RewardException.validation("Invalid " + name + " score: " + value);
        }
    }
}
