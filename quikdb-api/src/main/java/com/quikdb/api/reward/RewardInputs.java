package com.quikdb.api.reward;

import com.quikdb.api.error.RewardException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identifier checks applied before any state is read.
 */
final class RewardInputs {

    private static final Pattern OPERATOR_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final int MAX_NODE_ID_LENGTH = 128;
    private static final int MAX_REWARD_ID_LENGTH = 64;
    static final int MAX_REASON_LENGTH = 512;

    private RewardInputs() {}

    static void requireOperator(String operator) {
        if (operator == null || !OPERATOR_ADDRESS.matcher(operator).matches()) {
            throw RewardException.validation("Invalid operator address: " + operator);
        }
    }

    /**
     * Canonical lowercase form of a valid address. Ledgers, buckets and
     * records are keyed by this form only.
     */
    static String normalizeOperator(String operator) {
        requireOperator(operator);
        return operator.toLowerCase(Locale.ROOT);
    }

    static void requireNodeId(String nodeId) {
        if (nodeId == null || nodeId.isBlank() || nodeId.length() > MAX_NODE_ID_LENGTH) {
            throw RewardException.validation("Invalid node id: " + nodeId);
        }
    }

    static void requireRewardId(String rewardId) {
        if (rewardId == null || rewardId.isBlank() || rewardId.length() > MAX_REWARD_ID_LENGTH) {
            throw RewardException.validation("Invalid reward id: " + rewardId);
        }
    }
}
