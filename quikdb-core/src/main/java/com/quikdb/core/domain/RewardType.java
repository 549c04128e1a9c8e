package com.quikdb.core.domain;

/**
 * Category of contribution compensated by a reward.
 * Codes match the on-chain enum ordering.
 */
public enum RewardType {
    PERFORMANCE(0),
    UPTIME(1),
    STORAGE_PROVIDED(2),
    COMPUTATION(3),
    NETWORK_CONTRIBUTION(4),
    BONUS(5);

    private final int code;

    RewardType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static boolean isValidCode(int code) {
        return code >= 0 && code < values().length;
    }

    public static RewardType fromCode(int code) {
        for (RewardType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown reward type: " + code);
    }
}
