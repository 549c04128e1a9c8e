package com.quikdb.api.node;

/**
 * Lifecycle status of a node in the directory.
 */
public enum NodeStatus {
    PENDING,
    ACTIVE,
    INACTIVE,
    MAINTENANCE,
    SUSPENDED,
    DEREGISTERED,
    LISTED,
    OFFLINE;

    /**
     * Only active and listed nodes earn rewards.
     */
    public boolean isRewardable() {
        return this == ACTIVE || this == LISTED;
    }
}
