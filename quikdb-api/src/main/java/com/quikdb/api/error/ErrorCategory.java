package com.quikdb.api.error;

/**
 * Failure classes of the reward engine. Every failure commits nothing.
 */
public enum ErrorCategory {
    /** Malformed identifiers, out-of-range scores, amounts or enum values. */
    VALIDATION,
    /** Missing or settled records, rate limits, open circuits, pauses, cooldowns. */
    PRECONDITION,
    /** Period caps, balances and slashing bounds. */
    CAPACITY,
    /** Duplicate content-derived identifiers. */
    COLLISION,
    /** Caller lacks the required capability. */
    AUTHORIZATION
}
