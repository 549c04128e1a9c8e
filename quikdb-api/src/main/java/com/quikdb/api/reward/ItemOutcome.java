package com.quikdb.api.reward;

import com.quikdb.api.error.ErrorCategory;
import com.quikdb.api.error.RewardException;

/**
 * Result of a single calculation or distribution run on behalf of a batch.
 * A failed item carries the category and message of the refused check.
 */
public record ItemOutcome<T>(T value, ErrorCategory errorCategory, String failureReason) {

    static <T> ItemOutcome<T> succeeded(T value) {
        return new ItemOutcome<>(value, null, null);
    }

    static <T> ItemOutcome<T> failed(RewardException refusal) {
        return new ItemOutcome<>(null, refusal.getCategory(), refusal.getMessage());
    }

    public boolean success() {
        return errorCategory == null;
    }
}
