package com.quikdb.api.error;

/**
 * Caller-visible failure of a reward engine operation.
 */
public class RewardException extends RuntimeException {

    private final ErrorCategory category;

    public RewardException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public RewardException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public static RewardException validation(String message) {
        return new RewardException(ErrorCategory.VALIDATION, message);
    }

    public static RewardException precondition(String message) {
        return new RewardException(ErrorCategory.PRECONDITION, message);
    }

    public static RewardException capacity(String message) {
        return new RewardException(ErrorCategory.CAPACITY, message);
    }

    public static RewardException collision(String message) {
        return new RewardException(ErrorCategory.COLLISION, message);
    }

    public static RewardException unauthorized(String message) {
        return new RewardException(ErrorCategory.AUTHORIZATION, message);
    }
}
