package com.quikdb.api.error;

public class RateLimitExceededException extends RewardException {

    private final String caller;
    private final String operation;
    private final long currentCount;
    private final long maxAllowed;

    public RateLimitExceededException(String caller, String operation, long currentCount, long maxAllowed) {
        super(ErrorCategory.PRECONDITION, "Rate limit exceeded for " + caller + " on " + operation
                + ": " + currentCount + "/" + maxAllowed);
        this.caller = caller;
        this.operation = operation;
        this.currentCount = currentCount;
        this.maxAllowed = maxAllowed;
    }

    public String getCaller() { return caller; }
    public String getOperation() { return operation; }
    public long getCurrentCount() { return currentCount; }
    public long getMaxAllowed() { return maxAllowed; }
}
