package com.quikdb.api.error;

public class CircuitOpenException extends RewardException {

    private final String operation;
    private final String reason;

    public CircuitOpenException(String operation, String reason) {
        super(ErrorCategory.PRECONDITION, "Circuit breaker open for " + operation + ": " + reason);
        this.operation = operation;
        this.reason = reason;
    }

    public String getOperation() { return operation; }
    public String getReason() { return reason; }
}
