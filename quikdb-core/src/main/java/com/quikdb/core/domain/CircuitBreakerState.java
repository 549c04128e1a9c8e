package com.quikdb.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Breaker for one named operation. Opens only on an explicit trip and
 * closes only on an explicit reset.
 */
@Entity
@Table(name = "circuit_breaker_states")
public class CircuitBreakerState {

    @Id
    @Column(name = "operation_name", length = 64)
    private String operation;

    @Column(nullable = false)
    private boolean tripped;

    @Column(name = "tripped_at")
    private Instant trippedAt;

    @Column(name = "tripped_by", length = 128)
    private String trippedBy;

    @Column(name = "failure_count", nullable = false)
    private long failureCount;

    @Column(name = "success_count", nullable = false)
    private long successCount;

    @Column(length = 512)
    private String reason;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected CircuitBreakerState() {}

    public static CircuitBreakerState closed(String operation, Instant now) {
        var state = new CircuitBreakerState();
        state.operation = operation;
        state.tripped = false;
        state.failureCount = 0;
        state.successCount = 0;
        state.updatedAt = now;
        return state;
    }

    public void trip(String reason, String trippedBy, Instant now) {
        this.tripped = true;
        this.reason = reason;
        this.trippedBy = trippedBy;
        this.trippedAt = now;
        this.updatedAt = now;
    }

    public void reset(Instant now) {
        this.tripped = false;
        this.failureCount = 0;
        this.successCount = 0;
        this.reason = null;
        this.trippedBy = null;
        this.trippedAt = null;
        this.updatedAt = now;
    }

    public void recordFailure(Instant now) {
        this.failureCount++;
        this.updatedAt = now;
    }

    public void recordSuccess(Instant now) {
        this.successCount++;
        this.updatedAt = now;
    }

    // Getters
    public String getOperation() { return operation; }
    public boolean isTripped() { return tripped; }
    public Instant getTrippedAt() { return trippedAt; }
    public String getTrippedBy() { return trippedBy; }
    public long getFailureCount() { return failureCount; }
    public long getSuccessCount() { return successCount; }
    public String getReason() { return reason; }
    public Instant getUpdatedAt() { return updatedAt; }
}
