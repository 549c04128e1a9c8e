package com.quikdb.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Fixed-window call counter for one (caller, operation) pair.
 */
@Entity
@Table(name = "rate_limit_states", uniqueConstraints = {
    @UniqueConstraint(name = "uk_rate_limit_key", columnNames = {"caller_id", "operation_name"})
})
public class RateLimitState {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "caller_id", nullable = false, length = 128)
    private String caller;

    @NotNull
    @Column(name = "operation_name", nullable = false, length = 64)
    private String operation;

    @NotNull
    @Column(name = "window_started_at", nullable = false)
    private Instant windowStartedAt;

    @Column(name = "call_count", nullable = false)
    private int callCount;

    @Version
    private Long version;

    protected RateLimitState() {}

    public static RateLimitState open(String caller, String operation, Instant now) {
        var state = new RateLimitState();
        state.caller = caller;
        state.operation = operation;
        state.windowStartedAt = now;
        state.callCount = 0;
        return state;
    }

    /**
     * Starts a new window when the current one has elapsed.
     */
    public void rollWindow(Instant now, long windowSeconds) {
        if (!now.isBefore(windowStartedAt.plusSeconds(windowSeconds))) {
            this.windowStartedAt = now;
            this.callCount = 0;
        }
    }

    public boolean isExhausted(int maxAllowed) {
        return callCount >= maxAllowed;
    }

    public void increment() {
        this.callCount++;
    }

    // Getters
    public UUID getId() { return id; }
    public String getCaller() { return caller; }
    public String getOperation() { return operation; }
    public Instant getWindowStartedAt() { return windowStartedAt; }
    public int getCallCount() { return callCount; }
}
