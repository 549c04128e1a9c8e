package com.quikdb.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of a state transition, hash-chained to its predecessor.
 * Before/after values let ledger and bucket state be rebuilt independently.
 */
@Entity
@Table(name = "audit_events", indexes = {
    @Index(name = "idx_audit_event_type", columnList = "event_type"),
    @Index(name = "idx_audit_subject", columnList = "subject"),
    @Index(name = "idx_audit_sequence", columnList = "sequence_number", unique = true)
})
public class AuditEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private long sequenceNumber;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 48, updatable = false)
    private EventType eventType;

    @NotNull
    @Column(name = "actor_id", nullable = false, length = 128, updatable = false)
    private String actor;

    @NotNull
    @Column(nullable = false, length = 128, updatable = false)
    private String subject;

    @Column(name = "before_value", length = 512, updatable = false)
    private String beforeValue;

    @Column(name = "after_value", length = 512, updatable = false)
    private String afterValue;

    @Column(length = 1024, updatable = false)
    private String details;

    @NotNull
    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @NotNull
    @Column(name = "previous_hash", nullable = false, length = 64, updatable = false)
    private String previousHash;

    @NotNull
    @Column(name = "event_hash", nullable = false, length = 64, updatable = false)
    private String eventHash;

    protected AuditEvent() {}

    public static AuditEvent create(
            long sequenceNumber,
            EventType eventType,
            String actor,
            String subject,
            String beforeValue,
            String afterValue,
            String details,
            Instant occurredAt,
            String previousHash,
            String eventHash) {
        var event = new AuditEvent();
        event.sequenceNumber = sequenceNumber;
        event.eventType = eventType;
        event.actor = actor;
        event.subject = subject;
        event.beforeValue = beforeValue;
        event.afterValue = afterValue;
        event.details = details;
        event.occurredAt = occurredAt;
        event.previousHash = previousHash;
        event.eventHash = eventHash;
        return event;
    }

    // Getters
    public UUID getId() { return id; }
    public long getSequenceNumber() { return sequenceNumber; }
    public EventType getEventType() { return eventType; }
    public String getActor() { return actor; }
    public String getSubject() { return subject; }
    public String getBeforeValue() { return beforeValue; }
    public String getAfterValue() { return afterValue; }
    public String getDetails() { return details; }
    public Instant getOccurredAt() { return occurredAt; }
    public String getPreviousHash() { return previousHash; }
    public String getEventHash() { return eventHash; }

    public enum EventType {
        // Reward lifecycle
        REWARD_CALCULATED,
        REWARD_DISTRIBUTED,
        PERIOD_ACCRUED,
        OPERATOR_SLASHED,
        BATCH_DISTRIBUTED,
        BATCH_CALCULATED,
        // Resilience plane
        RATE_LIMIT_RESET,
        CIRCUIT_TRIPPED,
        CIRCUIT_RESET,
        EMERGENCY_PAUSE_ACTIVATED,
        EMERGENCY_PAUSE_DEACTIVATED,
        ANOMALY_DETECTED,
        ANOMALY_BASELINE_RECALIBRATED,
        // Governance
        TIMELOCK_PROPOSED,
        TIMELOCK_EXECUTED,
        TIMELOCK_CANCELLED,
        POLICY_UPDATED,
        CAPABILITY_GRANTED,
        CAPABILITY_REVOKED
    }
}
