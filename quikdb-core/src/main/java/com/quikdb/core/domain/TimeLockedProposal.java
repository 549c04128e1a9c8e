package com.quikdb.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Privileged admin command waiting out its delay before it may run.
 */
@Entity
@Table(name = "time_locked_proposals", indexes = {
    @Index(name = "idx_timelock_hash", columnList = "operation_hash"),
    @Index(name = "idx_timelock_execute_after", columnList = "execute_after")
})
public class TimeLockedProposal {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "operation_hash", nullable = false, length = 64, updatable = false)
    private String operationHash;

    @NotNull
    @Column(name = "command_type", nullable = false, length = 64, updatable = false)
    private String commandType;

    @NotNull
    @Column(name = "command_payload", nullable = false, length = 4000, updatable = false)
    private String commandPayload;

    @Column(length = 1024, updatable = false)
    private String description;

    @NotNull
    @Column(nullable = false, length = 128, updatable = false)
    private String proposer;

    @NotNull
    @Column(name = "proposed_at", nullable = false, updatable = false)
    private Instant proposedAt;

    @NotNull
    @Column(name = "execute_after", nullable = false, updatable = false)
    private Instant executeAfter;

    @Column(nullable = false)
    private boolean executed;

    @Column(name = "executed_at")
    private Instant executedAt;

    @Column(name = "executed_by", length = 128)
    private String executedBy;

    @Column(nullable = false)
    private boolean cancelled;

    @Version
    private Long version;

    protected TimeLockedProposal() {}

    public static TimeLockedProposal propose(
            String operationHash,
            String commandType,
            String commandPayload,
            String description,
            String proposer,
            Instant proposedAt,
            long delaySeconds) {
        var proposal = new TimeLockedProposal();
        proposal.operationHash = operationHash;
        proposal.commandType = commandType;
        proposal.commandPayload = commandPayload;
        proposal.description = description;
        proposal.proposer = proposer;
        proposal.proposedAt = proposedAt;
        proposal.executeAfter = proposedAt.plusSeconds(delaySeconds);
        proposal.executed = false;
        proposal.cancelled = false;
        return proposal;
    }

    public boolean isReady(Instant now) {
        return !now.isBefore(executeAfter);
    }

    public boolean isPending() {
        return !executed && !cancelled;
    }

    public void markExecuted(String executedBy, Instant now) {
        if (executed) {
            throw new IllegalStateException("Proposal already executed: " + operationHash);
        }
        this.executed = true;
        this.executedBy = executedBy;
        this.executedAt = now;
    }

    public void cancel() {
        if (executed) {
            throw new IllegalStateException("Executed proposal cannot be cancelled: " + operationHash);
        }
        this.cancelled = true;
    }

    // Getters
    public UUID getId() { return id; }
    public String getOperationHash() { return operationHash; }
    public String getCommandType() { return commandType; }
    public String getCommandPayload() { return commandPayload; }
    public String getDescription() { return description; }
    public String getProposer() { return proposer; }
    public Instant getProposedAt() { return proposedAt; }
    public Instant getExecuteAfter() { return executeAfter; }
    public boolean isExecuted() { return executed; }
    public Instant getExecutedAt() { return executedAt; }
    public String getExecutedBy() { return executedBy; }
    public boolean isCancelled() { return cancelled; }
}
