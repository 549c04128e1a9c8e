package com.quikdb.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Per-operator cumulative totals.
 * Distributed and slashed totals only ever grow; each settlement or slash
 * event touches them exactly once.
 */
@Entity
@Table(name = "operator_ledgers", indexes = {
    @Index(name = "idx_ledger_operator", columnList = "operator_address", unique = true)
})
public class OperatorLedger {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "operator_address", nullable = false, unique = true, length = 42)
    private String operator;

    @NotNull
    @Column(name = "total_distributed", nullable = false, precision = 38, scale = 0)
    private BigInteger totalDistributed;

    @NotNull
    @Column(name = "total_slashed", nullable = false, precision = 38, scale = 0)
    private BigInteger totalSlashed;

    @Column(name = "reward_count", nullable = false)
    private long rewardCount;

    @Column(name = "last_calculation_at")
    private Instant lastCalculationAt;

    @Column(name = "last_distribution_at")
    private Instant lastDistributionAt;

    @Column(name = "last_slash_at")
    private Instant lastSlashAt;

    @Version
    private Long version;

    protected OperatorLedger() {}

    public static OperatorLedger open(String operator) {
        var ledger = new OperatorLedger();
        ledger.operator = operator;
        ledger.totalDistributed = BigInteger.ZERO;
        ledger.totalSlashed = BigInteger.ZERO;
        ledger.rewardCount = 0;
        return ledger;
    }

    public void recordCalculation(Instant at) {
        this.rewardCount++;
        this.lastCalculationAt = at;
    }

    public void recordDistribution(BigInteger amount, Instant at) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Distribution amount must be positive");
        }
        this.totalDistributed = this.totalDistributed.add(amount);
        this.lastDistributionAt = at;
    }

    public void recordSlash(BigInteger amount, Instant at) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Slash amount must be positive");
        }
        this.totalSlashed = this.totalSlashed.add(amount);
        this.lastSlashAt = at;
    }

    /**
     * Distributed rewards not yet offset by slashing, floored at zero.
     */
    public BigInteger getNetEntitlement() {
        return totalDistributed.subtract(totalSlashed).max(BigInteger.ZERO);
    }

    // Getters
    public UUID getId() { return id; }
    public String getOperator() { return operator; }
    public BigInteger getTotalDistributed() { return totalDistributed; }
    public BigInteger getTotalSlashed() { return totalSlashed; }
    public long getRewardCount() { return rewardCount; }
    public Instant getLastCalculationAt() { return lastCalculationAt; }
    public Instant getLastDistributionAt() { return lastDistributionAt; }
    public Instant getLastSlashAt() { return lastSlashAt; }
}
