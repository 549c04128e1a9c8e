package com.quikdb.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import java.time.Instant;

/**
 * Ledgered reward awaiting or having completed settlement.
 *
 * The amount is fixed at creation. The distributed flag moves from false to
 * true exactly once, through {@link #markDistributed(Instant)}.
 */
@Entity
@Table(name = "reward_records", indexes = {
    @Index(name = "idx_reward_operator", columnList = "operator_address"),
    @Index(name = "idx_reward_node", columnList = "node_id"),
    @Index(name = "idx_reward_distributed", columnList = "distributed")
})
public class RewardRecord {

    @Id
    @Column(name = "reward_id", length = 64)
    private String rewardId;

    @NotNull
    @Column(name = "operator_address", nullable = false, length = 42)
    private String operator;

    @NotNull
    @Column(name = "node_id", nullable = false, length = 128)
    private String nodeId;

    @NotNull
    @Column(name = "base_amount", nullable = false, precision = 38, scale = 0, updatable = false)
    private BigInteger baseAmount;

    @NotNull
    @Column(nullable = false, precision = 38, scale = 0, updatable = false)
    private BigInteger amount;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "reward_type", nullable = false, updatable = false)
    private RewardType rewardType;

    @Min(0) @Max(100)
    @Column(name = "uptime_score", nullable = false, updatable = false)
    private int uptimeScore;

    @Min(0) @Max(100)
    @Column(name = "performance_score", nullable = false, updatable = false)
    private int performanceScore;

    @Min(0) @Max(100)
    @Column(name = "quality_score", nullable = false, updatable = false)
    private int qualityScore;

    @Min(0) @Max(100)
    @Column(name = "overall_score", nullable = false, updatable = false)
    private int overallScore;

    @Column(name = "reward_period", length = 64, updatable = false)
    private String period;

    @NotNull
    @Column(name = "calculated_at", nullable = false, updatable = false)
    private Instant calculatedAt;

    @Column(name = "distributed_at")
    private Instant distributedAt;

    @Column(nullable = false)
    private boolean distributed;

    @Column(name = "payout_reference")
    private String payoutReference;

    @Version
    private Long version;

    protected RewardRecord() {}

    public static RewardRecord create(
            String rewardId,
            String operator,
            String nodeId,
            BigInteger baseAmount,
            BigInteger amount,
            RewardType rewardType,
            int uptimeScore,
            int performanceScore,
            int qualityScore,
            int overallScore,
            String period,
            Instant calculatedAt) {
        var record = new RewardRecord();
        record.rewardId = rewardId;
        record.operator = operator;
        record.nodeId = nodeId;
        record.baseAmount = baseAmount;
        record.amount = amount;
        record.rewardType = rewardType;
        record.uptimeScore = uptimeScore;
        record.performanceScore = performanceScore;
        record.qualityScore = qualityScore;
        record.overallScore = overallScore;
        record.period = period;
        record.calculatedAt = calculatedAt;
        record.distributed = false;
        return record;
    }

    public void markDistributed(Instant at) {
        if (this.distributed) {
            throw new IllegalStateException("Reward already distributed: " + rewardId);
        }
        this.distributed = true;
        this.distributedAt = at;
    }

    /**
     * Records the payout of a settled reward. Set once.
     */
    public void attachPayoutReference(String payoutReference) {
        if (!this.distributed || this.payoutReference != null) {
            throw new IllegalStateException("Payout reference not attachable: " + rewardId);
        }
        this.payoutReference = payoutReference;
    }

    /**
     * Distribution time in epoch seconds, 0 while unsettled.
     */
    public long getDistributionTimestamp() {
        return distributedAt == null ? 0L : distributedAt.getEpochSecond();
    }

    // Getters
    public String getRewardId() { return rewardId; }
    public String getOperator() { return operator; }
    public String getNodeId() { return nodeId; }
    public BigInteger getBaseAmount() { return baseAmount; }
    public BigInteger getAmount() { return amount; }
    public RewardType getRewardType() { return rewardType; }
    public int getUptimeScore() { return uptimeScore; }
    public int getPerformanceScore() { return performanceScore; }
    public int getQualityScore() { return qualityScore; }
    public int getOverallScore() { return overallScore; }
    public String getPeriod() { return period; }
    public Instant getCalculatedAt() { return calculatedAt; }
    public Instant getDistributedAt() { return distributedAt; }
    public boolean isDistributed() { return distributed; }
    public String getPayoutReference() { return payoutReference; }
}
