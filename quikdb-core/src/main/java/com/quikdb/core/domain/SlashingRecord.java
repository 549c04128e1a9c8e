package com.quikdb.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of an applied slash and the evidence behind it.
 */
@Entity
@Table(name = "slashing_records", indexes = {
    @Index(name = "idx_slash_operator", columnList = "operator_address"),
    @Index(name = "idx_slash_time", columnList = "slashed_at")
})
public class SlashingRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "operator_address", nullable = false, length = 42, updatable = false)
    private String operator;

    @NotNull
    @Column(nullable = false, precision = 38, scale = 0, updatable = false)
    private BigInteger amount;

    @NotNull
    @Column(nullable = false, length = 512, updatable = false)
    private String reason;

    @Column(name = "uptime_score", nullable = false, updatable = false)
    private int uptimeScore;

    @Column(name = "performance_score", nullable = false, updatable = false)
    private int performanceScore;

    @Column(name = "quality_score", nullable = false, updatable = false)
    private int qualityScore;

    @Column(name = "overall_score", nullable = false, updatable = false)
    private int overallScore;

    @NotNull
    @Column(name = "slashed_by", nullable = false, updatable = false)
    private String slashedBy;

    @NotNull
    @Column(name = "slashed_at", nullable = false, updatable = false)
    private Instant slashedAt;

    protected SlashingRecord() {}

    public static SlashingRecord create(
            String operator,
            BigInteger amount,
            String reason,
            int uptimeScore,
            int performanceScore,
            int qualityScore,
            int overallScore,
            String slashedBy,
            Instant slashedAt) {
        var record = new SlashingRecord();
        record.operator = operator;
        record.amount = amount;
        record.reason = reason;
        record.uptimeScore = uptimeScore;
        record.performanceScore = performanceScore;
        record.qualityScore = qualityScore;
        record.overallScore = overallScore;
        record.slashedBy = slashedBy;
        record.slashedAt = slashedAt;
        return record;
    }

    // Getters
    public UUID getId() { return id; }
    public String getOperator() { return operator; }
    public BigInteger getAmount() { return amount; }
    public String getReason() { return reason; }
    public int getUptimeScore() { return uptimeScore; }
    public int getPerformanceScore() { return performanceScore; }
    public int getQualityScore() { return qualityScore; }
    public int getOverallScore() { return overallScore; }
    public String getSlashedBy() { return slashedBy; }
    public Instant getSlashedAt() { return slashedAt; }
}
