package com.quikdb.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import java.time.Instant;

/**
 * Reference value for one metric. Observations never move the baseline;
 * only recalibration does.
 */
@Entity
@Table(name = "anomaly_baselines")
public class AnomalyBaseline {

    @Id
    @Column(name = "metric_name", length = 128)
    private String metric;

    @NotNull
    @Column(name = "baseline_value", nullable = false, precision = 38, scale = 0)
    private BigInteger baselineValue;

    @Column(name = "last_observed_value", precision = 38, scale = 0)
    private BigInteger lastObservedValue;

    @Column(nullable = false)
    private boolean detected;

    @Column(name = "last_increase_percent")
    private Long lastIncreasePercent;

    @NotNull
    @Column(name = "guarded_operation", nullable = false, length = 64)
    private String guardedOperation;

    @NotNull
    @Column(name = "recalibrated_at", nullable = false)
    private Instant recalibratedAt;

    @Column(name = "last_observed_at")
    private Instant lastObservedAt;

    @Version
    private Long version;

    protected AnomalyBaseline() {}

    public static AnomalyBaseline calibrate(String metric, BigInteger baselineValue,
                                            String guardedOperation, Instant now) {
        var baseline = new AnomalyBaseline();
        baseline.metric = metric;
        baseline.baselineValue = baselineValue;
        baseline.guardedOperation = guardedOperation;
        baseline.recalibratedAt = now;
        baseline.detected = false;
        return baseline;
    }

    public void recalibrate(BigInteger baselineValue, String guardedOperation, Instant now) {
        this.baselineValue = baselineValue;
        this.guardedOperation = guardedOperation;
        this.recalibratedAt = now;
        this.detected = false;
        this.lastIncreasePercent = null;
    }

    public void observe(BigInteger value, Long increasePercent, boolean anomalous, Instant now) {
        this.lastObservedValue = value;
        this.lastIncreasePercent = increasePercent;
        this.detected = anomalous;
        this.lastObservedAt = now;
    }

    // Getters
    public String getMetric() { return metric; }
    public BigInteger getBaselineValue() { return baselineValue; }
    public BigInteger getLastObservedValue() { return lastObservedValue; }
    public boolean isDetected() { return detected; }
    public Long getLastIncreasePercent() { return lastIncreasePercent; }
    public String getGuardedOperation() { return guardedOperation; }
    public Instant getRecalibratedAt() { return recalibratedAt; }
    public Instant getLastObservedAt() { return lastObservedAt; }
}
