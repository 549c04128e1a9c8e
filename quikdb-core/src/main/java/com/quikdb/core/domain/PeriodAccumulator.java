package com.quikdb.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import java.util.UUID;

/**
 * Amount accrued by one operator within one day or month bucket.
 */
@Entity
@Table(name = "period_accumulators", uniqueConstraints = {
    @UniqueConstraint(name = "uk_period_bucket", columnNames = {"operator_address", "period_type", "bucket_epoch"})
})
public class PeriodAccumulator {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "operator_address", nullable = false, length = 42)
    private String operator;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "period_type", nullable = false, length = 16)
    private PeriodType periodType;

    @Column(name = "bucket_epoch", nullable = false)
    private long bucketEpoch;

    @NotNull
    @Column(name = "accrued_amount", nullable = false, precision = 38, scale = 0)
    private BigInteger accruedAmount;

    @Version
    private Long version;

    protected PeriodAccumulator() {}

    public static PeriodAccumulator open(String operator, PeriodType periodType, long bucketEpoch) {
        var accumulator = new PeriodAccumulator();
        accumulator.operator = operator;
        accumulator.periodType = periodType;
        accumulator.bucketEpoch = bucketEpoch;
        accumulator.accruedAmount = BigInteger.ZERO;
        return accumulator;
    }

    public boolean wouldExceed(BigInteger amount, BigInteger cap) {
        return accruedAmount.add(amount).compareTo(cap) > 0;
    }

    public void accrue(BigInteger amount, BigInteger cap) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Accrued amount must be positive");
        }
        if (wouldExceed(amount, cap)) {
            throw new IllegalStateException("Accrual exceeds " + periodType + " cap");
        }
        this.accruedAmount = this.accruedAmount.add(amount);
    }

    // Getters
    public UUID getId() { return id; }
    public String getOperator() { return operator; }
    public PeriodType getPeriodType() { return periodType; }
    public long getBucketEpoch() { return bucketEpoch; }
    public BigInteger getAccruedAmount() { return accruedAmount; }
}
