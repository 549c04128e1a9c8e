package com.quikdb.api.resilience;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the anomaly increase computation.
 */
class AnomalyThresholdPropertyTest {

    @Property(tries = 300)
    void increaseIsTruncatedWholePercent(
            @ForAll @LongRange(min = 1, max = 1_000_000) long baseline,
            @ForAll @LongRange(min = 1, max = 1_000_000) long delta) {

        BigInteger increase = AnomalyDetectorService.increasePercent(
                BigInteger.valueOf(baseline), BigInteger.valueOf(baseline + delta));

        assertThat(increase).isEqualTo(BigInteger.valueOf(delta * 100 / baseline));
    }

    @Property(tries = 100)
    void noGrowthMeansNoIncrease(
            @ForAll @LongRange(min = 1, max = 1_000_000) long baseline,
            @ForAll @LongRange(min = 0, max = 1_000_000) long drop) {

        long current = Math.max(0, baseline - drop);
        assertThat(AnomalyDetectorService.increasePercent(BigInteger.valueOf(baseline), BigInteger.valueOf(current)))
                .isNull();
    }

    @Property(tries = 200)
    void hugeGrowthStaysAboveThreshold(
            @ForAll @LongRange(min = 1, max = 1_000) long baseline,
            @ForAll @BigRange(min = "1000000000000", max = "1000000000000000000000000") BigInteger current) {

        BigInteger increase = AnomalyDetectorService.increasePercent(BigInteger.valueOf(baseline), current);

        assertThat(increase).isGreaterThan(BigInteger.valueOf(AnomalyDetectorService.THRESHOLD_PERCENT));
        assertThat(AnomalyDetectorService.saturate(increase)).isPositive();
    }

    @Example
    void fiftyPercentIsNotAboveThreshold() {
        assertThat(AnomalyDetectorService.increasePercent(BigInteger.valueOf(100), BigInteger.valueOf(150)))
                .isEqualTo(BigInteger.valueOf(AnomalyDetectorService.THRESHOLD_PERCENT));
        assertThat(AnomalyDetectorService.increasePercent(BigInteger.valueOf(100), BigInteger.valueOf(151)))
                .isGreaterThan(BigInteger.valueOf(AnomalyDetectorService.THRESHOLD_PERCENT));
    }

    @Example
    void increaseBeyondLongRangeIsExactAndStoredCapped() {
        BigInteger wraps = AnomalyDetectorService.increasePercent(
                BigInteger.ONE, new BigInteger("138350580552821633"));
        assertThat(wraps).isEqualTo(new BigInteger("13835058055282163200"));
        assertThat(AnomalyDetectorService.saturate(wraps)).isEqualTo(Long.MAX_VALUE);

        BigInteger huge = AnomalyDetectorService.increasePercent(BigInteger.ONE, BigInteger.TEN.pow(21));
        assertThat(huge).isEqualTo(BigInteger.TEN.pow(23).subtract(BigInteger.valueOf(100)));
        assertThat(AnomalyDetectorService.saturate(huge)).isEqualTo(Long.MAX_VALUE);
    }
}
