package com.quikdb.core.domain;

/**
 * Accumulator bucket granularity. A month is a fixed 30 days, not a calendar month.
 */
public enum PeriodType {
    DAY(86_400L),
    MONTH(30L * 86_400L);

    private final long lengthSeconds;

    PeriodType(long lengthSeconds) {
        this.lengthSeconds = lengthSeconds;
    }

    public long getLengthSeconds() {
        return lengthSeconds;
    }

    public long bucketOf(long epochSecond) {
        return epochSecond / lengthSeconds;
    }
}
