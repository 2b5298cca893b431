package com.aperture.query.time;

import java.time.Duration;
import java.util.Objects;

/**
 * Width of a time bucket, e.g. 5 MINUTE.
 */
public class BucketInterval {

    private final long value;
    private final IntervalUnit unit;

    public BucketInterval(long value, IntervalUnit unit) {
        if (value <= 0) {
            throw new IllegalArgumentException("Bucket interval must be positive: " + value);
        }
        this.value = value;
        this.unit = Objects.requireNonNull(unit, "unit");
    }

    public static BucketInterval of(long value, IntervalUnit unit) {
        return new BucketInterval(value, unit);
    }

    public long getValue() {
        return value;
    }

    public IntervalUnit getUnit() {
        return unit;
    }

    public Duration toDuration() {
        return Duration.ofSeconds(value * unit.getSeconds());
    }

    /**
     * @return the interval literal, e.g. {@code INTERVAL 5 MINUTE}
     */
    public String toSql() {
        return "INTERVAL " + value + " " + unit.name();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BucketInterval that = (BucketInterval) o;
        return value == that.value && unit == that.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, unit);
    }

    @Override
    public String toString() {
        return value + " " + unit;
    }
}
