package com.aperture.query.builder;

import com.aperture.query.time.BucketInterval;

import java.util.Objects;

/**
 * Groups rows into fixed-width time buckets exposed as the {@code time} column.
 * With {@code fillGaps}, empty buckets inside the time range are returned as well.
 */
public class TimeBucket {

    public static final String ALIAS = "time";

    private final BucketInterval interval;
    private final boolean fillGaps;

    public TimeBucket(BucketInterval interval, boolean fillGaps) {
        this.interval = Objects.requireNonNull(interval, "interval");
        this.fillGaps = fillGaps;
    }

    public static TimeBucket of(BucketInterval interval) {
        return new TimeBucket(interval, false);
    }

    public static TimeBucket filled(BucketInterval interval) {
        return new TimeBucket(interval, true);
    }

    public BucketInterval getInterval() {
        return interval;
    }

    public boolean isFillGaps() {
        return fillGaps;
    }
}
