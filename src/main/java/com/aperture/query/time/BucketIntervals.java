package com.aperture.query.time;

import java.time.Duration;

/**
 * Chooses bucket widths for time-series charts.
 */
public final class BucketIntervals {

    private BucketIntervals() {
    }

    /**
     * Picks a human-friendly width so that the range splits into roughly {@code targetBuckets}
     * buckets. Widths are 1/2/5 multiples of a power of ten in the largest unit that fits.
     */
    public static BucketInterval forTargetBuckets(TimeRange range, int targetBuckets) {
        if (targetBuckets <= 0) {
            throw new IllegalArgumentException("targetBuckets must be positive: " + targetBuckets);
        }
        double rawSeconds = range.getDuration().toMillis() / 1000.0 / targetBuckets;
        if (rawSeconds < 1) {
            return BucketInterval.of(1, IntervalUnit.SECOND);
        }

        IntervalUnit unit = IntervalUnit.SECOND;
        for (IntervalUnit candidate : IntervalUnit.values()) {
            if (rawSeconds >= candidate.getSeconds()) {
                unit = candidate;
            }
        }
        long nice = Math.round(niceNumber(rawSeconds / unit.getSeconds(), true));
        return BucketInterval.of(Math.max(1, nice), unit);
    }

    /**
     * Widths used by the stock dashboard charts.
     */
    public static BucketInterval defaultFor(TimeRange range) {
        Duration duration = range.getDuration();
        if (duration.compareTo(Duration.ofHours(1)) <= 0) {
            return BucketInterval.of(5, IntervalUnit.MINUTE);
        }
        if (duration.compareTo(Duration.ofDays(1)) <= 0) {
            return BucketInterval.of(1, IntervalUnit.HOUR);
        }
        return BucketInterval.of(1, IntervalUnit.DAY);
    }

    // Heckbert, "Nice numbers for graph labels", Graphics Gems (1990)
    static double niceNumber(double x, boolean round) {
        double exponent = Math.floor(Math.log10(x));
        double fraction = x / Math.pow(10, exponent);
        double niceFraction;
        if (round) {
            if (fraction < 1.5) {
                niceFraction = 1;
            } else if (fraction < 3) {
                niceFraction = 2;
            } else if (fraction < 7) {
                niceFraction = 5;
            } else {
                niceFraction = 10;
            }
        } else {
            if (fraction <= 1) {
                niceFraction = 1;
            } else if (fraction <= 2) {
                niceFraction = 2;
            } else if (fraction <= 5) {
                niceFraction = 5;
            } else {
                niceFraction = 10;
            }
        }
        return niceFraction * Math.pow(10, exponent);
    }
}
