package com.aperture.query.time;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Resolved half-open interval {@code [start, end)} in UTC. Always {@code start < end}.
 */
public class TimeRange {

    public static final TimeRange ALL_TIME = new TimeRange(
        Instant.parse("1970-01-01T00:00:00Z"), Instant.parse("2100-01-01T00:00:00Z"));

    private final Instant start;
    private final Instant end;

    public TimeRange(Instant start, Instant end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new TimeRangeException("Time range start " + start + " must be before end " + end);
        }
        this.start = start;
        this.end = end;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public Duration getDuration() {
        return Duration.between(start, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeRange that = (TimeRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
