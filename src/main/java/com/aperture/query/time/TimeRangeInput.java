package com.aperture.query.time;

import java.time.Instant;

/**
 * Time selection as it arrives from the dashboard: either a relative look-back in hours
 * ({@code "all"} for everything), an absolute start/end pair, or nothing.
 * Values are kept as strings and validated by {@link TimeRangeResolver}.
 */
public class TimeRangeInput {

    private static final TimeRangeInput NONE = new TimeRangeInput(null, null, null);

    private final String pastHours;
    private final String startDate;
    private final String endDate;

    private TimeRangeInput(String pastHours, String startDate, String endDate) {
        this.pastHours = pastHours;
        this.startDate = startDate;
        this.endDate = endDate;
    }

    public static TimeRangeInput of(String pastHours, String startDate, String endDate) {
        return new TimeRangeInput(pastHours, startDate, endDate);
    }

    public static TimeRangeInput pastHours(long hours) {
        return new TimeRangeInput(Long.toString(hours), null, null);
    }

    public static TimeRangeInput allTime() {
        return new TimeRangeInput(TimeRangeResolver.ALL_TIME, null, null);
    }

    public static TimeRangeInput between(Instant start, Instant end) {
        return new TimeRangeInput(null, start.toString(), end.toString());
    }

    public static TimeRangeInput none() {
        return NONE;
    }

    public String getPastHours() {
        return pastHours;
    }

    public String getStartDate() {
        return startDate;
    }

    public String getEndDate() {
        return endDate;
    }

    @Override
    public String toString() {
        return "TimeRangeInput{pastHours=" + pastHours + ", startDate=" + startDate + ", endDate=" + endDate + "}";
    }
}
