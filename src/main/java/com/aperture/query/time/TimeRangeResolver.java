package com.aperture.query.time;

import com.aperture.query.ParameterSet;
import com.aperture.query.SqlCondition;
import com.aperture.schema.DbType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Turns dashboard time selections into concrete {@code [start, end)} ranges and the
 * matching bound predicates.
 */
@Component
public class TimeRangeResolver {

    private static final Logger logger = LoggerFactory.getLogger(TimeRangeResolver.class);

    public static final String ALL_TIME = "all";
    public static final String START_PARAMETER = "start_time";
    public static final String END_PARAMETER = "end_time";

    private final Clock clock;

    public TimeRangeResolver(Clock clock) {
        this.clock = clock;
    }

    /**
     * Strict resolution: relative and absolute inputs are mutually exclusive, an absolute
     * range needs both bounds with {@code start < end}. Without input the last
     * {@code defaultHours} hours are used.
     *
     * @throws TimeRangeException when the input is contradictory or malformed
     */
    public TimeRange resolve(TimeRangeInput input, long defaultHours) {
        TimeRangeInput value = input != null ? input : TimeRangeInput.none();
        boolean relative = hasText(value.getPastHours());
        boolean absolute = hasText(value.getStartDate()) || hasText(value.getEndDate());

        if (relative && absolute) {
            throw new TimeRangeException("Specify either pastHours or startDate/endDate, not both");
        }
        if (absolute) {
            if (!hasText(value.getStartDate()) || !hasText(value.getEndDate())) {
                throw new TimeRangeException("Both startDate and endDate are required for an absolute range");
            }
            Instant start = ClickHouseTimestamps.parse(value.getStartDate());
            Instant end = ClickHouseTimestamps.parse(value.getEndDate());
            if (!start.isBefore(end)) {
                throw new TimeRangeException("startDate must be before endDate");
            }
            return new TimeRange(start, end);
        }

        Instant now = clock.instant();
        if (relative) {
            String pastHours = value.getPastHours().trim();
            if (ALL_TIME.equalsIgnoreCase(pastHours)) {
                return TimeRange.ALL_TIME;
            }
            return lookBack(now, parseHours(pastHours));
        }
        if (defaultHours <= 0) {
            throw new TimeRangeException("A time range is required");
        }
        logger.debug("No time range given, defaulting to the last {} hours", defaultHours);
        return lookBack(now, defaultHours);
    }

    /**
     * Range selection from a chart drag: the two points may arrive in either order.
     */
    public TimeRange normalizeForZoom(Instant first, Instant second) {
        if (first == null || second == null) {
            throw new TimeRangeException("Both zoom bounds are required");
        }
        if (first.equals(second)) {
            throw new TimeRangeException("Zoom range must not be empty");
        }
        return first.isBefore(second) ? new TimeRange(first, second) : new TimeRange(second, first);
    }

    /**
     * @return {@code expression >= :start_time AND expression < :end_time} with DateTime64 parameters
     */
    public SqlCondition toCondition(TimeRange range, String expression) {
        ParameterSet parameters = new ParameterSet();
        parameters.add(START_PARAMETER, ClickHouseTimestamps.format(range.getStart()), DbType.DATETIME64);
        parameters.add(END_PARAMETER, ClickHouseTimestamps.format(range.getEnd()), DbType.DATETIME64);
        String sql = expression + " >= :" + START_PARAMETER + " AND " + expression + " < :" + END_PARAMETER;
        return new SqlCondition(sql, parameters.asMap());
    }

    private TimeRange lookBack(Instant now, long hours) {
        // 'all' is the widest range; nothing may reach further back
        long maxHours = Duration.between(TimeRange.ALL_TIME.getStart(), now).toHours();
        if (hours > maxHours) {
            throw new TimeRangeException("pastHours reaches before " + TimeRange.ALL_TIME.getStart()
                + ": at most " + maxHours + " hours, got " + hours);
        }
        return new TimeRange(now.minus(Duration.ofHours(hours)), now);
    }

    private long parseHours(String pastHours) {
        long hours;
        try {
            hours = Long.parseLong(pastHours);
        } catch (NumberFormatException e) {
            throw new TimeRangeException("pastHours must be a whole number of hours or 'all': " + pastHours, e);
        }
        if (hours <= 0) {
            throw new TimeRangeException("pastHours must be positive: " + pastHours);
        }
        return hours;
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
