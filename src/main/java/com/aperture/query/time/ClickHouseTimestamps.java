package com.aperture.query.time;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Conversions between {@link Instant} and the textual DateTime64 form the store accepts.
 */
public final class ClickHouseTimestamps {

    private static final DateTimeFormatter DATETIME64_FORMATTER =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    // ISO-8601 with 'T' or the store's space separator, optional fraction and offset
    private static final DateTimeFormatter PARSER = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart().appendLiteral('T').optionalEnd()
        .optionalStart().appendLiteral(' ').optionalEnd()
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
        .toFormatter();

    private ClickHouseTimestamps() {
    }

    public static String format(Instant instant) {
        return DATETIME64_FORMATTER.format(instant);
    }

    /**
     * Parses {@code 2024-05-01T10:00:00Z}, {@code 2024-05-01T12:00:00+02:00} and
     * {@code 2024-05-01 10:00:00[.fff]}. Values without an offset are read as UTC.
     *
     * @throws TimeRangeException if the text is not a timestamp
     */
    public static Instant parse(String text) {
        if (text == null) {
            throw new TimeRangeException("Timestamp must not be null");
        }
        try {
            TemporalAccessor parsed = PARSER.parseBest(text.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new TimeRangeException("Invalid timestamp '" + text + "'", e);
        }
    }
}
