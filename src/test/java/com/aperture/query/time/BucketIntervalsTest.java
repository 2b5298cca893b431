package com.aperture.query.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("BucketIntervals")
class BucketIntervalsTest {

    private static final Instant END = Instant.parse("2024-05-01T00:00:00Z");

    private static TimeRange last(Duration duration) {
        return new TimeRange(END.minus(duration), END);
    }

    @Test
    @DisplayName("should pick round widths close to the target bucket count")
    void shouldPickNiceWidths() {
        assertThat(BucketIntervals.forTargetBuckets(last(Duration.ofHours(1)), 60))
            .isEqualTo(BucketInterval.of(1, IntervalUnit.MINUTE));
        assertThat(BucketIntervals.forTargetBuckets(last(Duration.ofHours(24)), 60))
            .isEqualTo(BucketInterval.of(20, IntervalUnit.MINUTE));
        assertThat(BucketIntervals.forTargetBuckets(last(Duration.ofDays(7)), 100))
            .isEqualTo(BucketInterval.of(2, IntervalUnit.HOUR));
    }

    @Test
    @DisplayName("should not go below one second")
    void shouldClampToOneSecond() {
        assertThat(BucketIntervals.forTargetBuckets(last(Duration.ofSeconds(30)), 60))
            .isEqualTo(BucketInterval.of(1, IntervalUnit.SECOND));
    }

    @Test
    @DisplayName("should mirror the stock chart defaults")
    void shouldUseStockDefaults() {
        assertThat(BucketIntervals.defaultFor(last(Duration.ofMinutes(30)))).isEqualTo(BucketInterval.of(5, IntervalUnit.MINUTE));
        assertThat(BucketIntervals.defaultFor(last(Duration.ofHours(24)))).isEqualTo(BucketInterval.of(1, IntervalUnit.HOUR));
        assertThat(BucketIntervals.defaultFor(last(Duration.ofDays(3)))).isEqualTo(BucketInterval.of(1, IntervalUnit.DAY));
    }

    @Test
    @DisplayName("should round to 1, 2, 5 and 10 multiples")
    void shouldRoundNiceNumbers() {
        assertThat(BucketIntervals.niceNumber(1.2, true)).isCloseTo(1, within(1e-9));
        assertThat(BucketIntervals.niceNumber(24, true)).isCloseTo(20, within(1e-9));
        assertThat(BucketIntervals.niceNumber(45, true)).isCloseTo(50, within(1e-9));
        assertThat(BucketIntervals.niceNumber(8, true)).isCloseTo(10, within(1e-9));
    }

    @Test
    @DisplayName("should render the interval as SQL")
    void shouldRenderSql() {
        assertThat(BucketInterval.of(15, IntervalUnit.MINUTE).toSql()).isEqualTo("INTERVAL 15 MINUTE");
        assertThat(IntervalUnit.fromString("hours")).isEqualTo(IntervalUnit.HOUR);
    }
}
