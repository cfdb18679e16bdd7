package com.phillippitts.interviewengine.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void elapsedMillisIsNonNegative() {
        long start = System.nanoTime() - 5 * TimeUtils.NANOS_PER_MILLI;

        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(5L);
    }

    @Test
    void secondsBetweenUsesMillisecondPrecision() {
        assertThat(TimeUtils.secondsBetween(T0, T0.plusMillis(90_250))).isEqualTo(90.25);
        assertThat(TimeUtils.secondsBetween(T0, T0.plusNanos(999))).isEqualTo(0.0);
    }

    @Test
    void negativeSpanIsZero() {
        assertThat(TimeUtils.secondsBetween(T0, T0.minusSeconds(3))).isEqualTo(0.0);
    }
}
