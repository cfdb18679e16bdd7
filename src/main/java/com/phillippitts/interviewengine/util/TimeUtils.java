package com.phillippitts.interviewengine.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Time helpers shared by the turn pipeline and the session views.
 *
 * <p>Pipeline stages are timed with {@link System#nanoTime()}; session durations are reported
 * to callers as fractional seconds between two wall-clock instants.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private static final double MILLIS_PER_SECOND = 1000.0;

    private TimeUtils() {
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * <pre>
     * long start = System.nanoTime();
     * String text = speechToText.transcribe(segment);
     * LOG.debug("Transcribed in {} ms", TimeUtils.elapsedMillis(start));
     * </pre>
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Seconds between two instants, with millisecond precision.
     *
     * <p>For a session still running, callers pass the current clock instant as {@code end}.
     * Negative spans (clock skew) are reported as zero.
     *
     * @param start start instant (must not be null)
     * @param end end instant (must not be null)
     * @return elapsed seconds, never negative
     */
    public static double secondsBetween(Instant start, Instant end) {
        long millis = Duration.between(start, end).toMillis();
        return millis <= 0 ? 0.0 : millis / MILLIS_PER_SECOND;
    }
}
