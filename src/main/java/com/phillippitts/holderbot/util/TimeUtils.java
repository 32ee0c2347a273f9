package com.phillippitts.holderbot.util;

/**
 * Elapsed time helpers for {@link System#nanoTime()} based timing.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    /**
     * Elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos, never negative
     */
    public static long elapsedMillis(long startNanos) {
        return Math.max(0L, (System.nanoTime() - startNanos) / NANOS_PER_MILLI);
    }

    /**
     * Elapsed nanoseconds since a nanosecond timestamp, for Micrometer timers.
     */
    public static long elapsedNanos(long startNanos) {
        return Math.max(0L, System.nanoTime() - startNanos);
    }
}
