package com.phillippitts.affectsignal.util;

/**
 * Elapsed-time helpers for {@link System#nanoTime()} based measurements.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }
}
