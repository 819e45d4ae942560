package com.phillippitts.aibakeoff.util;

/**
 * Utility methods for time conversions.
 *
 * <p>Converts between nanoseconds from {@link System#nanoTime()} and the fractional
 * milliseconds reported in measurements.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to fractional milliseconds.
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds, keeping sub-millisecond precision
     */
    public static double nanosToMillis(long nanos) {
        return nanos / (double) NANOS_PER_MILLI;
    }

    /**
     * Converts fractional milliseconds back to whole nanoseconds.
     *
     * @param millis time in milliseconds
     * @return time in nanoseconds (rounded)
     */
    public static long millisToNanos(double millis) {
        return Math.round(millis * NANOS_PER_MILLI);
    }
}
