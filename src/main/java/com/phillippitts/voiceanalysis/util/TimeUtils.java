package com.phillippitts.voiceanalysis.util;

/**
 * Utility methods for time conversions and countdown display.
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
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Formats whole seconds as {@code mm:ss}. Negative input renders as {@code 00:00}.
     */
    public static String formatMinutesSeconds(long totalSeconds) {
        long clamped = Math.max(0, totalSeconds);
        return String.format("%02d:%02d", clamped / 60, clamped % 60);
    }
}
