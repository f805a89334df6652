package io.fullerstack.perf.core.util;

import lombok.experimental.UtilityClass;

/**
 * Time-unit conversions used at the boundaries where ticks and durations enter
 * the monitor.
 */
@UtilityClass
public class FrameTimes {

    private static final double MILLIS_PER_SECOND = 1_000.0;
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    public static double millisToSeconds(double millis) {
        return millis / MILLIS_PER_SECOND;
    }

    public static double nanosToSeconds(long nanos) {
        return nanos / NANOS_PER_SECOND;
    }

    /**
     * @return true for finite, non-negative durations
     */
    public static boolean isValidDuration(double durationMs) {
        return Double.isFinite(durationMs) && durationMs >= 0.0;
    }
}
