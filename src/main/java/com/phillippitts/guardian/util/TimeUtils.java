package com.phillippitts.guardian.util;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Status payloads report durations as fractional seconds; these helpers keep the
 * conversion in one place.
 *
 * @since 1.0
 */
public final class TimeUtils {

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Seconds between two instants with millisecond precision.
     *
     * @param from start instant
     * @param to end instant
     * @return non-negative seconds between the instants, 0 if either is null
     */
    public static double secondsBetween(Instant from, Instant to) {
        if (from == null || to == null) {
            return 0.0;
        }
        long millis = Duration.between(from, to).toMillis();
        return Math.max(0L, millis) / 1000.0;
    }

    /**
     * Formats a duration as seconds with one decimal, for log lines.
     */
    public static String formatSeconds(Duration duration) {
        if (duration == null) {
            return "0.0s";
        }
        return String.format(Locale.ROOT, "%.1fs", duration.toMillis() / 1000.0);
    }
}
