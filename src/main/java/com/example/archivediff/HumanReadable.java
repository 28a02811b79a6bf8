package com.example.archivediff;

import java.time.Duration;
import java.util.Locale;

/**
 * Display formatting for byte counts and durations.
 */
public final class HumanReadable {
    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private HumanReadable() {
    }

    /**
     * Formats a byte count with two decimals using 1024 steps, e.g. {@code 1.50 KB}.
     */
    public static String size(double bytes) {
        double value = bytes;
        int unit = 0;
        while (value >= 1024.0 && unit < UNITS.length - 1) {
            value /= 1024.0;
            unit++;
        }
        return String.format(Locale.ROOT, "%.2f %s", value, UNITS[unit]);
    }

    /**
     * Formats a duration as {@code 1h 2m 3s}.
     */
    public static String duration(Duration duration) {
        long seconds = Math.max(0L, duration.getSeconds());
        return String.format(Locale.ROOT, "%dh %dm %ds", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
