package com.example.disksight;

import java.util.Locale;

/**
 * Formats byte counts for display.
 */
public final class SizeFormatter {
    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB", "PB", "EB"};
    private static final double STEP = 1024.0;

    private SizeFormatter() {
    }

    /**
     * Returns the plain decimal byte count, or a binary-scaled string such as "1.50 KB"
     * when {@code humanReadable} is set.
     */
    public static String format(long bytes, boolean humanReadable) {
        if (!humanReadable) {
            return Long.toString(bytes);
        }
        return humanReadable(bytes);
    }

    public static String humanReadable(long bytes) {
        if (bytes < STEP) {
            return bytes + " B";
        }
        double value = bytes;
        int unit = 0;
        while (value >= STEP && unit < UNITS.length - 1) {
            value /= STEP;
            unit++;
        }
        // 1048575 B is 1023.999 KB, which prints as 1024.00 KB
        if (Math.round(value * 100.0) >= STEP * 100.0 && unit < UNITS.length - 1) {
            value /= STEP;
            unit++;
        }
        return String.format(Locale.ROOT, "%.2f %s", value, UNITS[unit]);
    }
}
