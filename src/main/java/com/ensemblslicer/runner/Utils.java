package com.ensemblslicer.runner;

import java.time.Duration;

/**
 * Utility class for small naming and formatting helpers.
 *
 * @author Data Slicer Runner Team
 * @since 1.0
 */
public class Utils {
    private Utils() {}

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/\\\\:\\s]", "_");
    }

    /**
     * Formats a duration as seconds with millisecond precision, e.g. {@code 12.345s}.
     */
    public static String formatDuration(Duration d) {
        if (d == null) return "?";
        long ms = d.toMillis();
        return String.format(java.util.Locale.ROOT, "%d.%03ds", ms / 1000, Math.abs(ms % 1000));
    }
}
