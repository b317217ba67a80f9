package me.bihan.torrentbot.util;

/**
 * Formatting helpers for log output.
 */
public final class FormatUtils {

    private FormatUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Format bytes in a human-readable format.
     * @param bytes Number of bytes to format
     * @return Formatted string (e.g., "1.5 MB", "256 KB", "42 B")
     */
    public static String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        } else if (bytes < 1024 * 1024) {
            return String.format("%.1f KB", bytes / 1024.0);
        } else if (bytes < 1024 * 1024 * 1024) {
            return String.format("%.1f MB", bytes / (1024.0 * 1024.0));
        } else {
            return String.format("%.1f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }

    /**
     * Shortens a magnet link or other long value for logs.
     */
    public static String abbreviate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, Math.max(0, maxLength - 3)) + "...";
    }
}
