package de.bsommerfeld.toolvault.core.util;

import java.util.Locale;

/**
 * Byte count helpers for progress details and archive size reporting.
 */
public final class ByteFormatter {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};
    private static final double MEBIBYTE = 1024.0 * 1024.0;

    private ByteFormatter() {
    }

    /**
     * Formats a byte count as a human-readable string (e.g. "14.3 MB").
     * Negative values mean "unknown" and render as {@code "? B"}.
     */
    public static String format(long bytes) {
        if (bytes < 0) return "? B";

        double value = bytes;
        int unitIdx = 0;
        while (value >= 1024 && unitIdx < UNITS.length - 1) {
            value /= 1024;
            unitIdx++;
        }

        if (unitIdx == 0) return bytes + " B";
        return String.format(Locale.ROOT, "%.1f %s", value, UNITS[unitIdx]);
    }

    /**
     * Formats a transfer as {@code "done / total"}, or just {@code "done"} when
     * the total is unknown.
     */
    public static String formatProgress(long done, long total) {
        String detail = format(done);
        return total > 0 ? detail + " / " + format(total) : detail;
    }

    /** Converts bytes to mebibytes, rounded to two decimals. */
    public static double toMegabytes(long bytes) {
        return Math.round(bytes / MEBIBYTE * 100.0) / 100.0;
    }
}
