package de.bsommerfeld.patchfetcher.core.util;

import java.util.Locale;

/**
 * Formats byte sizes into human-readable strings.
 */
public final class ByteFormatter {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};
    private static final long MEGABYTE = 1024L * 1024;

    private ByteFormatter() {}

    /**
     * Formats a byte count as a human-readable string (e.g. "14.3 MB").
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
     * Formats a byte count in megabytes with grouping, as used by the size
     * estimate report (e.g. {@code "1,280.00 MB"}).
     */
    public static String formatMegabytes(long bytes) {
        return String.format(Locale.ROOT, "%,.2f MB", (double) bytes / MEGABYTE);
    }
}
