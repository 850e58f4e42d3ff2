package io.stashlite.cache;

import java.util.Locale;

/**
 * Point-in-time storage accounting. Only live (non-expired) records count
 * toward the quota; expired ones are reported separately until they are purged.
 */
public record StorageUsage(
        long liveBytes,
        int liveCount,
        long expiredBytes,
        int expiredCount,
        long limitBytes
) {

    public long totalBytes() {
        return liveBytes + expiredBytes;
    }

    public boolean overLimit() {
        return liveBytes > limitBytes;
    }

    /** Live bytes in human units, e.g. "1.50 MB". */
    public String formatted() {
        return formatBytes(liveBytes);
    }

    public static String formatBytes(long bytes) {
        if (bytes <= 0) return "0 B";
        String[] units = {"B", "KB", "MB", "GB"};
        int unit = 0;
        double value = bytes;
        while (value >= 1024 && unit < units.length - 1) {
            value /= 1024;
            unit++;
        }
        if (unit == 0) return bytes + " B";
        return String.format(Locale.ROOT, "%.2f %s", value, units[unit]);
    }
}
