package io.stashlite.cache;

import java.util.List;

/**
 * Outcome of one {@link QuotaManager#checkAndEvict} call.
 *
 * @param evictedKeys    keys removed, oldest first
 * @param bytesFreed     payload bytes released
 * @param usageAfter     live bytes once eviction stopped
 * @param limitBytes     configured limit
 */
public record EvictionReport(
        List<String> evictedKeys,
        long bytesFreed,
        long usageAfter,
        long limitBytes
) {
    public EvictionReport {
        evictedKeys = List.copyOf(evictedKeys);
    }

    public static EvictionReport none(long usage, long limit) {
        return new EvictionReport(List.of(), 0L, usage, limit);
    }

    public boolean evicted() {
        return !evictedKeys.isEmpty();
    }
}
