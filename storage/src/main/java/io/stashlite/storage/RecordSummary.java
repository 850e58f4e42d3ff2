package io.stashlite.storage;

/**
 * Record metadata without the payload. Cheap to produce for every key, which
 * is what quota accounting and type-tag cleanup need.
 * <p>
 * writeSeq is assigned by the store on every put and only grows, so it orders
 * writes that share a createdAt millisecond and tells a rewrite apart from
 * the record it replaced.
 */
public record RecordSummary(
        String key,
        long createdAtMillis,
        long ttlMillis,
        String typeTag,
        int sizeBytes,
        long writeSeq
) {
    public boolean isExpired(long nowMillis) {
        return nowMillis - createdAtMillis >= ttlMillis;
    }
}
