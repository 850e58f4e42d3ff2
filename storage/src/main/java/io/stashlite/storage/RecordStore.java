package io.stashlite.storage;

import io.stashlite.core.CacheRecord;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Durable key -> {@link CacheRecord} storage.
 * <p>
 * This layer is a dumb store: it does not look at TTLs. Expiry is decided by
 * the cache facade, eviction by the quota manager.
 * <p>
 * Semantics:
 *  - put() replaces any existing record for the key atomically; a reader never
 *    observes a half-written record.
 *  - get() returns null when the key is absent.
 *  - delete()/deleteMany() are idempotent.
 *  - scanAll()/scanSummaries() return point-in-time snapshots and are safe to
 *    call while other threads read and write.
 */
public interface RecordStore {

    /** @throws StoreException kind WRITE_FAILED if the record was not stored */
    void put(CacheRecord record);

    /**
     * @return the record, or null if absent
     * @throws StoreException kind CORRUPT_RECORD if the stored bytes cannot be decoded
     */
    CacheRecord get(String key);

    void delete(String key);

    void deleteMany(Collection<String> keys);

    /**
     * Delete the key only if its current record is still 'expected'.
     * Lets lazy expiry and eviction act on a snapshot without removing a newer write.
     *
     * @return true if the record was deleted
     */
    boolean deleteIfCurrent(CacheRecord expected);

    /**
     * Summary form of {@link #deleteIfCurrent}: delete the key only if the
     * metadata of its current record, write sequence included, still matches
     * 'expected'. Used by eviction and purges, which work from summaries.
     *
     * @return true if the record was deleted
     */
    boolean deleteIfUnchanged(RecordSummary expected);

    /**
     * Delete the key only if its stored bytes are still undecodable.
     *
     * @return true if the entry was deleted
     */
    boolean deleteIfCorrupt(String key);

    /** All decodable records. Undecodable entries are skipped. */
    List<CacheRecord> scanAll();

    /** Metadata of all decodable records, without copying payloads. */
    List<RecordSummary> scanSummaries();

    Set<String> keys();

    void clear();
}
