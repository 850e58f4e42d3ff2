// file: src/main/java/io/stashlite/storage/StorageBackend.java
package io.stashlite.storage;

import java.util.Collection;
import java.util.Map;

/**
 * Minimal durable byte key-value interface the cache and the sync queue are built on.
 * <p>
 * Semantics:
 *  - put() is atomic per key: a concurrent get() observes the old or the new
 *    value, never a torn one. A failed put() leaves no trace.
 *  - get() returns the latest applied value for the key, or null if absent.
 *  - delete()/deleteMany() are idempotent; deleting an absent key is not an error.
 *  - scan() returns a point-in-time view that is safe to iterate while writers run.
 */
public interface StorageBackend extends AutoCloseable {

    /**
     * Insert or replace the value for a key.
     *
     * @throws StoreException kind WRITE_FAILED if the value could not be persisted
     */
    void put(String key, byte[] value);

    /** Current value, or null if the key is absent. */
    byte[] get(String key);

    void delete(String key);

    void deleteMany(Collection<String> keys);

    /** Remove every key. */
    void clear();

    /**
     * Immutable snapshot of key -> value.
     * The value arrays are not copied; callers must treat them as read-only.
     */
    Map<String, byte[]> scan();

    @Override
    void close();
}
