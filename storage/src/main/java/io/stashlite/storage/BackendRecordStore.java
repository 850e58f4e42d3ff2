package io.stashlite.storage;

import io.stashlite.core.CacheRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * {@link RecordStore} over any {@link StorageBackend}.
 * <p>
 * Mutations are serialized on this instance, which gives one writer per key
 * and makes the compare-and-delete operations atomic. Reads go straight to
 * the backend.
 * <p>
 * Every put stamps the record with the next write sequence. The counter
 * resumes from the highest sequence found in the backend at construction.
 */
public final class BackendRecordStore implements RecordStore {
    private static final Logger log = Logger.getLogger(BackendRecordStore.class.getName());

    private final StorageBackend backend;
    private long lastWriteSeq;

    public BackendRecordStore(StorageBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
        for (RecordSummary s : scanSummaries()) {
            lastWriteSeq = Math.max(lastWriteSeq, s.writeSeq());
        }
    }

    @Override
    public synchronized void put(CacheRecord record) {
        long seq = lastWriteSeq + 1;
        backend.put(record.key(), RecordFormat.encode(record, seq));
        lastWriteSeq = seq;
    }

    @Override
    public CacheRecord get(String key) {
        byte[] bytes = backend.get(key);
        return bytes == null ? null : RecordFormat.decode(key, bytes);
    }

    @Override
    public synchronized void delete(String key) {
        backend.delete(key);
    }

    @Override
    public synchronized void deleteMany(Collection<String> keys) {
        if (keys.isEmpty()) return;
        backend.deleteMany(keys);
    }

    @Override
    public synchronized boolean deleteIfCurrent(CacheRecord expected) {
        byte[] bytes = backend.get(expected.key());
        if (bytes == null) return false;

        CacheRecord current;
        try {
            current = RecordFormat.decode(expected.key(), bytes);
        } catch (StoreException e) {
            return false;
        }
        if (!current.equals(expected)) return false;

        backend.delete(expected.key());
        return true;
    }

    @Override
    public synchronized boolean deleteIfUnchanged(RecordSummary expected) {
        byte[] bytes = backend.get(expected.key());
        if (bytes == null) return false;
        try {
            if (!RecordFormat.summary(expected.key(), bytes).equals(expected)) return false;
        } catch (StoreException e) {
            return false;
        }
        backend.delete(expected.key());
        return true;
    }

    @Override
    public synchronized boolean deleteIfCorrupt(String key) {
        byte[] bytes = backend.get(key);
        if (bytes == null) return false;
        try {
            RecordFormat.decode(key, bytes);
            return false;
        } catch (StoreException e) {
            backend.delete(key);
            return true;
        }
    }

    @Override
    public List<CacheRecord> scanAll() {
        Map<String, byte[]> raw = backend.scan();
        List<CacheRecord> out = new ArrayList<>(raw.size());
        for (Map.Entry<String, byte[]> e : raw.entrySet()) {
            try {
                out.add(RecordFormat.decode(e.getKey(), e.getValue()));
            } catch (StoreException ex) {
                log.warning("Skipping undecodable record " + e.getKey() + ": " + ex.getMessage());
            }
        }
        return out;
    }

    @Override
    public List<RecordSummary> scanSummaries() {
        Map<String, byte[]> raw = backend.scan();
        List<RecordSummary> out = new ArrayList<>(raw.size());
        for (Map.Entry<String, byte[]> e : raw.entrySet()) {
            try {
                out.add(RecordFormat.summary(e.getKey(), e.getValue()));
            } catch (StoreException ex) {
                log.warning("Skipping undecodable record " + e.getKey() + ": " + ex.getMessage());
            }
        }
        return out;
    }

    @Override
    public Set<String> keys() {
        return Set.copyOf(backend.scan().keySet());
    }

    @Override
    public synchronized void clear() {
        backend.clear();
    }
}
