// file: src/main/java/io/stashlite/storage/DurableBackend.java
package io.stashlite.storage;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable byte key-value backend.
 * <p>
 * Responsibilities:
 *  - Maintain an in-memory map: key -> value bytes.
 *  - On write:
 *      1) Serialize op+seq+key+value to a WAL record.
 *      2) Append+fsync to WAL. On failure nothing is applied.
 *      3) Apply to the in-memory map (a single reference swap per key,
 *         so readers never observe a torn value).
 *      4) Rotate WAL segment if needed.
 *      5) Possibly write a full snapshot and drop the WAL it covers.
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay WAL records whose seq is newer than the snapshot, in order.
 * <p>
 * Mutations are serialized on this instance; reads are lock-free.
 */
public class DurableBackend implements StorageBackend {
    private static final Logger log = Logger.getLogger(DurableBackend.class.getName());

    public static final long DEFAULT_ROTATE_BYTES = 16L * 1024 * 1024;
    public static final int DEFAULT_SNAPSHOT_EVERY_OPS = 10_000;

    private final Map<String, byte[]> mem = new ConcurrentHashMap<>();
    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;
    private long seq;

    public DurableBackend(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy) {
        this.wal = wal;
        this.snaps = snaps;
        this.snapPolicy = snapPolicy;
        recover();
    }

    /**
     * Open (or create) a backend rooted at 'dir', with the WAL under dir/wal and
     * snapshots under dir/snap.
     *
     * @throws StoreException kind OPEN_FAILED if the directories cannot be used
     *                        or recovery fails
     */
    public static DurableBackend open(Path dir, long rotateBytes, int snapshotEveryOps) {
        try {
            var wal = new FileWal(dir.resolve("wal"), rotateBytes);
            var snaps = new FileSnapshotter(dir.resolve("snap"));
            return new DurableBackend(wal, snaps, new SnapshotPolicy(snapshotEveryOps));
        } catch (IOException e) {
            throw new StoreException(StoreException.Kind.OPEN_FAILED, "Cannot open storage at " + dir, e);
        }
    }

    public static DurableBackend open(Path dir) {
        return open(dir, DEFAULT_ROTATE_BYTES, DEFAULT_SNAPSHOT_EVERY_OPS);
    }

    @Override
    public synchronized void put(String key, byte[] value) {
        Objects.requireNonNull(key, "key");
        byte[] copy = Objects.requireNonNull(value, "value").clone();
        long next = seq + 1;

        // If the process crashes after this call returns, recovery will still see this write.
        appendOrFail(WalRecordCodec.put(next, key, copy), "put " + key);
        seq = next;
        mem.put(key, copy);
        afterWrite();
    }

    @Override
    public byte[] get(String key) {
        byte[] v = mem.get(key);
        return v == null ? null : v.clone();
    }

    @Override
    public synchronized void delete(String key) {
        if (!mem.containsKey(key)) return;
        long next = seq + 1;
        appendOrFail(WalRecordCodec.delete(next, key), "delete " + key);
        seq = next;
        mem.remove(key);
        afterWrite();
    }

    @Override
    public synchronized void deleteMany(Collection<String> keys) {
        List<String> present = new ArrayList<>();
        for (String k : keys) {
            if (mem.containsKey(k) && !present.contains(k)) present.add(k);
        }
        if (present.isEmpty()) return;

        // One fsync for the whole batch.
        var batch = new ByteArrayOutputStream();
        long next = seq;
        for (String k : present) {
            batch.writeBytes(WalRecordCodec.delete(++next, k));
        }
        appendOrFail(batch.toByteArray(), "delete " + present.size() + " keys");
        seq = next;
        present.forEach(mem::remove);
        afterWrite();
    }

    @Override
    public synchronized void clear() {
        long next = seq + 1;
        appendOrFail(WalRecordCodec.clear(next), "clear");
        seq = next;
        mem.clear();
        afterWrite();
    }

    @Override
    public Map<String, byte[]> scan() {
        return Map.copyOf(mem);
    }

    @Override
    public synchronized void close() {
        try {
            wal.close();
        } catch (IOException e) {
            log.log(Level.WARNING, "WAL close failed", e);
        }
    }

    /** Number of live keys. */
    public int size() {
        return mem.size();
    }

    private void appendOrFail(byte[] record, String what) {
        try {
            wal.append(record);
        } catch (IOException e) {
            throw new StoreException(StoreException.Kind.WRITE_FAILED, "WAL append failed: " + what, e);
        }
    }

    /**
     * Housekeeping after a durable write. The write itself already succeeded,
     * so failures here are logged and retried on the next write.
     */
    private void afterWrite() {
        try {
            wal.rotateIfNeeded();
        } catch (IOException e) {
            log.log(Level.WARNING, "WAL rotation failed", e);
        }
        if (snapPolicy.recordWrite()) {
            try {
                String id = snaps.writeSnapshot(Map.copyOf(mem), seq);
                wal.reset();
                log.fine("Wrote snapshot " + id + " at seq " + seq);
            } catch (IOException e) {
                log.log(Level.WARNING, "Snapshot at seq " + seq + " failed; WAL kept for recovery", e);
            }
        }
    }

    /**
     * Recovery procedure called from constructor:
     *  1) Seed memory from the latest snapshot (if present).
     *  2) Replay WAL records newer than the snapshot, in order.
     */
    private void recover() {
        try {
            Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
            long base = 0;
            if (loaded != null) {
                mem.putAll(loaded.data());
                base = loaded.lastSeq();
            }
            seq = base;

            int replayed = 0;
            try (Wal.WalReader r = wal.openReader()) {
                for (byte[] payload; (payload = r.next()) != null; ) {
                    WalRecordCodec.LogRecord rec = WalRecordCodec.decode(payload);
                    if (rec.seq() <= base) continue; // already in the snapshot
                    apply(rec);
                    seq = Math.max(seq, rec.seq());
                    replayed++;
                }
            }
            log.fine("Recovered " + mem.size() + " keys (snapshot seq " + base + ", replayed " + replayed + ")");
        } catch (IOException | RuntimeException e) {
            throw new StoreException(StoreException.Kind.OPEN_FAILED, "Recovery failed", e);
        }
    }

    private void apply(WalRecordCodec.LogRecord rec) {
        switch (rec.op()) {
            case PUT -> mem.put(rec.key(), rec.value());
            case DELETE -> mem.remove(rec.key());
            case CLEAR -> mem.clear();
        }
    }
}
