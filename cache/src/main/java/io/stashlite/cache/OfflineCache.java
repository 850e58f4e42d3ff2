// file: cache/src/main/java/io/stashlite/cache/OfflineCache.java
package io.stashlite.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stashlite.cache.sync.DrainReport;
import io.stashlite.cache.sync.QueueException;
import io.stashlite.cache.sync.QueueItem;
import io.stashlite.cache.sync.SyncAction;
import io.stashlite.cache.sync.SyncQueue;
import io.stashlite.cache.sync.SyncTransport;
import io.stashlite.core.CacheOptions;
import io.stashlite.core.CacheRecord;
import io.stashlite.core.codec.CodecException;
import io.stashlite.core.codec.FileKeyProvider;
import io.stashlite.core.codec.PayloadCodec;
import io.stashlite.storage.BackendRecordStore;
import io.stashlite.storage.DurableBackend;
import io.stashlite.storage.InMemoryBackend;
import io.stashlite.storage.RecordStore;
import io.stashlite.storage.RecordSummary;
import io.stashlite.storage.StoreException;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Offline-first cache: typed values with TTL, optional compression and
 * encryption, a storage quota, and a queue of actions to replay once online.
 * <p>
 * Contract:
 *  - Cache operations never throw. A failed write returns false; a read that
 *    hits an expired, undecodable or unauthenticated record is a miss and
 *    removes that record (unless it was rewritten meanwhile).
 *  - Queue operations do throw {@link QueueException}: losing a queued action
 *    silently is worse than telling the caller.
 *  - clear() removes cached records only; queued actions and settings are kept.
 *  - Settings are a separate key space without TTL or quota (see {@link SettingsStore}).
 * <p>
 * Values are serialized with the supplied Jackson mapper.
 */
public final class OfflineCache implements AutoCloseable {
    private static final Logger log = Logger.getLogger(OfflineCache.class.getName());

    private final RecordStore store;
    private final SyncQueue queue;
    private final SettingsStore settings;
    private final PayloadCodec codec;
    private final QuotaManager quota;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final CacheOptions defaults;
    private final AutoCloseable storeResources;

    public OfflineCache(
            RecordStore store,
            SyncQueue queue,
            PayloadCodec codec,
            QuotaManager quota,
            Clock clock,
            ObjectMapper mapper
    ) {
        this(store, queue, new SettingsStore(new InMemoryBackend(), mapper), codec, quota, clock, mapper);
    }

    public OfflineCache(
            RecordStore store,
            SyncQueue queue,
            SettingsStore settings,
            PayloadCodec codec,
            QuotaManager quota,
            Clock clock,
            ObjectMapper mapper
    ) {
        this(store, queue, settings, codec, quota, clock, mapper, CacheOptions.defaults(), () -> { });
    }

    private OfflineCache(
            RecordStore store,
            SyncQueue queue,
            SettingsStore settings,
            PayloadCodec codec,
            QuotaManager quota,
            Clock clock,
            ObjectMapper mapper,
            CacheOptions defaults,
            AutoCloseable storeResources
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.quota = Objects.requireNonNull(quota, "quota");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        this.storeResources = storeResources;
    }

    /**
     * Open a durable cache: records under config.cacheDir(), the queue under
     * config.queueDir(), settings under config.settingsDir(), the key in config.keyFile().
     *
     * @throws StoreException kind OPEN_FAILED if record or settings storage cannot be opened
     * @throws QueueException kind OPEN_FAILED if queue storage cannot be opened
     */
    public static OfflineCache open(CacheConfig config, Clock clock) {
        ObjectMapper mapper = new ObjectMapper();
        DurableBackend records = DurableBackend.open(
                config.cacheDir(), config.walRotateBytes(), config.snapshotEveryOps());
        SyncQueue queue;
        try {
            queue = SyncQueue.open(config.queueDir(), mapper, clock);
        } catch (QueueException e) {
            records.close();
            throw e;
        }
        SettingsStore settings;
        try {
            settings = SettingsStore.open(config.settingsDir(), mapper);
        } catch (StoreException e) {
            queue.close();
            records.close();
            throw e;
        }
        log.info("Opened cache at " + config.dataDir() + " (quota " + StorageUsage.formatBytes(config.quotaBytes())
                + ", " + records.size() + " records, " + queue.size() + " queued actions)");
        return new OfflineCache(
                new BackendRecordStore(records),
                queue,
                settings,
                new PayloadCodec(new FileKeyProvider(config.keyFile())),
                new QuotaManager(config.quotaBytes(), clock),
                clock,
                mapper,
                config.defaultOptions(),
                records
        );
    }

    // ---------- cache ----------

    public boolean set(String key, Object value) {
        return set(key, value, defaults);
    }

    public boolean set(String key, Object value, CacheOptions options) {
        byte[] json;
        try {
            json = mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            log.log(Level.WARNING, "Cannot serialize value for " + key, e);
            return false;
        }
        return setBytes(key, json, options);
    }

    /** Store raw bytes. Read back with {@link #getBytes}. */
    public boolean setBytes(String key, byte[] value, CacheOptions options) {
        if (key == null || key.isEmpty()) {
            log.warning("Rejected write with empty key");
            return false;
        }
        try {
            PayloadCodec.Encoded enc = codec.encode(value, options.compress(), options.encrypt());
            CacheRecord record = new CacheRecord(
                    key,
                    enc.payload(),
                    enc.nonce(),
                    clock.millis(),
                    options.ttl().toMillis(),
                    options.typeTag(),
                    enc.compressed(),
                    enc.encrypted()
            );
            store.put(record);
        } catch (CodecException | StoreException e) {
            log.log(Level.WARNING, "Cache write failed for " + key, e);
            return false;
        }

        try {
            quota.checkAndEvict(store);
        } catch (StoreException e) {
            // The write itself is durable; the next write retries eviction.
            log.log(Level.WARNING, "Eviction after write of " + key + " failed", e);
        }
        return true;
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key, mapper.constructType(type));
    }

    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return get(key, mapper.getTypeFactory().constructType(type));
    }

    private <T> Optional<T> get(String key, JavaType type) {
        Optional<byte[]> raw = getBytes(key);
        if (raw.isEmpty()) return Optional.empty();
        try {
            return Optional.ofNullable(mapper.readValue(raw.get(), type));
        } catch (IOException e) {
            // The record is intact; the caller asked for the wrong shape. Keep it.
            log.warning("Cached value for " + key + " does not map to " + type + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    /** Decoded bytes of a live record, or empty on miss. */
    public Optional<byte[]> getBytes(String key) {
        if (key == null || key.isEmpty()) return Optional.empty();

        CacheRecord record;
        try {
            record = store.get(key);
        } catch (StoreException e) {
            if (e.kind() == StoreException.Kind.CORRUPT_RECORD) {
                log.warning("Dropping corrupt record " + key + ": " + e.getMessage());
                quietly(() -> store.deleteIfCorrupt(key), key);
            } else {
                log.log(Level.WARNING, "Cache read failed for " + key, e);
            }
            return Optional.empty();
        }
        if (record == null) return Optional.empty();

        if (record.isExpired(clock.millis())) {
            quietly(() -> store.deleteIfCurrent(record), key);
            return Optional.empty();
        }

        try {
            return Optional.of(codec.decode(record));
        } catch (CodecException e) {
            log.warning("Dropping undecodable record " + key + " (" + e.kind() + "): " + e.getMessage());
            quietly(() -> store.deleteIfCurrent(record), key);
            return Optional.empty();
        }
    }

    /** Idempotent; failures are logged. */
    public void remove(String key) {
        if (key == null || key.isEmpty()) return;
        quietly(() -> store.delete(key), key);
    }

    /** Remove every cached record. The sync queue is not touched. */
    public void clear() {
        try {
            store.clear();
            log.info("Cache cleared");
        } catch (StoreException e) {
            log.log(Level.WARNING, "Cache clear failed", e);
        }
    }

    /** Every stored key, live or not yet purged. */
    public Set<String> keys() {
        return store.keys();
    }

    public StorageUsage usage() {
        return quota.usage(store);
    }

    /** @return how many expired records were removed */
    public int purgeExpired() {
        long now = clock.millis();
        int purged = 0;
        for (RecordSummary s : store.scanSummaries()) {
            if (s.isExpired(now) && deleteUnchanged(s)) purged++;
        }
        if (purged > 0) log.info("Purged " + purged + " expired records");
        return purged;
    }

    /** Remove all records carrying the given type tag. */
    public int removeByType(String typeTag) {
        int removed = 0;
        for (RecordSummary s : store.scanSummaries()) {
            if (s.typeTag().equals(typeTag) && deleteUnchanged(s)) removed++;
        }
        if (removed > 0) log.info("Removed " + removed + " records of type " + typeTag);
        return removed;
    }

    // ---------- settings ----------

    /** Store a setting (no TTL, not counted against the quota). */
    public boolean setSetting(String key, Object value) {
        return settings.put(key, value);
    }

    public <T> T getSetting(String key, Class<T> type, T defaultValue) {
        return settings.get(key, mapper.constructType(type), defaultValue);
    }

    public <T> T getSetting(String key, TypeReference<T> type, T defaultValue) {
        return settings.get(key, mapper.getTypeFactory().constructType(type), defaultValue);
    }

    public void removeSetting(String key) {
        settings.remove(key);
    }

    public Set<String> settingKeys() {
        return settings.keys();
    }

    // ---------- backup ----------

    public CacheBackup exportBackup() {
        return CacheBackup.of(store.scanAll(), settings.snapshot(), clock.millis());
    }

    /**
     * Replace the cache records and settings with the backup's. Queued actions
     * are kept. The quota is enforced once the records are in.
     *
     * @return number of records restored, or -1 if the backup could not be applied
     */
    public int importBackup(CacheBackup backup) {
        if (backup == null) return -1;
        List<CacheRecord> records;
        Map<String, JsonNode> restoredSettings;
        try {
            records = backup.toRecords();
            restoredSettings = backup.validSettings();
        } catch (IllegalArgumentException e) {
            log.warning("Rejected backup: " + e.getMessage());
            return -1;
        }
        try {
            store.clear();
            for (CacheRecord r : records) store.put(r);
            settings.replaceAll(restoredSettings);
        } catch (StoreException | IOException e) {
            log.log(Level.WARNING, "Backup import failed", e);
            return -1;
        }
        log.info("Imported " + records.size() + " records and " + restoredSettings.size() + " settings from backup");

        try {
            quota.checkAndEvict(store);
        } catch (StoreException e) {
            log.log(Level.WARNING, "Eviction after backup import failed", e);
        }
        return records.size();
    }

    // ---------- sync queue ----------

    public QueueItem queueAction(SyncAction action, int priority) {
        return queue.enqueue(action, priority);
    }

    public QueueItem queueAction(SyncAction action, int priority, int maxRetries) {
        return queue.enqueue(action, priority, maxRetries);
    }

    public DrainReport flushQueue(SyncTransport transport) {
        return queue.drain(transport);
    }

    public List<QueueItem> pendingActions() {
        return queue.pending();
    }

    @Override
    public void close() {
        queue.close();
        settings.close();
        try {
            storeResources.close();
        } catch (Exception e) {
            log.log(Level.WARNING, "Closing record storage failed", e);
        }
    }

    // ---------- internals ----------

    private boolean deleteUnchanged(RecordSummary s) {
        try {
            return store.deleteIfUnchanged(s);
        } catch (StoreException e) {
            log.log(Level.WARNING, "Cannot delete " + s.key(), e);
            return false;
        }
    }

    private static void quietly(Runnable deletion, String key) {
        try {
            deletion.run();
        } catch (StoreException e) {
            log.log(Level.WARNING, "Cannot delete " + key, e);
        }
    }
}
