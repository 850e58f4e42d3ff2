// file: cache/src/main/java/io/stashlite/cache/CacheConfig.java
package io.stashlite.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.stashlite.core.CacheOptions;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings for {@link OfflineCache#open(CacheConfig, java.time.Clock)}.
 * <p>
 * Layout under dataDir:
 *  - cache/      records (WAL + snapshots)
 *  - queue/      sync queue items (WAL + snapshots)
 *  - settings/   settings and user data (WAL + snapshots)
 *  - stash.key   AES key, unless keyFile points elsewhere
 */
public record CacheConfig(
        Path dataDir,
        long quotaBytes,
        Duration defaultTtl,
        boolean compress,
        boolean encrypt,
        String typeTag,
        long walRotateBytes,
        int snapshotEveryOps,
        Path keyFile,
        Duration sweepInterval
) {
    public static final long DEFAULT_QUOTA_BYTES = QuotaManager.DEFAULT_LIMIT_BYTES;
    public static final long DEFAULT_WAL_ROTATE_BYTES = 16L * 1024 * 1024;
    public static final int DEFAULT_SNAPSHOT_EVERY_OPS = 10_000;

    public CacheConfig {
        Objects.requireNonNull(dataDir, "dataDir");
        Objects.requireNonNull(defaultTtl, "defaultTtl");
        Objects.requireNonNull(typeTag, "typeTag");
        if (quotaBytes <= 0) throw new IllegalArgumentException("quotaBytes must be > 0");
        if (defaultTtl.isNegative()) throw new IllegalArgumentException("defaultTtl must not be negative");
        if (walRotateBytes <= 0) throw new IllegalArgumentException("walRotateBytes must be > 0");
        if (snapshotEveryOps <= 0) throw new IllegalArgumentException("snapshotEveryOps must be > 0");
        if (keyFile == null) keyFile = dataDir.resolve("stash.key");
        if (sweepInterval == null) sweepInterval = Duration.ZERO;
        if (sweepInterval.isNegative()) throw new IllegalArgumentException("sweepInterval must not be negative");
    }

    public static CacheConfig defaults(Path dataDir) {
        return new CacheConfig(
                dataDir,
                DEFAULT_QUOTA_BYTES,
                CacheOptions.DEFAULT_TTL,
                true,
                true,
                CacheOptions.DEFAULT_TYPE_TAG,
                DEFAULT_WAL_ROTATE_BYTES,
                DEFAULT_SNAPSHOT_EVERY_OPS,
                null,
                Duration.ZERO
        );
    }

    /**
     * Load settings from a JSON file. Missing fields keep their defaults;
     * a relative dataDir is resolved against the file's directory.
     */
    public static CacheConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonCacheConfig cfg = mapper.readValue(path.toFile(), JsonCacheConfig.class);
            Path base = path.toAbsolutePath().getParent();
            Path dataDir = base.resolve(cfg.dataDir == null ? "stash-data" : cfg.dataDir);
            CacheConfig d = defaults(dataDir);

            return new CacheConfig(
                    dataDir,
                    cfg.quotaBytes != null ? cfg.quotaBytes : d.quotaBytes(),
                    cfg.defaultTtlMillis != null ? Duration.ofMillis(cfg.defaultTtlMillis) : d.defaultTtl(),
                    cfg.compress != null ? cfg.compress : d.compress(),
                    cfg.encrypt != null ? cfg.encrypt : d.encrypt(),
                    cfg.typeTag != null ? cfg.typeTag : d.typeTag(),
                    cfg.walRotateBytes != null ? cfg.walRotateBytes : d.walRotateBytes(),
                    cfg.snapshotEveryOps != null ? cfg.snapshotEveryOps : d.snapshotEveryOps(),
                    cfg.keyFile != null ? base.resolve(cfg.keyFile) : null,
                    cfg.sweepIntervalMillis != null ? Duration.ofMillis(cfg.sweepIntervalMillis) : d.sweepInterval()
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load CacheConfig from " + path, e);
        }
    }

    /** Options used by writes that do not pass their own. */
    public CacheOptions defaultOptions() {
        return new CacheOptions(defaultTtl, compress, encrypt, typeTag);
    }

    public Path cacheDir() {
        return dataDir.resolve("cache");
    }

    public Path queueDir() {
        return dataDir.resolve("queue");
    }

    public Path settingsDir() {
        return dataDir.resolve("settings");
    }

    public CacheConfig withQuotaBytes(long quotaBytes) {
        return new CacheConfig(dataDir, quotaBytes, defaultTtl, compress, encrypt, typeTag,
                walRotateBytes, snapshotEveryOps, keyFile, sweepInterval);
    }
}
