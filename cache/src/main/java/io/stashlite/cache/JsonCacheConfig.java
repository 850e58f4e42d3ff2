package io.stashlite.cache;

/** JSON shape of a cache config file. Absent fields stay null and fall back to defaults. */
public class JsonCacheConfig {
    public String dataDir;
    public Long quotaBytes;
    public Long defaultTtlMillis;
    public Boolean compress;
    public Boolean encrypt;
    public String typeTag;
    public Long walRotateBytes;
    public Integer snapshotEveryOps;
    public String keyFile;
    public Long sweepIntervalMillis;
}
