// file: src/main/java/io/stashlite/core/CacheRecord.java
package io.stashlite.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable envelope for one cached entry.
 * <p>
 * Fields:
 *  - key:             unique identifier inside a store; later writes replace the record.
 *  - payload:         bytes after codec transforms (compressed and/or encrypted).
 *  - nonce:           AES-GCM nonce, present iff encrypted.
 *  - createdAtMillis: wall-clock time of the write.
 *  - ttlMillis:       lifetime; the record is expired once now - createdAt >= ttl.
 *  - typeTag:         free-form category used for selective cleanup only.
 *  - compressed / encrypted: which codec steps were applied, so a reader never guesses.
 *  - sizeBytes:       payload length, fixed at construction and used for quota accounting.
 * <p>
 * Invariants:
 *  - All fields are immutable; a write to an existing key builds a new record.
 *  - Defensive copies of the byte arrays are taken on input and output.
 */
public final class CacheRecord {
    private final String key;
    private final byte[] payload;
    private final byte[] nonce;
    private final long createdAtMillis;
    private final long ttlMillis;
    private final String typeTag;
    private final boolean compressed;
    private final boolean encrypted;
    private final int sizeBytes;

    public CacheRecord(
            String key,
            byte[] payload,
            byte[] nonce,
            long createdAtMillis,
            long ttlMillis,
            String typeTag,
            boolean compressed,
            boolean encrypted
    ) {
        this.key = Objects.requireNonNull(key, "key");
        Objects.requireNonNull(payload, "payload");
        if (key.isEmpty()) throw new IllegalArgumentException("key must not be empty");
        if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
        if (encrypted && nonce == null) throw new IllegalArgumentException("encrypted record requires a nonce");

        this.payload = Arrays.copyOf(payload, payload.length);
        this.nonce = nonce == null ? null : Arrays.copyOf(nonce, nonce.length);
        this.createdAtMillis = createdAtMillis;
        this.ttlMillis = ttlMillis;
        this.typeTag = typeTag == null ? CacheOptions.DEFAULT_TYPE_TAG : typeTag;
        this.compressed = compressed;
        this.encrypted = encrypted;
        this.sizeBytes = payload.length;
    }

    public String key() { return key; }

    public byte[] payload() { return Arrays.copyOf(payload, payload.length); }

    public byte[] nonce() { return nonce == null ? null : Arrays.copyOf(nonce, nonce.length); }

    public long createdAtMillis() { return createdAtMillis; }

    public long ttlMillis() { return ttlMillis; }

    public String typeTag() { return typeTag; }

    public boolean compressed() { return compressed; }

    public boolean encrypted() { return encrypted; }

    public int sizeBytes() { return sizeBytes; }

    /** Expiry is inclusive: a record read exactly ttl millis after its write is gone. */
    public boolean isExpired(long nowMillis) {
        return nowMillis - createdAtMillis >= ttlMillis;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheRecord other)) return false;
        return createdAtMillis == other.createdAtMillis
                && ttlMillis == other.ttlMillis
                && compressed == other.compressed
                && encrypted == other.encrypted
                && key.equals(other.key)
                && typeTag.equals(other.typeTag)
                && Arrays.equals(payload, other.payload)
                && Arrays.equals(nonce, other.nonce);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(key, createdAtMillis, ttlMillis, typeTag, compressed, encrypted);
        return 31 * h + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "CacheRecord{key=" + key
                + ", size=" + sizeBytes
                + ", createdAt=" + createdAtMillis
                + ", ttl=" + ttlMillis
                + ", type=" + typeTag
                + ", compressed=" + compressed
                + ", encrypted=" + encrypted + "}";
    }
}
