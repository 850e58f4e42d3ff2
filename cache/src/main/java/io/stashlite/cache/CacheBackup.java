package io.stashlite.cache;

import com.fasterxml.jackson.databind.JsonNode;
import io.stashlite.core.CacheRecord;

import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Portable copy of every stored record and setting, as JSON.
 * <p>
 * Payloads are exported exactly as stored (still compressed and encrypted),
 * base64-encoded, so a backup only restores into a cache that holds the same key.
 * Settings are plain JSON values.
 */
public record CacheBackup(
        int version,
        long exportedAtMillis,
        List<Entry> records,
        Map<String, JsonNode> settings
) {
    public static final int VERSION = 1;

    public record Entry(
            String key,
            String payloadBase64,
            String nonceBase64,
            long createdAtMillis,
            long ttlMillis,
            String typeTag,
            boolean compressed,
            boolean encrypted
    ) {
        static Entry of(CacheRecord r) {
            Base64.Encoder b64 = Base64.getEncoder();
            byte[] nonce = r.nonce();
            return new Entry(
                    r.key(),
                    b64.encodeToString(r.payload()),
                    nonce == null ? null : b64.encodeToString(nonce),
                    r.createdAtMillis(),
                    r.ttlMillis(),
                    r.typeTag(),
                    r.compressed(),
                    r.encrypted()
            );
        }

        CacheRecord toRecord() {
            if (key == null || key.isEmpty()) throw new IllegalArgumentException("entry without key");
            if (payloadBase64 == null) throw new IllegalArgumentException("entry " + key + " has no payloadBase64");
            if (encrypted && nonceBase64 == null) throw new IllegalArgumentException("entry " + key + " is encrypted but has no nonceBase64");
            Base64.Decoder b64 = Base64.getDecoder();
            return new CacheRecord(
                    key,
                    b64.decode(payloadBase64),
                    nonceBase64 == null ? null : b64.decode(nonceBase64),
                    createdAtMillis,
                    ttlMillis,
                    typeTag,
                    compressed,
                    encrypted
            );
        }
    }

    public CacheBackup {
        // Null entries are kept so toRecords() can reject them instead of failing here.
        records = records == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(records));
        settings = settings == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(settings));
    }

    public static CacheBackup of(List<CacheRecord> records, Map<String, JsonNode> settings, long nowMillis) {
        List<Entry> entries = new ArrayList<>(records.size());
        for (CacheRecord r : records) entries.add(Entry.of(r));
        return new CacheBackup(VERSION, nowMillis, entries, settings);
    }

    /**
     * Records ordered oldest first, so restoring them in this order keeps
     * their relative age for eviction.
     *
     * @throws IllegalArgumentException if the version is unknown or an entry is
     *                                  malformed (missing key or payload, bad base64,
     *                                  negative ttl)
     */
    public List<CacheRecord> toRecords() {
        if (version != VERSION) throw new IllegalArgumentException("Unsupported backup version: " + version);
        List<CacheRecord> out = new ArrayList<>(records.size());
        for (Entry e : records) {
            if (e == null) throw new IllegalArgumentException("null backup entry");
            out.add(e.toRecord());
        }
        out.sort(Comparator.comparingLong(CacheRecord::createdAtMillis));
        return out;
    }

    /** @throws IllegalArgumentException if a setting has an empty key */
    public Map<String, JsonNode> validSettings() {
        for (String key : settings.keySet()) {
            if (key.isEmpty()) throw new IllegalArgumentException("setting without key");
        }
        return settings;
    }
}
