package io.stashlite.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stashlite.storage.DurableBackend;
import io.stashlite.storage.StorageBackend;
import io.stashlite.storage.StoreException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Settings and user data that outlive the cache: plain JSON values with no
 * TTL, no quota and no codec, kept in their own backend.
 * <p>
 * Reads and writes never throw. A failed write returns false; a missing or
 * unreadable value yields the caller's default.
 */
public final class SettingsStore implements AutoCloseable {
    private static final Logger log = Logger.getLogger(SettingsStore.class.getName());

    private final StorageBackend backend;
    private final ObjectMapper mapper;

    public SettingsStore(StorageBackend backend, ObjectMapper mapper) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /** @throws StoreException kind OPEN_FAILED if the storage cannot be opened */
    public static SettingsStore open(Path dir, ObjectMapper mapper) {
        return new SettingsStore(DurableBackend.open(dir), mapper);
    }

    public boolean put(String key, Object value) {
        if (key == null || key.isEmpty()) {
            log.warning("Rejected setting with empty key");
            return false;
        }
        try {
            backend.put(key, mapper.writeValueAsBytes(value));
            return true;
        } catch (IOException | StoreException e) {
            log.log(Level.WARNING, "Cannot store setting " + key, e);
            return false;
        }
    }

    <T> T get(String key, JavaType type, T defaultValue) {
        if (key == null || key.isEmpty()) return defaultValue;
        try {
            byte[] raw = backend.get(key);
            if (raw == null) return defaultValue;
            T value = mapper.readValue(raw, type);
            return value == null ? defaultValue : value;
        } catch (IOException | StoreException e) {
            log.warning("Cannot read setting " + key + " as " + type + ": " + e.getMessage());
            return defaultValue;
        }
    }

    public void remove(String key) {
        if (key == null || key.isEmpty()) return;
        try {
            backend.delete(key);
        } catch (StoreException e) {
            log.log(Level.WARNING, "Cannot remove setting " + key, e);
        }
    }

    public Set<String> keys() {
        return Set.copyOf(backend.scan().keySet());
    }

    /** Every setting as a JSON tree, sorted by key. Unreadable values are skipped. */
    public Map<String, JsonNode> snapshot() {
        Map<String, JsonNode> out = new TreeMap<>();
        for (Map.Entry<String, byte[]> e : backend.scan().entrySet()) {
            try {
                out.put(e.getKey(), mapper.readTree(e.getValue()));
            } catch (IOException ex) {
                log.warning("Skipping unreadable setting " + e.getKey() + ": " + ex.getMessage());
            }
        }
        return out;
    }

    /**
     * Replace every setting with 'settings'.
     *
     * @throws StoreException kind WRITE_FAILED if storage rejects a write
     */
    void replaceAll(Map<String, JsonNode> settings) throws IOException {
        backend.clear();
        for (Map.Entry<String, JsonNode> e : settings.entrySet()) {
            backend.put(e.getKey(), mapper.writeValueAsBytes(e.getValue()));
        }
    }

    @Override
    public void close() {
        backend.close();
    }
}
