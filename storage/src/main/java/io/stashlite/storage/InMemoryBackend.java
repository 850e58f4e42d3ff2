package io.stashlite.storage;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable backend: a plain concurrent map. Contents are lost on restart.
 * Used for ephemeral caches and as a lightweight backend in tests.
 */
public final class InMemoryBackend implements StorageBackend {
    private final Map<String, byte[]> mem = new ConcurrentHashMap<>();

    @Override
    public void put(String key, byte[] value) {
        Objects.requireNonNull(key, "key");
        mem.put(key, Objects.requireNonNull(value, "value").clone());
    }

    @Override
    public byte[] get(String key) {
        byte[] v = mem.get(key);
        return v == null ? null : v.clone();
    }

    @Override
    public void delete(String key) {
        mem.remove(key);
    }

    @Override
    public void deleteMany(Collection<String> keys) {
        keys.forEach(mem::remove);
    }

    @Override
    public void clear() {
        mem.clear();
    }

    @Override
    public Map<String, byte[]> scan() {
        return Map.copyOf(mem);
    }

    @Override
    public void close() {
        // nothing to release
    }
}
