package io.stashlite.core.codec;

import javax.crypto.SecretKey;
import java.util.Objects;

/** Process-local key, lost on restart. Suitable for ephemeral caches and tests. */
public final class InMemoryKeyProvider implements KeyProvider {
    private SecretKey key;

    public InMemoryKeyProvider() {
    }

    public InMemoryKeyProvider(SecretKey key) {
        this.key = Objects.requireNonNull(key, "key");
    }

    @Override
    public synchronized SecretKey getOrCreateKey() {
        if (key == null) {
            key = AesGcm.generateKey();
        }
        return key;
    }

    @Override
    public synchronized void setKey(SecretKey key) {
        this.key = Objects.requireNonNull(key, "key");
    }
}
