package io.stashlite.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-write options for the cache facade.
 *
 * Defaults: ttl 1 hour, compression and encryption on, type tag "generic".
 */
public record CacheOptions(
        Duration ttl,
        boolean compress,
        boolean encrypt,
        String typeTag
) {
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);
    public static final String DEFAULT_TYPE_TAG = "generic";

    public CacheOptions {
        Objects.requireNonNull(ttl, "ttl");
        Objects.requireNonNull(typeTag, "typeTag");
        if (ttl.isNegative()) throw new IllegalArgumentException("ttl must not be negative, got: " + ttl);
        if (typeTag.isBlank()) throw new IllegalArgumentException("typeTag must not be blank");
    }

    public static CacheOptions defaults() {
        return new CacheOptions(DEFAULT_TTL, true, true, DEFAULT_TYPE_TAG);
    }

    public static CacheOptions ttl(Duration ttl) {
        return defaults().withTtl(ttl);
    }

    public CacheOptions withTtl(Duration ttl) {
        return new CacheOptions(ttl, compress, encrypt, typeTag);
    }

    public CacheOptions withCompress(boolean compress) {
        return new CacheOptions(ttl, compress, encrypt, typeTag);
    }

    public CacheOptions withEncrypt(boolean encrypt) {
        return new CacheOptions(ttl, compress, encrypt, typeTag);
    }

    public CacheOptions withTypeTag(String typeTag) {
        return new CacheOptions(ttl, compress, encrypt, typeTag);
    }
}
