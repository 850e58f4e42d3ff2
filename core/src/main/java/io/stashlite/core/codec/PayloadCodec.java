package io.stashlite.core.codec;

import io.stashlite.core.CacheRecord;

import java.util.Objects;

/**
 * Applies the codec pipeline to cache payloads.
 * <p>
 * Order is fixed:
 *   write: compress -> encrypt
 *   read:  decrypt  -> decompress
 * The flags stored on each record say which steps ran, so decode never guesses.
 */
public final class PayloadCodec {
    private final KeyProvider keys;

    public PayloadCodec(KeyProvider keys) {
        this.keys = Objects.requireNonNull(keys, "keys");
    }

    /** Result of the write-side pipeline. nonce is null unless encrypted. */
    public record Encoded(byte[] payload, byte[] nonce, boolean compressed, boolean encrypted) {}

    public Encoded encode(byte[] raw, boolean compress, boolean encrypt) {
        Objects.requireNonNull(raw, "raw");
        byte[] data = compress ? Compression.compress(raw) : raw;
        if (!encrypt) {
            return new Encoded(data, null, compress, false);
        }
        AesGcm.Sealed sealed = AesGcm.encrypt(data, keys.getOrCreateKey());
        return new Encoded(sealed.ciphertext(), sealed.nonce(), compress, true);
    }

    public byte[] decode(byte[] payload, byte[] nonce, boolean compressed, boolean encrypted) {
        byte[] data = encrypted
                ? AesGcm.decrypt(payload, nonce, keys.getOrCreateKey())
                : payload;
        return compressed ? Compression.decompress(data) : data;
    }

    public byte[] decode(CacheRecord record) {
        return decode(record.payload(), record.nonce(), record.compressed(), record.encrypted());
    }
}
