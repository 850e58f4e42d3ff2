package io.stashlite.core.codec;

import javax.crypto.SecretKey;

/**
 * Source of the symmetric key used for all encrypted records.
 * <p>
 * Contract:
 *  - getOrCreateKey() returns the same key for the lifetime of an installation;
 *    the first call generates and persists one if none exists.
 *  - setKey() replaces the key. Records sealed with the previous key become
 *    unreadable, which the cache treats as misses.
 *  - Key material is stored outside the record store.
 */
public interface KeyProvider {

    SecretKey getOrCreateKey();

    void setKey(SecretKey key);
}
