package io.stashlite.core.codec;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * AES-256-GCM authenticated encryption.
 * <p>
 * Every call to {@link #encrypt} draws a fresh 96-bit random nonce. The
 * 128-bit tag is appended to the ciphertext by the JCE provider, so any
 * bit flip, wrong key or wrong nonce makes {@link #decrypt} throw
 * {@link CodecException.Kind#AUTHENTICATION_FAILED}.
 */
public final class AesGcm {
    public static final int KEY_BYTES = 32;
    public static final int NONCE_BYTES = 12;
    private static final int TAG_BITS = 128;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private static final SecureRandom RANDOM = new SecureRandom();

    /** Ciphertext (with tag) plus the nonce needed to open it. */
    public record Sealed(byte[] ciphertext, byte[] nonce) {}

    private AesGcm() {
        // utility
    }

    public static Sealed encrypt(byte[] plaintext, SecretKey key) {
        byte[] nonce = new byte[NONCE_BYTES];
        RANDOM.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            return new Sealed(cipher.doFinal(plaintext), nonce);
        } catch (GeneralSecurityException e) {
            throw new CodecException(CodecException.Kind.ENCRYPTION, "AES-GCM encryption failed", e);
        }
    }

    public static byte[] decrypt(byte[] ciphertext, byte[] nonce, SecretKey key) {
        if (nonce == null || nonce.length != NONCE_BYTES) {
            throw new CodecException(CodecException.Kind.AUTHENTICATION_FAILED, "missing or malformed nonce");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            return cipher.doFinal(ciphertext);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new CodecException(CodecException.Kind.AUTHENTICATION_FAILED, "AES-GCM authentication failed", e);
        }
    }

    public static SecretKey generateKey() {
        try {
            KeyGenerator gen = KeyGenerator.getInstance("AES");
            gen.init(KEY_BYTES * 8, RANDOM);
            return gen.generateKey();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES key generation unavailable", e);
        }
    }

    public static SecretKey keyFromBytes(byte[] raw) {
        if (raw == null || raw.length != KEY_BYTES) {
            throw new IllegalArgumentException("AES key must be " + KEY_BYTES + " bytes");
        }
        return new SecretKeySpec(raw, "AES");
    }
}
