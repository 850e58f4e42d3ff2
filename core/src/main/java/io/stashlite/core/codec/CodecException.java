package io.stashlite.core.codec;

/**
 * Raised when a payload transform cannot be applied or reversed.
 * <p>
 * Codec failures always fail closed: callers never receive partially
 * decompressed or partially decrypted bytes.
 */
public class CodecException extends RuntimeException {

    public enum Kind {
        /** Compressed stream is truncated, malformed or followed by trailing bytes. */
        COMPRESSION,
        /** Ciphertext was tampered with, or the key/nonce does not match. */
        AUTHENTICATION_FAILED,
        /** Encryption could not be performed (unusable key material). */
        ENCRYPTION
    }

    private final Kind kind;

    public CodecException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CodecException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
