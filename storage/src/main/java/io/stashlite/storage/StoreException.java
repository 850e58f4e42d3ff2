package io.stashlite.storage;

/**
 * Failure talking to a storage backend.
 * <p>
 * The cache treats WRITE_FAILED as a soft, retryable condition. The sync queue
 * surfaces it to its caller, since a lost queued action is a correctness gap.
 */
public class StoreException extends RuntimeException {

    public enum Kind {
        /** Backend could not be opened or recovered. */
        OPEN_FAILED,
        /** A mutation could not be persisted; nothing was applied. */
        WRITE_FAILED,
        /** Stored bytes for a key cannot be decoded into a record. */
        CORRUPT_RECORD
    }

    private final Kind kind;

    public StoreException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StoreException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
