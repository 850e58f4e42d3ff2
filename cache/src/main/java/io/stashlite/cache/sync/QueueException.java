package io.stashlite.cache.sync;

/** Failure of the persistent sync queue. Unlike cache failures, these reach the caller. */
public class QueueException extends RuntimeException {

    public enum Kind {
        /** Queue storage could not be opened. */
        OPEN_FAILED,
        /** An item could not be persisted; it is not queued. */
        ENQUEUE_FAILED,
        /** Another drain is already running. */
        DRAIN_IN_PROGRESS
    }

    private final Kind kind;

    public QueueException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public QueueException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
