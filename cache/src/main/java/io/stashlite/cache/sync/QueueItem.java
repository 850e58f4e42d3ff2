package io.stashlite.cache.sync;

import java.util.Comparator;
import java.util.Objects;

/**
 * One queued action plus its retry bookkeeping. Immutable; a failed attempt
 * produces a copy with retryCount + 1.
 */
public record QueueItem(
        long id,
        SyncAction action,
        int priority,
        int retryCount,
        int maxRetries,
        long enqueuedAtMillis
) {
    public static final int DEFAULT_MAX_RETRIES = 3;

    /** Drain order: higher priority first, then oldest id. */
    public static final Comparator<QueueItem> DRAIN_ORDER =
            Comparator.comparingInt(QueueItem::priority).reversed().thenComparingLong(QueueItem::id);

    public QueueItem {
        Objects.requireNonNull(action, "action");
        if (retryCount < 0) throw new IllegalArgumentException("retryCount must be >= 0");
        if (maxRetries < 1) throw new IllegalArgumentException("maxRetries must be >= 1");
    }

    public QueueItem afterFailedAttempt() {
        return new QueueItem(id, action, priority, retryCount + 1, maxRetries, enqueuedAtMillis);
    }

    public boolean exhausted() {
        return retryCount >= maxRetries;
    }
}
