package io.stashlite.cache.sync;

import java.util.List;

/** Result of one {@link SyncQueue#drain} pass. */
public record DrainReport(
        List<QueueItem> succeeded,
        List<QueueItem> retried,
        List<FailedItem> permanentlyFailed
) {
    /** An item dropped after its last allowed attempt. */
    public record FailedItem(QueueItem item, String lastError) {}

    public DrainReport {
        succeeded = List.copyOf(succeeded);
        retried = List.copyOf(retried);
        permanentlyFailed = List.copyOf(permanentlyFailed);
    }

    public int attempted() {
        return succeeded.size() + retried.size() + permanentlyFailed.size();
    }
}
