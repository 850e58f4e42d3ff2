// file: cache/src/main/java/io/stashlite/cache/QuotaManager.java
package io.stashlite.cache;

import io.stashlite.storage.RecordStore;
import io.stashlite.storage.RecordSummary;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Keeps a record store under a byte budget by evicting the oldest records.
 * <p>
 * Policy:
 *  - Usage is the sum of sizeBytes over live (non-expired) records.
 *  - While usage exceeds the limit: order live records by createdAt (write
 *    sequence breaks ties, so the later of two same-millisecond writes is
 *    younger), take the oldest quarter (at least one) and delete them
 *    oldest first, stopping as soon as usage fits. Repeat with a fresh scan
 *    if one cut was not enough.
 *  - Expired records are neither counted nor targeted; lazy expiry and
 *    purges remove them.
 * <p>
 * Concurrency:
 *  - One eviction runs at a time (single-flight lock).
 *  - Deletes are compare-and-delete against the scanned record, so a key
 *    rewritten during eviction keeps its newer value.
 */
public final class QuotaManager {
    private static final Logger log = Logger.getLogger(QuotaManager.class.getName());

    public static final long DEFAULT_LIMIT_BYTES = 50L * 1024 * 1024;

    private static final Comparator<RecordSummary> OLDEST_FIRST =
            Comparator.comparingLong(RecordSummary::createdAtMillis).thenComparingLong(RecordSummary::writeSeq);

    private final long limitBytes;
    private final Clock clock;
    private final ReentrantLock evictionLock = new ReentrantLock();

    public QuotaManager(long limitBytes, Clock clock) {
        if (limitBytes <= 0) throw new IllegalArgumentException("limitBytes must be > 0");
        this.limitBytes = limitBytes;
        this.clock = clock;
    }

    public QuotaManager(Clock clock) {
        this(DEFAULT_LIMIT_BYTES, clock);
    }

    public long limitBytes() {
        return limitBytes;
    }

    public EvictionReport checkAndEvict(RecordStore store) {
        evictionLock.lock();
        try {
            List<RecordSummary> live = liveRecords(store);
            long usage = sizeOf(live);
            if (usage <= limitBytes) return EvictionReport.none(usage, limitBytes);

            List<String> evicted = new ArrayList<>();
            long freed = 0;
            while (usage > limitBytes && !live.isEmpty()) {
                live.sort(OLDEST_FIRST);
                int cut = Math.max(1, live.size() / 4);
                for (RecordSummary victim : live.subList(0, cut)) {
                    if (usage <= limitBytes) break;
                    if (store.deleteIfUnchanged(victim)) {
                        evicted.add(victim.key());
                        freed += victim.sizeBytes();
                    }
                    usage -= victim.sizeBytes();
                }
                // Rescan so concurrent writes and skipped victims are accounted for.
                live = liveRecords(store);
                usage = sizeOf(live);
            }

            log.info("Evicted " + evicted.size() + " records (" + StorageUsage.formatBytes(freed)
                    + "); usage now " + StorageUsage.formatBytes(usage) + " of " + StorageUsage.formatBytes(limitBytes));
            return new EvictionReport(evicted, freed, usage, limitBytes);
        } finally {
            evictionLock.unlock();
        }
    }

    public StorageUsage usage(RecordStore store) {
        long now = clock.millis();
        long liveBytes = 0, expiredBytes = 0;
        int liveCount = 0, expiredCount = 0;
        for (RecordSummary s : store.scanSummaries()) {
            if (s.isExpired(now)) {
                expiredBytes += s.sizeBytes();
                expiredCount++;
            } else {
                liveBytes += s.sizeBytes();
                liveCount++;
            }
        }
        return new StorageUsage(liveBytes, liveCount, expiredBytes, expiredCount, limitBytes);
    }

    private List<RecordSummary> liveRecords(RecordStore store) {
        long now = clock.millis();
        List<RecordSummary> live = new ArrayList<>();
        for (RecordSummary s : store.scanSummaries()) {
            if (!s.isExpired(now)) live.add(s);
        }
        return live;
    }

    private static long sizeOf(List<RecordSummary> records) {
        long total = 0;
        for (RecordSummary s : records) total += s.sizeBytes();
        return total;
    }
}
