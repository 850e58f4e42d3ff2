// file: cache/src/main/java/io/stashlite/cache/sync/SyncQueue.java
package io.stashlite.cache.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.stashlite.storage.DurableBackend;
import io.stashlite.storage.StorageBackend;
import io.stashlite.storage.StoreException;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent, priority-ordered queue of actions waiting for connectivity.
 * <p>
 * Persistence:
 *  - One backend entry per item: key = zero-padded id, value = item as JSON.
 *  - enqueue() returns only after the item is durable.
 *  - Opening reloads every item; ids continue after the highest one seen.
 *    Entries that cannot be read are logged and left in storage.
 * <p>
 * Drain:
 *  - Exclusive: a second concurrent drain fails with DRAIN_IN_PROGRESS.
 *  - Works on a snapshot in priority-then-FIFO order. Items enqueued during
 *    a drain wait for the next one.
 *  - Success deletes the item. Failure bumps retryCount; once it reaches
 *    maxRetries the item is deleted and reported as permanently failed.
 *  - Nothing marks an item in flight, so a crash mid-replay replays it again
 *    (at-least-once).
 */
public final class SyncQueue implements AutoCloseable {
    private static final Logger log = Logger.getLogger(SyncQueue.class.getName());

    private final StorageBackend backend;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Map<Long, QueueItem> items = new ConcurrentHashMap<>();
    private final ReentrantLock drainLock = new ReentrantLock();
    private long nextId = 1;

    public SyncQueue(StorageBackend backend, ObjectMapper mapper, Clock clock) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        load();
    }

    /**
     * Open a durable queue under 'dir'.
     *
     * @throws QueueException kind OPEN_FAILED if the storage cannot be opened
     */
    public static SyncQueue open(Path dir, ObjectMapper mapper, Clock clock) {
        try {
            return new SyncQueue(DurableBackend.open(dir), mapper, clock);
        } catch (StoreException e) {
            throw new QueueException(QueueException.Kind.OPEN_FAILED, "Cannot open sync queue at " + dir, e);
        }
    }

    public QueueItem enqueue(SyncAction action, int priority) {
        return enqueue(action, priority, QueueItem.DEFAULT_MAX_RETRIES);
    }

    /**
     * Persist a new item.
     *
     * @throws QueueException kind ENQUEUE_FAILED if the item could not be stored
     */
    public synchronized QueueItem enqueue(SyncAction action, int priority, int maxRetries) {
        QueueItem item = new QueueItem(nextId, action, priority, 0, maxRetries, clock.millis());
        try {
            persist(item);
        } catch (StoreException | IOException e) {
            throw new QueueException(QueueException.Kind.ENQUEUE_FAILED, "Cannot persist action " + action.type(), e);
        }
        nextId++;
        items.put(item.id(), item);
        log.fine("Queued action " + item.id() + " (" + action.type() + ", priority " + priority + ")");
        return item;
    }

    /**
     * Replay every pending item once.
     *
     * @throws QueueException kind DRAIN_IN_PROGRESS if another drain is running
     */
    public DrainReport drain(SyncTransport transport) {
        if (!drainLock.tryLock()) {
            throw new QueueException(QueueException.Kind.DRAIN_IN_PROGRESS, "A drain is already running");
        }
        try {
            List<QueueItem> succeeded = new ArrayList<>();
            List<QueueItem> retried = new ArrayList<>();
            List<DrainReport.FailedItem> failed = new ArrayList<>();

            for (QueueItem item : pending()) {
                Exception error = attempt(transport, item);
                try {
                    if (error == null) {
                        remove(item);
                        succeeded.add(item);
                        continue;
                    }
                    QueueItem next = item.afterFailedAttempt();
                    if (next.exhausted()) {
                        remove(item);
                        failed.add(new DrainReport.FailedItem(next, describe(error)));
                        log.warning("Dropping action " + item.id() + " (" + item.action().type()
                                + ") after " + next.retryCount() + " attempts: " + describe(error));
                    } else {
                        persist(next);
                        items.put(next.id(), next);
                        retried.add(next);
                    }
                } catch (StoreException | IOException e) {
                    // Item keeps its previous persisted state and is attempted again next drain.
                    log.log(Level.SEVERE, "Cannot record outcome of action " + item.id(), e);
                }
                if (Thread.currentThread().isInterrupted()) {
                    log.info("Drain interrupted; remaining actions stay queued");
                    break;
                }
            }

            if (!succeeded.isEmpty() || !retried.isEmpty() || !failed.isEmpty()) {
                log.info("Drained sync queue: " + succeeded.size() + " succeeded, " + retried.size()
                        + " will retry, " + failed.size() + " dropped");
            }
            return new DrainReport(succeeded, retried, failed);
        } finally {
            drainLock.unlock();
        }
    }

    /** Pending items in drain order. */
    public List<QueueItem> pending() {
        List<QueueItem> out = new ArrayList<>(items.values());
        out.sort(QueueItem.DRAIN_ORDER);
        return out;
    }

    public int size() {
        return items.size();
    }

    @Override
    public void close() {
        backend.close();
    }

    // ---------- internals ----------

    private static Exception attempt(SyncTransport transport, QueueItem item) {
        try {
            transport.replay(item.action());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return e;
        } catch (Exception e) {
            return e;
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private synchronized void persist(QueueItem item) throws IOException {
        backend.put(keyOf(item.id()), mapper.writeValueAsBytes(item));
    }

    private synchronized void remove(QueueItem item) {
        backend.delete(keyOf(item.id()));
        items.remove(item.id());
    }

    private void load() {
        long maxId = 0;
        for (Map.Entry<String, byte[]> e : backend.scan().entrySet()) {
            try {
                maxId = Math.max(maxId, Long.parseLong(e.getKey()));
            } catch (NumberFormatException ex) {
                log.severe("Unexpected key in sync queue storage: " + e.getKey());
                continue;
            }
            try {
                QueueItem item = mapper.readValue(e.getValue(), QueueItem.class);
                items.put(item.id(), item);
            } catch (IOException | RuntimeException ex) {
                log.log(Level.SEVERE, "Cannot read queued action " + e.getKey() + "; leaving it in storage", ex);
            }
        }
        nextId = maxId + 1;
        if (!items.isEmpty()) log.info("Loaded " + items.size() + " queued actions");
    }

    static String keyOf(long id) {
        return String.format("%019d", id);
    }
}
