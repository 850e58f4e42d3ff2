package io.stashlite.cache.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.stashlite.cache.MutableClock;
import io.stashlite.storage.DurableBackend;
import io.stashlite.storage.InMemoryBackend;
import io.stashlite.storage.StorageBackend;
import io.stashlite.storage.StoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SyncQueueTest {

    @TempDir Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final MutableClock clock = new MutableClock(1_700_000_000_000L);

    private static SyncAction action(String type) {
        return SyncAction.post(type, "http://localhost/api/" + type, "{}");
    }

    @Test
    void drains_by_priority_then_fifo() {
        var queue = new SyncQueue(new InMemoryBackend(), mapper, clock);
        queue.enqueue(action("A"), 1);
        queue.enqueue(action("B"), 2);
        queue.enqueue(action("C"), 1);

        List<String> replayed = new ArrayList<>();
        DrainReport report = queue.drain(a -> replayed.add(a.type()));

        assertEquals(List.of("B", "A", "C"), replayed);
        assertEquals(3, report.succeeded().size());
        assertEquals(0, queue.size());
    }

    @Test
    void always_failing_item_is_dropped_after_exactly_max_retries() {
        var queue = new SyncQueue(new InMemoryBackend(), mapper, clock);
        queue.enqueue(action("doomed"), 0, 3);

        int[] attempts = {0};
        SyncTransport failing = a -> {
            attempts[0]++;
            throw new IOException("offline");
        };

        DrainReport first = queue.drain(failing);
        DrainReport second = queue.drain(failing);
        assertEquals(1, first.retried().size());
        assertEquals(1, second.retried().size());
        assertEquals(2, queue.pending().get(0).retryCount());

        DrainReport third = queue.drain(failing);
        assertEquals(1, third.permanentlyFailed().size());
        assertEquals("offline", third.permanentlyFailed().get(0).lastError());
        assertEquals(3, third.permanentlyFailed().get(0).item().retryCount());

        DrainReport fourth = queue.drain(failing);
        assertEquals(0, fourth.attempted());
        assertEquals(3, attempts[0]);
        assertEquals(0, queue.size());
    }

    @Test
    void one_failure_does_not_stop_the_drain() {
        var queue = new SyncQueue(new InMemoryBackend(), mapper, clock);
        queue.enqueue(action("bad"), 5);
        queue.enqueue(action("good"), 1);

        DrainReport report = queue.drain(a -> {
            if (a.type().equals("bad")) throw new IllegalStateException("HTTP 500");
        });

        assertEquals(1, report.succeeded().size());
        assertEquals("good", report.succeeded().get(0).action().type());
        assertEquals(1, report.retried().size());
        assertEquals(1, queue.size());
    }

    @Test
    void items_and_retry_counts_survive_restart_and_ids_continue() {
        var first = SyncQueue.open(dir, mapper, clock);
        first.enqueue(action("A"), 1);
        first.enqueue(action("B"), 1);
        first.drain(a -> {
            if (a.type().equals("A")) throw new IOException("offline");
        });
        first.close();

        var second = SyncQueue.open(dir, mapper, clock);
        List<QueueItem> pending = second.pending();
        assertEquals(1, pending.size());
        assertEquals("A", pending.get(0).action().type());
        assertEquals(1, pending.get(0).retryCount());

        QueueItem next = second.enqueue(action("C"), 1);
        assertEquals(3, next.id());
    }

    @Test
    void unreadable_entry_is_left_in_storage() {
        var backend = DurableBackend.open(dir);
        backend.put(SyncQueue.keyOf(7), "not json".getBytes(StandardCharsets.UTF_8));

        var queue = new SyncQueue(backend, mapper, clock);

        assertEquals(0, queue.size());
        assertNotNull(backend.get(SyncQueue.keyOf(7)));
        assertEquals(8, queue.enqueue(action("A"), 0).id());
    }

    @Test
    void concurrent_drain_is_rejected() throws Exception {
        var queue = new SyncQueue(new InMemoryBackend(), mapper, clock);
        queue.enqueue(action("slow"), 0);

        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        Thread drainer = new Thread(() -> queue.drain(a -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
        }));
        drainer.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        var ex = assertThrows(QueueException.class, () -> queue.drain(a -> { }));
        assertEquals(QueueException.Kind.DRAIN_IN_PROGRESS, ex.kind());

        release.countDown();
        drainer.join(5_000);
        assertEquals(0, queue.size());
    }

    @Test
    void enqueue_failure_is_reported_and_nothing_is_queued() {
        var queue = new SyncQueue(new FullDiskBackend(), mapper, clock);

        var ex = assertThrows(QueueException.class, () -> queue.enqueue(action("A"), 0));
        assertEquals(QueueException.Kind.ENQUEUE_FAILED, ex.kind());
        assertEquals(0, queue.size());
    }

    @Test
    void max_retries_below_one_is_rejected() {
        var queue = new SyncQueue(new InMemoryBackend(), mapper, clock);
        assertThrows(IllegalArgumentException.class, () -> queue.enqueue(action("A"), 0, 0));
    }

    /** Backend that refuses every write. */
    private static final class FullDiskBackend implements StorageBackend {
        @Override
        public void put(String key, byte[] value) {
            throw new StoreException(StoreException.Kind.WRITE_FAILED, "disk full");
        }

        @Override public byte[] get(String key) { return null; }
        @Override public void delete(String key) { }
        @Override public void deleteMany(Collection<String> keys) { }
        @Override public void clear() { }
        @Override public Map<String, byte[]> scan() { return Map.of(); }
        @Override public void close() { }
    }
}
