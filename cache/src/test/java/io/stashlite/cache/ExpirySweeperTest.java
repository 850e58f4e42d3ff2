package io.stashlite.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.stashlite.cache.sync.SyncQueue;
import io.stashlite.core.CacheOptions;
import io.stashlite.core.codec.InMemoryKeyProvider;
import io.stashlite.core.codec.PayloadCodec;
import io.stashlite.storage.BackendRecordStore;
import io.stashlite.storage.InMemoryBackend;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExpirySweeperTest {

    private final MutableClock clock = new MutableClock(1_700_000_000_000L);
    private final ObjectMapper mapper = new ObjectMapper();

    private final OfflineCache cache = new OfflineCache(
            new BackendRecordStore(new InMemoryBackend()),
            new SyncQueue(new InMemoryBackend(), mapper, clock),
            new PayloadCodec(new InMemoryKeyProvider()),
            new QuotaManager(clock),
            clock,
            mapper
    );

    private static void awaitKeys(OfflineCache cache, Set<String> expected) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!cache.keys().equals(expected) && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
    }

    @Test
    void started_sweeper_purges_expired_records_and_stop_ends_sweeping() throws Exception {
        cache.set("short", "x", CacheOptions.ttl(Duration.ofMillis(10)));
        cache.set("long", "y", CacheOptions.ttl(Duration.ofHours(1)));
        clock.advance(Duration.ofMillis(10));

        var sweeper = new ExpirySweeper(cache, Duration.ofMillis(20));
        sweeper.start();
        awaitKeys(cache, Set.of("long"));
        assertEquals(Set.of("long"), cache.keys());

        sweeper.stop();
        assertTrue(sweeper.isStopped());
        Thread.sleep(50); // let a sweep already in flight finish

        cache.set("later", "z", CacheOptions.ttl(Duration.ofMillis(10)));
        clock.advance(Duration.ofMillis(10));
        Thread.sleep(150);
        assertTrue(cache.keys().contains("later"));
    }

    @Test
    void interval_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> new ExpirySweeper(cache, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new ExpirySweeper(cache, Duration.ofMillis(-1)));
    }
}
