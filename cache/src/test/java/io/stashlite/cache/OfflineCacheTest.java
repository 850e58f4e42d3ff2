package io.stashlite.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stashlite.cache.sync.DrainReport;
import io.stashlite.cache.sync.SyncAction;
import io.stashlite.cache.sync.SyncQueue;
import io.stashlite.core.CacheOptions;
import io.stashlite.core.CacheRecord;
import io.stashlite.core.codec.InMemoryKeyProvider;
import io.stashlite.core.codec.KeyProvider;
import io.stashlite.core.codec.PayloadCodec;
import io.stashlite.storage.BackendRecordStore;
import io.stashlite.storage.InMemoryBackend;
import io.stashlite.storage.RecordStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OfflineCacheTest {

    record Aqi(int aqi) {}

    @TempDir Path dir;

    private final MutableClock clock = new MutableClock(1_700_000_000_000L);
    private final ObjectMapper mapper = new ObjectMapper();
    private final KeyProvider keys = new InMemoryKeyProvider();
    private final InMemoryBackend backend = new InMemoryBackend();
    private final RecordStore store = new BackendRecordStore(backend);

    private OfflineCache cache(long quotaBytes) {
        return new OfflineCache(
                store,
                new SyncQueue(new InMemoryBackend(), mapper, clock),
                new PayloadCodec(keys),
                new QuotaManager(quotaBytes, clock),
                clock,
                mapper
        );
    }

    private OfflineCache cache() {
        return cache(QuotaManager.DEFAULT_LIMIT_BYTES);
    }

    @Test
    void city_42_is_served_then_expires_and_disappears() {
        var cache = cache();

        assertTrue(cache.set("city:42", new Aqi(35), CacheOptions.ttl(Duration.ofMillis(60_000))));
        assertEquals(new Aqi(35), cache.get("city:42", Aqi.class).orElseThrow());

        clock.advance(Duration.ofSeconds(61));

        assertTrue(cache.get("city:42", Aqi.class).isEmpty());
        assertTrue(store.scanAll().stream().noneMatch(r -> r.key().equals("city:42")));
    }

    @Test
    void record_is_live_until_exactly_ttl_has_elapsed() {
        var cache = cache();
        cache.set("k", "v", CacheOptions.ttl(Duration.ofMillis(1_000)));

        clock.advance(Duration.ofMillis(999));
        assertEquals("v", cache.get("k", String.class).orElseThrow());

        clock.advance(Duration.ofMillis(1));
        assertTrue(cache.get("k", String.class).isEmpty());
    }

    @Test
    void remove_twice_is_harmless() {
        var cache = cache();
        cache.set("k", "v");

        cache.remove("k");
        assertTrue(cache.get("k", String.class).isEmpty());
        cache.remove("k");
        assertTrue(cache.get("k", String.class).isEmpty());
    }

    @Test
    void writes_past_the_quota_evict_older_records_but_never_the_newest() {
        var cache = cache(5_000);
        var raw = CacheOptions.defaults().withCompress(false).withEncrypt(false);

        for (int i = 0; i < 12; i++) {
            assertTrue(cache.setBytes("blob:" + i, new byte[1_000], raw));
            clock.advance(Duration.ofMillis(1));
        }

        StorageUsage usage = cache.usage();
        assertTrue(usage.liveBytes() <= 5_000, "usage " + usage.liveBytes());
        assertTrue(cache.getBytes("blob:11").isPresent());
        assertTrue(cache.getBytes("blob:0").isEmpty());
    }

    @Test
    void writes_within_one_millisecond_still_keep_the_newest() {
        var cache = cache(1_500);
        var raw = CacheOptions.defaults().withCompress(false).withEncrypt(false);

        assertTrue(cache.setBytes("b", new byte[1_000], raw));
        assertTrue(cache.setBytes("a", new byte[1_000], raw));

        assertEquals(Set.of("a"), cache.keys());
    }

    @Test
    void bulk_writes_without_clock_movement_evict_in_write_order() {
        var cache = cache(3_000);
        var raw = CacheOptions.defaults().withCompress(false).withEncrypt(false);

        for (int i = 9; i >= 0; i--) {
            assertTrue(cache.setBytes("blob:" + i, new byte[1_000], raw));
        }

        assertEquals(Set.of("blob:2", "blob:1", "blob:0"), cache.keys());
    }

    @Test
    void tampered_ciphertext_reads_as_a_miss_and_is_removed() {
        var cache = cache();
        cache.set("secret", Map.of("token", "abc"));

        CacheRecord stored = store.get("secret");
        assertTrue(stored.encrypted());
        byte[] payload = stored.payload();
        payload[payload.length / 2] ^= 0x01;
        store.put(new CacheRecord(stored.key(), payload, stored.nonce(), stored.createdAtMillis(),
                stored.ttlMillis(), stored.typeTag(), stored.compressed(), stored.encrypted()));

        assertTrue(cache.get("secret", new TypeReference<Map<String, String>>() { }).isEmpty());
        assertNull(store.get("secret"));
    }

    @Test
    void undecodable_stored_bytes_read_as_a_miss_and_are_removed() {
        var cache = cache();
        backend.put("garbage", new byte[]{9, 9, 9});

        assertTrue(cache.getBytes("garbage").isEmpty());
        assertNull(backend.get("garbage"));
    }

    @Test
    void value_of_the_wrong_shape_is_a_miss_but_stays_stored() {
        var cache = cache();
        cache.set("k", "just a string");

        assertTrue(cache.get("k", Aqi.class).isEmpty());
        assertEquals("just a string", cache.get("k", String.class).orElseThrow());
    }

    @Test
    void typed_reads_support_generic_values() {
        var cache = cache();
        cache.set("list", List.of(new Aqi(1), new Aqi(2)));

        List<Aqi> got = cache.get("list", new TypeReference<List<Aqi>>() { }).orElseThrow();

        assertEquals(List.of(new Aqi(1), new Aqi(2)), got);
    }

    @Test
    void empty_key_is_rejected_without_throwing() {
        var cache = cache();
        assertFalse(cache.set("", "v"));
        assertTrue(cache.get("", String.class).isEmpty());
    }

    @Test
    void clear_removes_records_but_keeps_queued_actions() {
        var cache = cache();
        cache.set("a", 1);
        cache.queueAction(SyncAction.post("upload", "http://localhost/upload", "{}"), 1);

        cache.clear();

        assertEquals(Set.of(), cache.keys());
        assertEquals(1, cache.pendingActions().size());
    }

    @Test
    void flush_replays_queued_actions() {
        var cache = cache();
        cache.queueAction(SyncAction.post("low", "http://localhost/a", "{}"), 1);
        cache.queueAction(SyncAction.post("high", "http://localhost/b", "{}"), 9);

        List<String> order = new ArrayList<>();
        DrainReport report = cache.flushQueue(a -> order.add(a.type()));

        assertEquals(List.of("high", "low"), order);
        assertEquals(2, report.succeeded().size());
        assertTrue(cache.pendingActions().isEmpty());
    }

    @Test
    void purge_and_remove_by_type_delete_only_matching_records() {
        var cache = cache();
        cache.set("short", "x", CacheOptions.ttl(Duration.ofSeconds(1)));
        cache.set("img:1", "y", CacheOptions.defaults().withTypeTag("image"));
        cache.set("img:2", "z", CacheOptions.defaults().withTypeTag("image"));
        cache.set("keep", "k");

        clock.advance(Duration.ofSeconds(2));
        assertEquals(1, cache.purgeExpired());
        assertEquals(2, cache.removeByType("image"));

        assertEquals(Set.of("keep"), cache.keys());
    }

    @Test
    void usage_separates_live_and_expired_bytes() {
        var cache = cache();
        var raw = CacheOptions.defaults().withCompress(false).withEncrypt(false);
        cache.setBytes("live", new byte[300], raw);
        cache.setBytes("dying", new byte[200], raw.withTtl(Duration.ofMillis(10)));

        clock.advance(Duration.ofMillis(10));
        StorageUsage usage = cache.usage();

        assertEquals(300, usage.liveBytes());
        assertEquals(1, usage.liveCount());
        assertEquals(200, usage.expiredBytes());
        assertEquals("300 B", usage.formatted());
    }

    @Test
    void backup_restores_records_into_a_cache_sharing_the_key() throws Exception {
        var source = cache();
        source.setSetting("theme", "dark");
        source.set("a", new Aqi(1));
        source.set("b", new Aqi(2), CacheOptions.defaults().withEncrypt(false).withTypeTag("aqi"));

        String json = mapper.writeValueAsString(source.exportBackup());
        CacheBackup backup = mapper.readValue(json, CacheBackup.class);

        var target = new OfflineCache(
                new BackendRecordStore(new InMemoryBackend()),
                new SyncQueue(new InMemoryBackend(), mapper, clock),
                new PayloadCodec(keys),
                new QuotaManager(clock),
                clock,
                mapper
        );
        target.set("stale", "gone after import");

        assertEquals(2, target.importBackup(backup));
        assertEquals(new Aqi(1), target.get("a", Aqi.class).orElseThrow());
        assertEquals(new Aqi(2), target.get("b", Aqi.class).orElseThrow());
        assertTrue(target.get("stale", String.class).isEmpty());
        assertEquals("dark", target.getSetting("theme", String.class, "light"));
    }

    @Test
    void malformed_backup_entries_are_rejected_and_leave_the_cache_alone() throws Exception {
        var cache = cache();
        cache.set("keep", "me");

        for (String json : List.of(
                "{\"version\":1,\"records\":[{\"key\":\"x\",\"ttlMillis\":5}]}",
                "{\"version\":1,\"records\":[{\"payloadBase64\":\"AA==\",\"ttlMillis\":5}]}",
                "{\"version\":1,\"records\":[{\"key\":\"x\",\"payloadBase64\":\"AA==\",\"encrypted\":true}]}",
                "{\"version\":1,\"records\":[{\"key\":\"x\",\"payloadBase64\":\"@@\"}]}",
                "{\"version\":1,\"records\":[null]}",
                "{\"version\":99,\"records\":[]}")) {
            CacheBackup backup = mapper.readValue(json, CacheBackup.class);
            assertEquals(-1, cache.importBackup(backup), json);
        }
        assertEquals(-1, cache.importBackup(null));

        assertEquals("me", cache.get("keep", String.class).orElseThrow());
    }

    @Test
    void import_enforces_the_quota_keeping_the_newest_records() {
        var source = cache();
        var raw = CacheOptions.defaults().withCompress(false).withEncrypt(false);
        for (int i = 0; i < 4; i++) {
            source.setBytes("blob:" + i, new byte[1_000], raw);
            clock.advance(Duration.ofMillis(1));
        }
        CacheBackup backup = source.exportBackup();

        var target = new OfflineCache(
                new BackendRecordStore(new InMemoryBackend()),
                new SyncQueue(new InMemoryBackend(), mapper, clock),
                new PayloadCodec(keys),
                new QuotaManager(2_500, clock),
                clock,
                mapper
        );

        assertEquals(4, target.importBackup(backup));
        assertEquals(Set.of("blob:2", "blob:3"), target.keys());
    }

    @Test
    void settings_have_no_ttl_and_survive_cache_clear() {
        var cache = cache();

        assertEquals("light", cache.getSetting("theme", String.class, "light"));
        assertTrue(cache.setSetting("theme", "dark"));
        assertTrue(cache.setSetting("user:7", Map.of("name", "Ada")));

        clock.advance(Duration.ofDays(365));
        cache.clear();

        assertEquals("dark", cache.getSetting("theme", String.class, "light"));
        assertEquals(Map.of("name", "Ada"),
                cache.getSetting("user:7", new TypeReference<Map<String, String>>() { }, Map.of()));
        assertEquals(Set.of("theme", "user:7"), cache.settingKeys());
        assertEquals(0, cache.usage().liveCount());

        cache.removeSetting("theme");
        cache.removeSetting("theme");
        assertEquals("light", cache.getSetting("theme", String.class, "light"));
    }

    @Test
    void setting_of_the_wrong_shape_falls_back_to_the_default() {
        var cache = cache();
        cache.setSetting("volume", "loud");

        assertEquals(5, cache.getSetting("volume", Integer.class, 5));
        assertFalse(cache.setSetting("", 1));
    }

    @Test
    void durable_cache_survives_reopen_with_its_key_and_queue() {
        var config = CacheConfig.defaults(dir);

        var first = OfflineCache.open(config, clock);
        first.set("city:7", new Aqi(70));
        first.queueAction(SyncAction.post("sync", "http://localhost/sync", "{}"), 0);
        first.setSetting("locale", "de-DE");
        first.close();

        var second = OfflineCache.open(config, clock);
        assertEquals(new Aqi(70), second.get("city:7", Aqi.class).orElseThrow());
        assertEquals(1, second.pendingActions().size());
        assertEquals("de-DE", second.getSetting("locale", String.class, "en-US"));
        second.close();
    }
}
