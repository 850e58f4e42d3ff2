package io.stashlite.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stashlite.cache.OfflineCache;
import io.stashlite.cache.QuotaManager;
import io.stashlite.cache.sync.SyncAction;
import io.stashlite.cache.sync.SyncQueue;
import io.stashlite.core.codec.InMemoryKeyProvider;
import io.stashlite.core.codec.PayloadCodec;
import io.stashlite.storage.BackendRecordStore;
import io.stashlite.storage.InMemoryBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Happy-path round trips through the HTTP surface: cache CRUD, admin views, queue and flush.
 */
class WebServerCacheFlowTest {

    private static final int PORT = 18082; // test-only port
    private final ObjectMapper json = new ObjectMapper();
    private final List<String> replayed = new CopyOnWriteArrayList<>();
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        var clock = Clock.systemUTC();
        var cache = new OfflineCache(
                new BackendRecordStore(new InMemoryBackend()),
                new SyncQueue(new InMemoryBackend(), json, clock),
                new PayloadCodec(new InMemoryKeyProvider()),
                new QuotaManager(clock),
                clock,
                json
        );
        server = new WebServer(PORT, cache, (SyncAction a) -> replayed.add(a.type()));
        server.start();
        client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
    }

    @AfterEach
    void stopServer() {
        if (server != null) server.stop();
    }

    private HttpResponse<String> send(String method, String path, String body, String... headers) throws Exception {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + PORT + path))
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body));
        if (headers.length > 0) builder.headers(headers);
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void settings_round_trip_and_survive_cache_clear() throws Exception {
        assertEquals(404, send("GET", "/settings/theme", null).statusCode());
        assertEquals(200, send("PUT", "/settings/theme", "{\"mode\":\"dark\"}").statusCode());

        assertEquals(200, send("DELETE", "/cache", null).statusCode());

        var get = send("GET", "/settings/theme", null);
        assertEquals(200, get.statusCode());
        assertEquals("dark", json.readTree(get.body()).get("value").get("mode").asText());

        assertEquals(200, send("DELETE", "/settings/theme", null).statusCode());
        assertEquals(404, send("GET", "/settings/theme", null).statusCode());
    }

    @Test
    void put_get_delete_round_trip() throws Exception {
        var put = send("PUT", "/cache/city:42", "{\"aqi\":35}",
                WebServer.TTL_HEADER, "60000", WebServer.TYPE_HEADER, "aqi");
        assertEquals(200, put.statusCode());
        JsonNode putBody = json.readTree(put.body());
        assertEquals(60000, putBody.get("ttlMillis").asLong());
        assertEquals("aqi", putBody.get("typeTag").asText());

        var get = send("GET", "/cache/city:42", null);
        assertEquals(200, get.statusCode());
        assertEquals(35, json.readTree(get.body()).get("value").get("aqi").asInt());

        assertEquals(200, send("DELETE", "/cache/city:42", null).statusCode());
        assertEquals(200, send("DELETE", "/cache/city:42", null).statusCode());

        var miss = send("GET", "/cache/city:42", null);
        assertEquals(404, miss.statusCode());
        assertFalse(json.readTree(miss.body()).get("found").asBoolean());
    }

    @Test
    void admin_views_report_keys_and_usage() throws Exception {
        send("PUT", "/cache/b", "2", WebServer.TTL_HEADER, "60000");
        send("PUT", "/cache/a", "[1,2,3]");

        JsonNode keys = json.readTree(send("GET", "/admin/keys", null).body()).get("keys");
        assertEquals("a", keys.get(0).asText());
        assertEquals("b", keys.get(1).asText());

        JsonNode usage = json.readTree(send("GET", "/admin/usage", null).body());
        assertEquals(2, usage.get("liveCount").asInt());
        assertTrue(usage.get("liveBytes").asLong() > 0);

        JsonNode backup = json.readTree(send("GET", "/admin/export", null).body());
        assertEquals(2, backup.get("records").size());

        assertEquals(200, send("DELETE", "/cache", null).statusCode());
        assertEquals(0, json.readTree(send("GET", "/admin/keys", null).body()).get("keys").size());
    }

    @Test
    void queued_actions_are_listed_and_flushed_in_priority_order() throws Exception {
        var low = send("POST", "/queue", "{\"type\":\"low\",\"target\":\"http://example.invalid/a\",\"priority\":1}");
        var high = send("POST", "/queue", "{\"type\":\"high\",\"target\":\"http://example.invalid/b\",\"priority\":5}");
        assertEquals(201, low.statusCode());
        assertEquals(201, high.statusCode());

        JsonNode pending = json.readTree(send("GET", "/queue", null).body()).get("pending");
        assertEquals(2, pending.size());
        assertEquals("high", pending.get(0).get("action").get("type").asText());

        var flush = send("POST", "/queue/flush", null);
        assertEquals(200, flush.statusCode());
        assertEquals(2, json.readTree(flush.body()).get("succeeded").size());
        assertEquals(List.of("high", "low"), replayed);
    }
}
