package io.stashlite.cache.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.stashlite.storage.InMemoryBackend;
import io.undertow.Undertow;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Replays actions against a local Undertow endpoint.
 */
class HttpSyncTransportTest {

    private static final int PORT = 18091; // test-only port
    private static final String BASE = "http://localhost:" + PORT;

    private final List<String> received = new CopyOnWriteArrayList<>();
    private Undertow server;

    @BeforeEach
    void startServer() {
        server = Undertow.builder()
                .addHttpListener(PORT, "localhost")
                .setHandler(exchange -> exchange.getRequestReceiver().receiveFullString((ex, body) -> {
                    String path = ex.getRequestPath();
                    String marker = ex.getRequestHeaders().getFirst(new HttpString("X-Marker"));
                    received.add(ex.getRequestMethod() + " " + path + " " + marker + " " + body);
                    ex.setStatusCode(path.startsWith("/fail") ? 503 : 204);
                    ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
                    ex.getResponseSender().send("", StandardCharsets.UTF_8);
                }))
                .build();
        server.start();
    }

    @AfterEach
    void stopServer() {
        if (server != null) server.stop();
    }

    @Test
    void sends_method_headers_and_body() throws Exception {
        var action = new SyncAction("profile", BASE + "/profile", "put", Map.of("X-Marker", "m1"), "{\"name\":\"x\"}");

        new HttpSyncTransport().replay(action);

        assertEquals(List.of("PUT /profile m1 {\"name\":\"x\"}"), received);
    }

    @Test
    void non_2xx_status_is_a_failure() {
        var action = SyncAction.post("report", BASE + "/fail", "{}");

        var ex = assertThrows(IOException.class, () -> new HttpSyncTransport().replay(action));
        assertTrue(ex.getMessage().contains("503"));
    }

    @Test
    void queue_drain_over_http_keeps_failed_items() {
        var queue = new SyncQueue(new InMemoryBackend(), new ObjectMapper(), Clock.systemUTC());
        queue.enqueue(SyncAction.post("ok", BASE + "/ok", "{}"), 1);
        queue.enqueue(SyncAction.post("down", BASE + "/fail", "{}"), 1);

        DrainReport report = queue.drain(new HttpSyncTransport());

        assertEquals(1, report.succeeded().size());
        assertEquals(1, report.retried().size());
        assertEquals("down", queue.pending().get(0).action().type());
    }
}
