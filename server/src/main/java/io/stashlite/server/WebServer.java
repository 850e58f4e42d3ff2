// file: server/src/main/java/io/stashlite/server/WebServer.java
package io.stashlite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stashlite.cache.OfflineCache;
import io.stashlite.cache.StorageUsage;
import io.stashlite.cache.sync.DrainReport;
import io.stashlite.cache.sync.QueueException;
import io.stashlite.cache.sync.QueueItem;
import io.stashlite.cache.sync.SyncAction;
import io.stashlite.cache.sync.SyncTransport;
import io.stashlite.core.CacheOptions;
import io.stashlite.server.dto.GetResponse;
import io.stashlite.server.dto.PutResponse;
import io.stashlite.server.dto.QueueRequest;
import io.stashlite.server.dto.UsageResponse;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Thin HTTP adapter over {@link OfflineCache}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert cache and queue results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - GET    /cache/{key}     Cached JSON value (404 on miss)
 *   - PUT    /cache/{key}     Store JSON body; X-Stash-Ttl-Ms, X-Stash-Type optional
 *   - DELETE /cache/{key}     Remove (idempotent)
 *   - DELETE /cache           Clear all records (queue and settings untouched)
 *   - GET    /settings/{key}  Setting value (404 when unset)
 *   - PUT    /settings/{key}  Store JSON body as a setting (no TTL)
 *   - DELETE /settings/{key}  Remove a setting (idempotent)
 *   - GET    /admin/keys      Stored keys
 *   - GET    /admin/usage     Storage usage against the quota
 *   - GET    /admin/health    Basic health check
 *   - GET    /admin/export    Backup of every record
 *   - POST   /queue           Enqueue a sync action
 *   - GET    /queue           Pending actions in drain order
 *   - POST   /queue/flush     Drain the queue through the configured transport
 *
 * Handlers touch the disk, so requests are moved off the IO thread first.
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    static final String TTL_HEADER = "X-Stash-Ttl-Ms";
    static final String TYPE_HEADER = "X-Stash-Type";

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final OfflineCache cache;
    private final SyncTransport transport;
    private final CacheOptions defaults;

    public WebServer(int port, OfflineCache cache, SyncTransport transport) {
        this("127.0.0.1", port, cache, transport, CacheOptions.defaults());
    }

    public WebServer(String host, int port, OfflineCache cache, SyncTransport transport, CacheOptions defaults) {
        this.cache = cache;
        this.transport = transport;
        this.defaults = defaults;

        this.server = Undertow.builder()
                .addHttpListener(port, host)
                .setHandler(exchange -> {
                    if (exchange.isInIoThread()) {
                        exchange.dispatch(this::route);
                        return;
                    }
                    route(exchange);
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop(); // For tests to stop server
    }

    private void route(HttpServerExchange exchange) {
        var path = exchange.getRequestPath();
        var method = exchange.getRequestMethod().toString();
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        if (path.startsWith("/cache/")) {
            String key = path.substring("/cache/".length());
            if (key.isBlank()) {
                reply(exchange, 400, Map.of("error", "key must not be empty"));
                return;
            }
            switch (method) {
                case "PUT" -> handlePut(exchange, key);
                case "GET" -> handleGet(exchange, key);
                case "DELETE" -> timed(exchange, () -> {
                    cache.remove(key);
                    return new Reply(200, Map.of("ok", true));
                });
                default -> reply(exchange, 405, Map.of("error", "method not allowed"));
            }
        } else if (path.startsWith("/settings/")) {
            String key = path.substring("/settings/".length());
            if (key.isBlank()) {
                reply(exchange, 400, Map.of("error", "key must not be empty"));
                return;
            }
            switch (method) {
                case "PUT" -> handlePutSetting(exchange, key);
                case "GET" -> handleGetSetting(exchange, key);
                case "DELETE" -> timed(exchange, () -> {
                    cache.removeSetting(key);
                    return new Reply(200, Map.of("ok", true));
                });
                default -> reply(exchange, 405, Map.of("error", "method not allowed"));
            }
        } else if ("/cache".equals(path) && "DELETE".equals(method)) {
            timed(exchange, () -> {
                cache.clear();
                return new Reply(200, Map.of("ok", true));
            });
        } else if ("/admin/health".equals(path)) {
            reply(exchange, 200, Map.of("status", "ok"));
        } else if ("/admin/keys".equals(path) && "GET".equals(method)) {
            timed(exchange, () -> new Reply(200, Map.of("keys", new TreeSet<>(cache.keys()))));
        } else if ("/admin/usage".equals(path) && "GET".equals(method)) {
            timed(exchange, () -> new Reply(200, usageDto(cache.usage())));
        } else if ("/admin/export".equals(path) && "GET".equals(method)) {
            timed(exchange, () -> new Reply(200, cache.exportBackup()));
        } else if ("/queue".equals(path) && "POST".equals(method)) {
            handleEnqueue(exchange);
        } else if ("/queue".equals(path) && "GET".equals(method)) {
            timed(exchange, () -> new Reply(200, Map.of("pending", cache.pendingActions())));
        } else if ("/queue/flush".equals(path) && "POST".equals(method)) {
            timed(exchange, this::flush);
        } else {
            reply(exchange, 404, Map.of("error", "not found"));
        }
    }

    // ---------- handlers ----------

    /** GET /cache/{key} */
    private void handleGet(HttpServerExchange ex, String key) {
        timed(ex, () -> {
            Optional<byte[]> raw = cache.getBytes(key);
            var dto = new GetResponse();
            if (raw.isEmpty()) {
                dto.found = false;
                return new Reply(404, dto);
            }
            dto.found = true;
            dto.key = key;
            dto.value = json.readTree(raw.get());
            return new Reply(200, dto);
        });
    }

    /** PUT /cache/{key} */
    private void handlePut(HttpServerExchange ex, String key) {
        withBody(ex, data -> {
            CacheOptions options = optionsFrom(ex);
            JsonNode value = json.readTree(data);
            if (value == null || value.isMissingNode()) {
                throw new IllegalArgumentException("body must be a JSON value");
            }
            if (!cache.set(key, value, options)) {
                return new Reply(503, Map.of("error", "cache write failed"));
            }
            var dto = new PutResponse();
            dto.ok = true;
            dto.key = key;
            dto.ttlMillis = options.ttl().toMillis();
            dto.typeTag = options.typeTag();
            return new Reply(200, dto);
        });
    }

    /** GET /settings/{key} */
    private void handleGetSetting(HttpServerExchange ex, String key) {
        timed(ex, () -> {
            JsonNode value = cache.getSetting(key, JsonNode.class, null);
            var dto = new GetResponse();
            if (value == null) {
                dto.found = false;
                return new Reply(404, dto);
            }
            dto.found = true;
            dto.key = key;
            dto.value = value;
            return new Reply(200, dto);
        });
    }

    /** PUT /settings/{key} */
    private void handlePutSetting(HttpServerExchange ex, String key) {
        withBody(ex, data -> {
            JsonNode value = json.readTree(data);
            if (value == null || value.isMissingNode()) {
                throw new IllegalArgumentException("body must be a JSON value");
            }
            if (!cache.setSetting(key, value)) {
                return new Reply(503, Map.of("error", "settings write failed"));
            }
            return new Reply(200, Map.of("ok", true, "key", key));
        });
    }

    /** POST /queue */
    private void handleEnqueue(HttpServerExchange ex) {
        withBody(ex, data -> {
            var req = json.readValue(data, QueueRequest.class);
            if (req == null || req.type == null || req.target == null) {
                throw new IllegalArgumentException("type and target are required");
            }
            var action = new SyncAction(req.type, req.target, req.method, req.headers, req.body);
            int maxRetries = req.maxRetries == null ? QueueItem.DEFAULT_MAX_RETRIES : req.maxRetries;
            try {
                QueueItem item = cache.queueAction(action, req.priority, maxRetries);
                return new Reply(201, item);
            } catch (QueueException e) {
                return new Reply(503, Map.of("error", e.kind().name(), "message", e.getMessage()));
            }
        });
    }

    /** POST /queue/flush */
    private Reply flush() {
        try {
            DrainReport report = cache.flushQueue(transport);
            return new Reply(200, report);
        } catch (QueueException e) {
            if (e.kind() == QueueException.Kind.DRAIN_IN_PROGRESS) {
                return new Reply(409, Map.of("error", "drain already in progress"));
            }
            throw e;
        }
    }

    // ---------- request plumbing ----------

    /** Handler body that yields a status and a JSON-serializable payload. */
    @FunctionalInterface
    private interface Action {
        Reply run() throws Exception;
    }

    @FunctionalInterface
    private interface BodyAction {
        Reply run(byte[] body) throws Exception;
    }

    private record Reply(int status, Object body) {}

    private void withBody(HttpServerExchange ex, BodyAction action) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    if (data.length > MAX_BODY_BYTES) {
                        reply(exchange, 413, Map.of("error", "request body too large"));
                        return;
                    }
                    timed(exchange, () -> action.run(data));
                },
                (exchange, ioEx) -> {
                    int status = 400;
                    send(exchange, status, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest(exchange.getRequestMethod().toString(),
                            exchange.getRequestPath(), status, 0, -1, ioEx);
                }
        );
    }

    /** Run 'action', map exceptions to status codes, send the reply and log it. */
    private void timed(HttpServerExchange ex, Action action) {
        long start = System.nanoTime();
        int status;
        long storageMs = -1L;
        Throwable error = null;
        try {
            long sStart = System.nanoTime();
            Reply r = action.run();
            storageMs = (System.nanoTime() - sStart) / 1_000_000L;
            status = r.status();
            send(ex, status, r.body());
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, Map.of("error", "invalid JSON"));
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), status, totalMs, storageMs, error);
    }

    private void reply(HttpServerExchange ex, int status, Object body) {
        send(ex, status, body);
        RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), status, 0, -1, null);
    }

    /**
     * Per-write options from headers, falling back to the server defaults.
     * Malformed values surface as IllegalArgumentException (HTTP 400).
     */
    private CacheOptions optionsFrom(HttpServerExchange ex) {
        CacheOptions options = defaults;
        String ttl = ex.getRequestHeaders().getFirst(TTL_HEADER);
        if (ttl != null && !ttl.isBlank()) {
            try {
                long millis = Long.parseLong(ttl.trim());
                if (millis < 0) throw new IllegalArgumentException(TTL_HEADER + " must be >= 0");
                options = options.withTtl(Duration.ofMillis(millis));
            } catch (NumberFormatException nfe) {
                throw new IllegalArgumentException(TTL_HEADER + " must be a long", nfe);
            }
        }
        String type = ex.getRequestHeaders().getFirst(TYPE_HEADER);
        if (type != null && !type.isBlank()) {
            options = options.withTypeTag(type.trim());
        }
        return options;
    }

    private static UsageResponse usageDto(StorageUsage u) {
        var dto = new UsageResponse();
        dto.liveBytes = u.liveBytes();
        dto.liveCount = u.liveCount();
        dto.expiredBytes = u.expiredBytes();
        dto.expiredCount = u.expiredCount();
        dto.limitBytes = u.limitBytes();
        dto.formatted = u.formatted();
        return dto;
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
