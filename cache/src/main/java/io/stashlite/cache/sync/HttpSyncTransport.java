package io.stashlite.cache.sync;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * {@link SyncTransport} that sends the action as an HTTP request.
 * Any status outside 2xx is a failed attempt.
 */
public final class HttpSyncTransport implements SyncTransport {

    private final HttpClient client;
    private final Duration timeout;

    public HttpSyncTransport(HttpClient client, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public HttpSyncTransport() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(), Duration.ofSeconds(30));
    }

    @Override
    public void replay(SyncAction action) throws IOException, InterruptedException {
        HttpRequest.BodyPublisher body = action.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(action.body());

        HttpRequest.Builder req = HttpRequest.newBuilder(URI.create(action.target()))
                .timeout(timeout)
                .method(action.method(), body);
        for (Map.Entry<String, String> h : action.headers().entrySet()) {
            req.header(h.getKey(), h.getValue());
        }

        HttpResponse<String> resp = client.send(req.build(), HttpResponse.BodyHandlers.ofString());
        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException(action.method() + " " + action.target() + " returned HTTP " + status);
        }
    }
}
