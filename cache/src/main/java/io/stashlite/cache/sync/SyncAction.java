package io.stashlite.cache.sync;

import java.util.Map;
import java.util.Objects;

/**
 * A network action recorded while offline and replayed later.
 *
 * @param type    free-form label, e.g. "user-profile-update"
 * @param target  absolute URI the action is sent to
 * @param method  HTTP method, POST when not given
 * @param headers request headers, may be empty
 * @param body    request body, or null for none
 */
public record SyncAction(
        String type,
        String target,
        String method,
        Map<String, String> headers,
        String body
) {
    public SyncAction {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(target, "target");
        if (target.isBlank()) throw new IllegalArgumentException("target must not be blank");
        method = method == null || method.isBlank() ? "POST" : method.toUpperCase(java.util.Locale.ROOT);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static SyncAction post(String type, String target, String body) {
        return new SyncAction(type, target, "POST", Map.of("Content-Type", "application/json"), body);
    }
}
