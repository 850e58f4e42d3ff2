// file: server/src/main/java/io/stashlite/server/RequestLogger.java
package io.stashlite.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for the cache daemon.
 *
 * One line per request with method, path, status and latency. Server errors
 * are logged at WARNING with their cause; everything else at INFO.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method      HTTP method (GET, PUT, DELETE, POST)
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param cacheMillis time spent inside the cache or queue, or -1 if not measured
     * @param error       optional exception, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long cacheMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                cacheMillis >= 0 ? ", cache=" + cacheMillis + "ms" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (error != null) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
