// file: server/src/main/java/io/stashlite/server/Main.java
package io.stashlite.server;

import io.stashlite.cache.CacheConfig;
import io.stashlite.cache.ExpirySweeper;
import io.stashlite.cache.OfflineCache;
import io.stashlite.cache.sync.HttpSyncTransport;

import java.nio.file.Path;
import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for the local cache daemon.
 *
 * Responsibilities:
 *  - Parse configuration from CLI (and the optional JSON cache config).
 *  - Open the durable cache: records, sync queue, key file.
 *  - Start the expiry sweeper when a sweep interval is configured.
 *  - Start the HTTP server and close everything on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);
        CacheConfig cacheConfig = cfg.configPath() != null && !cfg.configPath().isBlank()
                ? CacheConfig.fromJsonFile(Path.of(cfg.configPath()))
                : CacheConfig.defaults(Path.of(cfg.dataDir()));

        // ------ Cache + queue ------
        var cache = OfflineCache.open(cacheConfig, Clock.systemUTC());

        ExpirySweeper sweeper = null;
        if (!cacheConfig.sweepInterval().isZero()) {
            sweeper = new ExpirySweeper(cache, cacheConfig.sweepInterval());
            sweeper.start();
        }

        // ------ HTTP layer ------
        var web = new WebServer(cfg.host(), cfg.httpPort(), cache, new HttpSyncTransport(),
                cacheConfig.defaultOptions());
        web.start();

        System.out.printf("StashLite listening on http://%s:%d (data: %s)%n",
                cfg.host(), cfg.httpPort(), cacheConfig.dataDir());

        // Shutdown hook
        final ExpirySweeper sweeperRef = sweeper;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                if (sweeperRef != null) sweeperRef.stop();
                web.stop();
                cache.close();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Shutdown did not complete cleanly", e);
            }
        }));
    }
}
