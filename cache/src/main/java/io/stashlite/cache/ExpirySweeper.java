package io.stashlite.cache;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically purges expired records in the background.
 * <p>
 * Optional: reads already treat expired records as absent, so the sweeper
 * only reclaims space earlier. One daemon thread, fixed delay, so at most
 * one sweep runs at a time.
 */
public final class ExpirySweeper implements AutoCloseable {
    private static final Logger log = Logger.getLogger(ExpirySweeper.class.getName());

    private final OfflineCache cache;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    public ExpirySweeper(OfflineCache cache, Duration interval) {
        this.cache = Objects.requireNonNull(cache, "cache");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "expiry-sweeper");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::tickSafe, millis, millis, TimeUnit.MILLISECONDS);
    }

    public void stop() {
        scheduler.shutdownNow();
    }

    /** True once stop() has been called; no further sweeps are scheduled. */
    public boolean isStopped() {
        return scheduler.isShutdown();
    }

    @Override
    public void close() {
        stop();
    }

    private void tickSafe() {
        try {
            int purged = cache.purgeExpired();
            if (purged > 0) log.fine("Sweep purged " + purged + " expired records");
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Expiry sweep failed", e);
        }
    }
}
