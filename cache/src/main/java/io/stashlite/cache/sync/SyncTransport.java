package io.stashlite.cache.sync;

/**
 * Replays one action against the network.
 * Returning normally means success; any exception counts as a failed attempt.
 */
@FunctionalInterface
public interface SyncTransport {
    void replay(SyncAction action) throws Exception;
}
