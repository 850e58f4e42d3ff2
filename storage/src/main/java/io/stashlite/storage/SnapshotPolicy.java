// file: src/main/java/io/stashlite/storage/SnapshotPolicy.java
package io.stashlite.storage;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Snapshot policy that triggers a full snapshot after every N writes.
 * <p>
 * Simple but effective:
 *  - Bounds worst-case recovery time by limiting WAL replay length.
 *  - Does not consider file size or time - those can be added later.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /** Call after each successful durable write. Returns true when a snapshot is due. */
    public boolean recordWrite() {
        if (sinceLast.incrementAndGet() >= everyOps) {
            sinceLast.set(0);
            return true;
        }
        return false;
    }

    public int everyOps() {
        return everyOps;
    }
}
