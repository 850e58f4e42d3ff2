// file: src/main/java/io/stashlite/storage/Snapshotter.java
package io.stashlite.storage;

import java.io.IOException;
import java.util.Map;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of the current in-memory map at some point in time,
 * tagged with the sequence number of the last WAL record it includes.
 * On restart:
 *  - we load the latest snapshot, then
 *  - replay WAL records with a higher sequence number.
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the current map.
     *
     * @param current immutable snapshot of key -> value bytes
     * @param lastSeq sequence number of the last WAL record reflected in 'current'
     * @return snapshot identifier (e.g., filename/path).
     */
    String writeSnapshot(Map<String, byte[]> current, long lastSeq) throws IOException;

    /** Load the latest snapshot if present, or null when there is none. */
    LoadedSnapshot loadLatest() throws IOException;

    /** Simple holder for snapshot id, its WAL position and its data */
    record LoadedSnapshot(String id, long lastSeq, Map<String, byte[]> data) {}
}
