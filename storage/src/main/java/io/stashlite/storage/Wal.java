// file: src/main/java/io/stashlite/storage/Wal.java
package io.stashlite.storage;

import java.io.IOException;

/**
 * Write-Ahead Log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at "record" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() must fsync the record to disk before returning, so that if
 *    the process crashes after append() returns, recovery will see the record.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append one or more serialized records (concatenated) and fsync them.
     *
     * @param serializedRecords header+payload bytes, typically from WalRecordCodec.encode(...)
     * @throws IOException if the bytes could not be made durable; the log is
     *                     rolled back to its previous length in that case
     */
    void append(byte[] serializedRecords) throws IOException;

    /**
     * Rotate log segment if configured thresholds are hit. (Log Rotations)
     * Called by the backend after each write.
     */
    void rotateIfNeeded() throws IOException;

    /**
     * Drop every segment and continue in a fresh one.
     * Called once a snapshot covering all logged records is durable.
     */
    void reset() throws IOException;

    /**
     * Open a sequential reader over the WAL.
     * Reader walks segments oldest first and stops at:
     *  - first corrupt header,
     *  - first truncated payload, or
     *  - end of the newest segment.
     */
    WalReader openReader() throws IOException;

    @Override
    void close() throws IOException;

    /**
     * Reader abstraction used during recovery.
     */
    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (NOT including header), or null when:
         *   - at EOF, or
         *   - corruption/truncation is detected at the tail.
         */
        byte[] next() throws IOException;

        @Override
        void close() throws IOException;
    }
}
