// file: src/main/java/io/stashlite/storage/FileWal.java
package io.stashlite.storage;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.READ;

/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment (e.g. "00000001.log", "00000002.log", ...),
 *      - cuts any torn tail left by a crash, so new records are never
 *        appended behind garbage,
 *      - opens it for append.
 * <p>
 *  - append():
 *      - writes the bytes through RandomAccessFile (not an interruptible
 *        channel, so thread interruption cannot abort a physical write),
 *      - syncs the file descriptor,
 *      - on failure, truncates the segment back to its previous length.
 * <p>
 *  - rotateIfNeeded():
 *      - when written bytes >= rotateBytes, closes current segment and opens
 *        a new one with incremented index, resetting the counter.
 * <p>
 *  - reset():
 *      - deletes every segment and continues in a fresh one.
 * <p>
 *  - Reader:
 *      - walks all segments in name order,
 *      - reads fixed-size header (11 bytes),
 *      - validates magic/version/length,
 *      - reads payload, validates CRC,
 *      - stops at the first truncated header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());
    private static final String SUFFIX = ".log";

    private final Path dir;
    private final long rotateBytes;
    private RandomAccessFile file;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) throws IOException {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        Files.createDirectories(dir);
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecords) throws IOException {
        long before = writtenInSegment;
        try {
            file.seek(before);
            file.write(serializedRecords);
            file.getFD().sync(); // fsync before acknowledging the write
            writtenInSegment = before + serializedRecords.length;
        } catch (IOException e) {
            rollbackTo(before);
            throw e;
        }
    }

    @Override
    public synchronized void rotateIfNeeded() throws IOException {
        if (writtenInSegment < rotateBytes) return;
        file.close();
        current = dir.resolve(segmentName(segmentIndex(current) + 1));
        file = new RandomAccessFile(current.toFile(), "rw");
        writtenInSegment = 0;
    }

    @Override
    public synchronized void reset() throws IOException {
        int next = segmentIndex(current) + 1;
        file.close();
        for (Path seg : segments(dir)) {
            Files.deleteIfExists(seg);
        }
        current = dir.resolve(segmentName(next));
        file = new RandomAccessFile(current.toFile(), "rw");
        file.setLength(0);
        writtenInSegment = 0;
    }

    @Override
    public WalReader openReader() throws IOException {
        return new Reader(segments(dir));
    }

    @Override
    public synchronized void close() throws IOException {
        if (file != null) file.close();
    }

    /** Bytes in the segment currently open for append. */
    synchronized long writtenInSegment() {
        return writtenInSegment;
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one and position at
     *    the end of its last valid record.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() throws IOException {
        List<Path> existing = segments(dir);
        current = existing.isEmpty()
                ? dir.resolve(segmentName(1))
                : existing.get(existing.size() - 1);
        file = new RandomAccessFile(current.toFile(), "rw");

        long valid = validLength(current);
        if (valid < file.length()) {
            log.warning("Truncating torn WAL tail in " + current + " at offset " + valid
                    + " (file length " + file.length() + ")");
            file.setLength(valid);
            file.getFD().sync();
        }
        writtenInSegment = valid;
    }

    private void rollbackTo(long length) {
        try {
            file.setLength(length);
        } catch (IOException e) {
            // The torn bytes stay on disk; the next open cuts them off.
            log.warning("WAL rollback to offset " + length + " failed in " + current + ": " + e.getMessage());
        }
    }

    private static long validLength(Path seg) throws IOException {
        try (FileChannel ch = FileChannel.open(seg, READ)) {
            long pos = 0;
            for (byte[] rec; (rec = readRecord(ch, pos)) != null; ) {
                pos += WalRecordCodec.HEADER_BYTES + rec.length;
            }
            return pos;
        }
    }

    /** Read one framed record at pos, or null at EOF / torn tail / bad CRC. */
    private static byte[] readRecord(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(WalRecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read == -1 || read == 0) return null; // EOF or empty
        if (read < WalRecordCodec.HEADER_BYTES) return null; // truncated header at tail, stop
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != WalRecordCodec.MAGIC || ver != WalRecordCodec.VERSION || len < 0) return null;
        if (pos + WalRecordCodec.HEADER_BYTES + len > ch.size()) return null; // truncated payload, stop
        ByteBuffer payload = ByteBuffer.allocate(len);
        int r2 = ch.read(payload, pos + WalRecordCodec.HEADER_BYTES);
        if (len > 0 && r2 < len) return null;
        byte[] bytes = payload.array();
        if (WalRecordCodec.crc32(bytes) != crc) return null; // bad tail, stop
        return bytes;
    }

    private static List<Path> segments(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return new ArrayList<>(files
                    .filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .toList());
        }
    }

    private static int segmentIndex(Path seg) {
        return Integer.parseInt(seg.getFileName().toString().replace(SUFFIX, ""));
    }

    private static String segmentName(int index) {
        return String.format("%08d%s", index, SUFFIX);
    }

    /**
     * Sequential reader for WAL segments used during recovery.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segmentPos = 0;
        private FileChannel ch;
        private long pos = 0;
        private boolean stopped = false;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() throws IOException {
            while (!stopped) {
                if (ch == null) {
                    if (segmentPos >= segments.size()) return null;
                    ch = FileChannel.open(segments.get(segmentPos++), READ);
                    pos = 0;
                }
                byte[] bytes = readRecord(ch, pos);
                if (bytes != null) {
                    pos += WalRecordCodec.HEADER_BYTES + bytes.length;
                    return bytes;
                }
                boolean cleanEnd = pos == ch.size();
                ch.close();
                ch = null;
                if (!cleanEnd) {
                    // Corruption in the middle of the log: nothing after it can be trusted.
                    stopped = true;
                }
            }
            return null;
        }

        @Override
        public void close() throws IOException {
            if (ch != null) ch.close();
        }
    }
}
