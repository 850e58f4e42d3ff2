package io.stashlite.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileWalTornTailTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private DurableBackend reopen() throws Exception {
        return new DurableBackend(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir), new SnapshotPolicy(1_000_000));
    }

    @Test
    void replay_ignores_truncated_tail_and_applies_all_prior_records() throws Exception {
        // Prepare WAL and write two full records
        var wal = new FileWal(walDir, 1L << 60); // huge rotate threshold so single segment
        wal.append(WalRecordCodec.put(1, "k1", "v1".getBytes(StandardCharsets.UTF_8)));
        wal.append(WalRecordCodec.put(2, "k2", "v2".getBytes(StandardCharsets.UTF_8)));
        wal.close();

        // Create a third record but append only a partial payload (simulate torn write)
        byte[] r3 = WalRecordCodec.put(3, "k3", "v3".getBytes(StandardCharsets.UTF_8));
        Path seg = walDir.resolve("00000001.log");
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            int partialLen = r3.length - 5; // cut the tail so header says "len" but payload is short
            out.write(r3, 0, partialLen);
            out.flush(); // simulate crash right here
        }

        var backend = reopen();

        // Records 1 and 2 are applied; 3 is ignored due to truncation
        assertArrayEquals("v1".getBytes(StandardCharsets.UTF_8), backend.get("k1"));
        assertArrayEquals("v2".getBytes(StandardCharsets.UTF_8), backend.get("k2"));
        assertNull(backend.get("k3")); // truncated tail not applied
    }

    @Test
    void writes_after_a_torn_tail_survive_the_next_restart() throws Exception {
        var first = reopen();
        first.put("a", "1".getBytes(StandardCharsets.UTF_8));
        first.close();

        Path seg = walDir.resolve("00000001.log");
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(new byte[]{(byte) 0xA5, 0x57, 1, 99}); // torn header
        }

        var second = reopen(); // cuts the torn bytes before appending
        second.put("b", "2".getBytes(StandardCharsets.UTF_8));
        second.close();

        var third = reopen();
        assertArrayEquals("1".getBytes(StandardCharsets.UTF_8), third.get("a"));
        assertArrayEquals("2".getBytes(StandardCharsets.UTF_8), third.get("b"));
    }
}
