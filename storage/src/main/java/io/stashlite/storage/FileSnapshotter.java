// file: src/main/java/io/stashlite/storage/FileSnapshotter.java
package io.stashlite.storage;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format:
 *   int64 lastSeq
 *   int32 count
 *   repeated 'count' times:
 *     - key:   int32 len + UTF-8 bytes
 *     - value: int32 len + bytes
 * <p>
 * Atomicity:
 *   - We write to "snapshot-<seq>.bin.tmp" first and fsync it,
 *   - then move to "snapshot-<seq>.bin" using ATOMIC_MOVE,
 *   - then delete older snapshots.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final Logger log = Logger.getLogger(FileSnapshotter.class.getName());
    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".bin";

    private final Path dir;

    public FileSnapshotter(Path dir) throws IOException {
        this.dir = dir;
        Files.createDirectories(dir);
    }

    @Override
    public String writeSnapshot(Map<String, byte[]> current, long lastSeq) throws IOException {
        String name = String.format("%s%020d%s", PREFIX, lastSeq, SUFFIX);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (var fos = new FileOutputStream(tmp.toFile());
             var out = new DataOutputStream(new BufferedOutputStream(fos))) {
            out.writeLong(lastSeq);
            out.writeInt(current.size());
            for (Map.Entry<String, byte[]> e : current.entrySet()) {
                writeBytes(out, e.getKey().getBytes(StandardCharsets.UTF_8));
                writeBytes(out, e.getValue());
            }
            out.flush();
            fos.getFD().sync();
        }

        Files.move(tmp, dst, ATOMIC_MOVE);
        pruneOlderThan(dst);
        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() throws IOException {
        List<Path> snaps = snapshots();
        if (snaps.isEmpty()) return null;
        Path snap = snaps.get(snaps.size() - 1);

        try (var in = new DataInputStream(new BufferedInputStream(Files.newInputStream(snap)))) {
            long lastSeq = in.readLong();
            int keyCount = in.readInt();
            Map<String, byte[]> map = new HashMap<>(Math.max(16, keyCount * 2));
            for (int i = 0; i < keyCount; i++) {
                String key = new String(readBytes(in), StandardCharsets.UTF_8);
                map.put(key, readBytes(in));
            }
            return new LoadedSnapshot(snap.getFileName().toString(), lastSeq, map);
        }
    }

    private void pruneOlderThan(Path keep) {
        try {
            for (Path old : snapshots()) {
                if (!old.equals(keep)) Files.deleteIfExists(old);
            }
        } catch (IOException e) {
            // Stale snapshots only cost disk space; loadLatest() always picks the newest.
            log.warning("Failed to prune old snapshots in " + dir + ": " + e.getMessage());
        }
    }

    private List<Path> snapshots() throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .toList();
        }
    }

    private static void writeBytes(DataOutputStream out, byte[] v) throws IOException {
        out.writeInt(v.length);
        out.write(v);
    }

    private static byte[] readBytes(DataInputStream in) throws IOException {
        int len = in.readInt();
        if (len < 0) throw new IOException("negative length in snapshot: " + len);
        return in.readNBytes(len);
    }
}
