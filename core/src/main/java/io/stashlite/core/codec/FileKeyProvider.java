package io.stashlite.core.codec;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Key provider that persists the raw 256-bit key in a single file.
 * <p>
 * Atomicity:
 *   - We write to "<name>.tmp" first,
 *   - then move over the key file using ATOMIC_MOVE,
 *   so a crash never leaves a half-written key behind.
 * <p>
 * Failure handling:
 *   - An unreadable or wrongly sized key file is replaced by a fresh key.
 *     Records sealed with the old key then read as misses.
 *   - If the key cannot be persisted, the generated key is still used for this
 *     process; records written now become unreadable after a restart.
 */
public final class FileKeyProvider implements KeyProvider {
    private static final Logger log = Logger.getLogger(FileKeyProvider.class.getName());

    private final Path keyFile;
    private SecretKey cached;

    public FileKeyProvider(Path keyFile) {
        this.keyFile = Objects.requireNonNull(keyFile, "keyFile");
    }

    @Override
    public synchronized SecretKey getOrCreateKey() {
        if (cached != null) return cached;

        SecretKey loaded = load();
        if (loaded != null) {
            cached = loaded;
            return cached;
        }

        SecretKey fresh = AesGcm.generateKey();
        persist(fresh);
        cached = fresh;
        return cached;
    }

    @Override
    public synchronized void setKey(SecretKey key) {
        Objects.requireNonNull(key, "key");
        persist(key);
        cached = key;
    }

    public Path keyFile() {
        return keyFile;
    }

    private SecretKey load() {
        if (!Files.exists(keyFile)) return null;
        try {
            byte[] raw = Files.readAllBytes(keyFile);
            if (raw.length != AesGcm.KEY_BYTES) {
                log.warning("Key file " + keyFile + " has " + raw.length + " bytes, expected "
                        + AesGcm.KEY_BYTES + "; generating a new key");
                return null;
            }
            return AesGcm.keyFromBytes(raw);
        } catch (IOException e) {
            log.log(Level.WARNING, "Key file " + keyFile + " is unreadable; generating a new key", e);
            return null;
        }
    }

    private void persist(SecretKey key) {
        Path tmp = keyFile.resolveSibling(keyFile.getFileName() + ".tmp");
        try {
            Path parent = keyFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);

            Files.write(tmp, key.getEncoded(),
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            restrictPermissions(tmp);
            Files.move(tmp, keyFile, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (IOException e) {
            log.log(Level.WARNING, "Failed to persist encryption key to " + keyFile
                    + "; key is valid for this process only", e);
        }
    }

    private static void restrictPermissions(Path file) throws IOException {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            log.fine("POSIX permissions not supported for " + file);
        }
    }
}
