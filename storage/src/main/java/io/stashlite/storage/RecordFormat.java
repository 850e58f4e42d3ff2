package io.stashlite.storage;

import io.stashlite.core.CacheRecord;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Serialized form of a {@link CacheRecord} inside a storage backend.
 * <p>
 * Layout (little-endian):
 *   - version:   byte (1)
 *   - flags:     byte (bit0 = compressed, bit1 = encrypted)
 *   - createdAt: int64
 *   - ttl:       int64
 *   - writeSeq:  int64, store-assigned write order
 *   - typeTag:   int32 len + UTF-8 bytes
 *   - nonce:     int32 len + bytes (len == -1 => null)
 *   - payload:   int32 len + bytes
 * <p>
 * The key is not repeated inside the value; it is the backend key.
 * Metadata precedes the payload so summaries can be read without copying it.
 */
final class RecordFormat {
    static final byte VERSION = 1;
    private static final int FLAG_COMPRESSED = 1;
    private static final int FLAG_ENCRYPTED = 1 << 1;

    private RecordFormat() {
    }

    static byte[] encode(CacheRecord r, long writeSeq) {
        byte[] tag = r.typeTag().getBytes(StandardCharsets.UTF_8);
        byte[] nonce = r.nonce();
        byte[] payload = r.payload();

        int size = 1 + 1 + 8 + 8 + 8
                + 4 + tag.length
                + 4 + (nonce == null ? 0 : nonce.length)
                + 4 + payload.length;

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.put(VERSION);
        b.put((byte) ((r.compressed() ? FLAG_COMPRESSED : 0) | (r.encrypted() ? FLAG_ENCRYPTED : 0)));
        b.putLong(r.createdAtMillis());
        b.putLong(r.ttlMillis());
        b.putLong(writeSeq);
        writeBytes(b, tag);
        writeBytes(b, nonce);
        writeBytes(b, payload);
        return b.array();
    }

    static CacheRecord decode(String key, byte[] bytes) {
        try {
            ByteBuffer b = header(bytes);
            int flags = b.get();
            long createdAt = b.getLong();
            long ttl = b.getLong();
            b.getLong(); // writeSeq
            String tag = new String(readBytes(b, false), StandardCharsets.UTF_8);
            byte[] nonce = readBytes(b, true);
            byte[] payload = readBytes(b, false);
            requireFullyConsumed(b);
            return new CacheRecord(key, payload, nonce, createdAt, ttl, tag,
                    (flags & FLAG_COMPRESSED) != 0, (flags & FLAG_ENCRYPTED) != 0);
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new StoreException(StoreException.Kind.CORRUPT_RECORD, "Undecodable record for key " + key, e);
        }
    }

    static RecordSummary summary(String key, byte[] bytes) {
        try {
            ByteBuffer b = header(bytes);
            b.get(); // flags
            long createdAt = b.getLong();
            long ttl = b.getLong();
            long writeSeq = b.getLong();
            String tag = new String(readBytes(b, false), StandardCharsets.UTF_8);
            int nonceLen = b.getInt();
            if (nonceLen > 0) b.position(b.position() + nonceLen);
            int payloadLen = b.getInt();
            if (payloadLen < 0 || payloadLen != b.remaining()) {
                throw new IllegalArgumentException("payload length mismatch");
            }
            return new RecordSummary(key, createdAt, ttl, tag, payloadLen, writeSeq);
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new StoreException(StoreException.Kind.CORRUPT_RECORD, "Undecodable record for key " + key, e);
        }
    }

    private static ByteBuffer header(byte[] bytes) {
        ByteBuffer b = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        byte version = b.get();
        if (version != VERSION) throw new IllegalArgumentException("unsupported record version " + version);
        return b;
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        if (data == null) { b.putInt(-1); return; }
        b.putInt(data.length).put(data);
    }

    private static byte[] readBytes(ByteBuffer b, boolean nullable) {
        int len = b.getInt();
        if (len == -1 && nullable) return null;
        if (len < 0 || len > b.remaining()) throw new IllegalArgumentException("bad length " + len);
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }

    private static void requireFullyConsumed(ByteBuffer b) {
        if (b.hasRemaining()) throw new IllegalArgumentException(b.remaining() + " trailing bytes");
    }
}
