// file: src/main/java/io/stashlite/storage/WalRecordCodec.java
package io.stashlite.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x57A5   (helps detect garbage)
 *     - version (1B)  = 1       (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - op:    byte (1 = PUT, 2 = DELETE, 3 = CLEAR)
 *     - seq:   int64, strictly increasing per backend
 *     - key:   int32 len + UTF-8 bytes (empty for CLEAR)
 *     - value: int32 len + bytes (len == -1 => null; null unless PUT)
 * <p>
 * The header is validated by magic/version/length and CRC when reading.
 */
final class WalRecordCodec {
    static final short MAGIC = (short) 0x57A5;
    static final byte  VERSION = 1;
    static final int   HEADER_BYTES = 2 + 1 + 4 + 4;

    enum Op {
        PUT((byte) 1), DELETE((byte) 2), CLEAR((byte) 3);

        final byte code;

        Op(byte code) { this.code = code; }

        static Op fromCode(byte code) {
            for (Op op : values()) {
                if (op.code == code) return op;
            }
            throw new IllegalArgumentException("Unknown WAL op code: " + code);
        }
    }

    /** Immutable view of a decoded record. */
    record LogRecord(Op op, long seq, String key, byte[] value) {}

    private WalRecordCodec() {
    }

    static byte[] put(long seq, String key, byte[] value) {
        return encode(Op.PUT, seq, key, value);
    }

    static byte[] delete(long seq, String key) {
        return encode(Op.DELETE, seq, key, null);
    }

    static byte[] clear(long seq) {
        return encode(Op.CLEAR, seq, "", null);
    }

    /** Encode a log record into header+payload bytes ready for append. */
    static byte[] encode(Op op, long seq, String key, byte[] value) {
        byte[] payload = encodePayload(op, seq, key, value);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /** Decode a full payload (not including header). */
    static LogRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        Op op = Op.fromCode(b.get());
        long seq = b.getLong();
        String key = readString(b);
        byte[] value = readBytes(b);
        return new LogRecord(op, seq, key, value);
    }

    // ----------------- helpers -----------------

    private static byte[] encodePayload(Op op, long seq, String key, byte[] value) {
        byte[] sKey = key.getBytes(StandardCharsets.UTF_8);

        int size = 0;
        size += 1;                                      // op
        size += 8;                                      // seq
        size += 4 + sKey.length;                        // key
        size += 4 + (value == null ? 0 : value.length); // value

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.put(op.code);
        b.putLong(seq);
        writeBytes(b, sKey);
        writeBytes(b, value);
        return b.array();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue(); // CRC32 fits in unsigned int; Java int is fine for compare
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        if (data == null) { b.putInt(-1); return; }
        b.putInt(data.length).put(data);
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len == -1) return null;
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }

    private static String readString(ByteBuffer b) {
        byte[] s = readBytes(b);
        if (s == null) throw new IllegalArgumentException("WAL key bytes are null");
        return new String(s, StandardCharsets.UTF_8);
    }
}
