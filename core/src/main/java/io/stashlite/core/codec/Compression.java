package io.stashlite.core.codec;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Deflate (zlib framing, Adler-32 checked) compression for stored payloads.
 * <p>
 * Properties:
 *  - compress/decompress are exact inverses.
 *  - Empty input maps to empty output in both directions.
 *  - decompress rejects truncated streams, checksum mismatches and trailing
 *    bytes with {@link CodecException.Kind#COMPRESSION}.
 */
public final class Compression {
    private static final int BUFFER_BYTES = 8192;

    private Compression() {
        // utility
    }

    public static byte[] compress(byte[] input) {
        if (input.length == 0) return new byte[0];

        Deflater deflater = new Deflater(Deflater.DEFAULT_COMPRESSION);
        try {
            deflater.setInput(input);
            deflater.finish();

            var out = new ByteArrayOutputStream(Math.max(64, input.length / 2));
            byte[] buf = new byte[BUFFER_BYTES];
            while (!deflater.finished()) {
                int n = deflater.deflate(buf);
                out.write(buf, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    public static byte[] decompress(byte[] input) {
        if (input.length == 0) return new byte[0];

        Inflater inflater = new Inflater();
        try {
            inflater.setInput(input);

            var out = new ByteArrayOutputStream(input.length * 2);
            byte[] buf = new byte[BUFFER_BYTES];
            while (!inflater.finished()) {
                int n = inflater.inflate(buf);
                if (n == 0) {
                    if (inflater.needsInput()) {
                        throw new CodecException(CodecException.Kind.COMPRESSION, "truncated deflate stream");
                    }
                    if (inflater.needsDictionary()) {
                        throw new CodecException(CodecException.Kind.COMPRESSION, "deflate stream requires a preset dictionary");
                    }
                }
                out.write(buf, 0, n);
            }
            if (inflater.getRemaining() > 0) {
                throw new CodecException(CodecException.Kind.COMPRESSION,
                        inflater.getRemaining() + " trailing bytes after deflate stream");
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new CodecException(CodecException.Kind.COMPRESSION, "invalid deflate stream", e);
        } finally {
            inflater.end();
        }
    }
}
