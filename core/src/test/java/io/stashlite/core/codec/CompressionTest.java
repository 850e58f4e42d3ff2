package io.stashlite.core.codec;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CompressionTest {

    @Test
    void empty_input_maps_to_empty_output() {
        assertEquals(0, Compression.compress(new byte[0]).length);
        assertEquals(0, Compression.decompress(new byte[0]).length);
    }

    @Test
    void round_trips_repetitive_and_random_payloads() {
        byte[] text = "{\"aqi\":35,\"pm25\":12.5}".repeat(500).getBytes(StandardCharsets.UTF_8);
        byte[] compressed = Compression.compress(text);
        assertTrue(compressed.length < text.length, "repetitive JSON should shrink");
        assertArrayEquals(text, Compression.decompress(compressed));

        byte[] noise = new byte[64 * 1024];
        new Random(7).nextBytes(noise);
        assertArrayEquals(noise, Compression.decompress(Compression.compress(noise)));
    }

    @Test
    void truncated_stream_fails_with_compression_kind() {
        byte[] compressed = Compression.compress("hello hello hello hello".getBytes(StandardCharsets.UTF_8));
        byte[] truncated = Arrays.copyOf(compressed, compressed.length - 3);

        var ex = assertThrows(CodecException.class, () -> Compression.decompress(truncated));
        assertEquals(CodecException.Kind.COMPRESSION, ex.kind());
    }

    @Test
    void garbage_and_trailing_bytes_are_rejected() {
        var garbage = assertThrows(CodecException.class,
                () -> Compression.decompress(new byte[]{1, 2, 3, 4, 5, 6, 7, 8}));
        assertEquals(CodecException.Kind.COMPRESSION, garbage.kind());

        byte[] compressed = Compression.compress("payload".getBytes(StandardCharsets.UTF_8));
        byte[] padded = Arrays.copyOf(compressed, compressed.length + 2);
        var trailing = assertThrows(CodecException.class, () -> Compression.decompress(padded));
        assertEquals(CodecException.Kind.COMPRESSION, trailing.kind());
    }
}
