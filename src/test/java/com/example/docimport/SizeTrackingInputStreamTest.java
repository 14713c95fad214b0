package com.example.docimport;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class SizeTrackingInputStreamTest {

    @Test
    void countsSingleAndBulkReads() throws IOException {
        byte[] data = "hello, world".getBytes(StandardCharsets.UTF_8);
        SizeTrackingInputStream in = new SizeTrackingInputStream(new ByteArrayInputStream(data));

        assertEquals('h', in.read());
        assertEquals(1, in.bytesRead());

        byte[] buf = new byte[4];
        assertEquals(4, in.read(buf));
        assertEquals(5, in.bytesRead());

        assertEquals(2, in.skip(2));
        assertEquals(7, in.bytesRead());

        byte[] rest = new byte[64];
        assertEquals(5, in.read(rest, 0, rest.length));
        assertEquals(-1, in.read(rest, 0, rest.length));
        assertEquals(-1, in.read());
        assertEquals(data.length, in.bytesRead());
    }

    @Test
    void markIsNotSupported() {
        SizeTrackingInputStream in = new SizeTrackingInputStream(new ByteArrayInputStream(new byte[3]));
        assertFalse(in.markSupported());
        assertThrows(IOException.class, in::reset);
    }
}
