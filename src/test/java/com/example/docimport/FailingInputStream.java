package com.example.docimport;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Serves {@code data} and then fails every further read.
 */
class FailingInputStream extends InputStream {

    private final byte[] data;
    private int pos = 0;

    FailingInputStream(String data) {
        this.data = data.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public int read() throws IOException {
        if (pos < data.length) {
            return data[pos++] & 0xFF;
        }
        throw new IOException("device unplugged");
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (pos >= data.length) {
            throw new IOException("device unplugged");
        }
        int n = Math.min(len, data.length - pos);
        System.arraycopy(data, pos, b, off, n);
        pos += n;
        return n;
    }

    @Override
    public int available() {
        return 0;
    }
}
