package com.example.docimport;

import java.io.FilterReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Follows CSV quoting over the characters passing through it, so a framer can tell whether the
 * input ended inside a quoted value. A quote opens a value only at the start of a field (after
 * leading blanks); inside a quoted value a doubled quote is an escape.
 */
class QuoteTrackingReader extends FilterReader {

    private enum State { FIELD_START, UNQUOTED, QUOTED, QUOTE_IN_QUOTED }

    private final char delimiter;
    private final char quote;
    private State state = State.FIELD_START;
    private boolean eof = false;

    QuoteTrackingReader(Reader in, char delimiter, char quote) {
        super(in);
        this.delimiter = delimiter;
        this.quote = quote;
    }

    /** True once the input is exhausted while a quoted value is still open. */
    boolean endedInsideQuote() {
        return eof && state == State.QUOTED;
    }

    @Override
    public int read() throws IOException {
        int c = in.read();
        if (c < 0) {
            eof = true;
        } else {
            track((char) c);
        }
        return c;
    }

    @Override
    public int read(char[] cbuf, int off, int len) throws IOException {
        int n = in.read(cbuf, off, len);
        if (n < 0) {
            eof = true;
        }
        for (int i = 0; i < n; i++) {
            track(cbuf[off + i]);
        }
        return n;
    }

    @Override
    public long skip(long n) {
        throw new UnsupportedOperationException("skip would lose quote state");
    }

    private void track(char c) {
        boolean boundary = c == delimiter || c == '\n' || c == '\r';
        switch (state) {
            case FIELD_START:
                if (c == quote) {
                    state = State.QUOTED;
                } else if (!boundary && !Character.isWhitespace(c)) {
                    state = State.UNQUOTED;
                }
                break;
            case UNQUOTED:
                if (boundary) {
                    state = State.FIELD_START;
                }
                break;
            case QUOTED:
                if (c == quote) {
                    state = State.QUOTE_IN_QUOTED;
                }
                break;
            case QUOTE_IN_QUOTED:
                if (c == quote) {
                    state = State.QUOTED;
                } else {
                    state = boundary ? State.FIELD_START : State.UNQUOTED;
                }
                break;
            default:
                throw new IllegalStateException("unknown state " + state);
        }
    }
}
