package com.example.docimport;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.util.List;

/**
 * CSV framing strategy, allowing uniVocity and Commons CSV to be switched.
 * Implementations pull one structural record at a time from the Reader given to {@link #begin}.
 */
public interface CsvRecordFramer extends Closeable {

    void begin(Reader reader) throws IOException;

    /** Tokens of the next record, or null at end of input. */
    List<String> next() throws IOException;

    static CsvRecordFramer forOptions(CsvFormatOptions options) {
        if ("commons".equalsIgnoreCase(options.getParser())) {
            return new CommonsCsvRecordFramer(options);
        }
        if (!"univocity".equalsIgnoreCase(options.getParser())) {
            throw new IllegalArgumentException("unknown csv parser: " + options.getParser());
        }
        return new UniVocityCsvRecordFramer(options);
    }
}
