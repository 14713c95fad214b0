package com.example.docimport;

import java.io.Closeable;
import java.util.List;

/**
 * Frames a delimited byte stream into {@link RawRecord}s.
 */
public interface InputReader extends Closeable {

    /**
     * Reads the header line, splits it into field names and validates them. Fails before any
     * record has been read.
     */
    List<String> readHeader() throws HeaderException;

    /**
     * Returns the next record, or null once the input is exhausted. After a {@link ReadException}
     * the reader is finished.
     */
    RawRecord nextRecord() throws ReadException;

    /** Field list in effect, empty until a header is read or fields are supplied. */
    List<String> fields();

    long bytesConsumed();

    long recordsRead();
}
