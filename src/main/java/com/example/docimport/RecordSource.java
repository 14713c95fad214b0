package com.example.docimport;

/**
 * Pull side of the pipeline; {@code InputReader::nextRecord} is the usual implementation.
 */
@FunctionalInterface
public interface RecordSource {

    /** Next record, or null at end of input. */
    RawRecord next() throws ReadException;
}
