package com.example.docimport;

/**
 * I/O or framing failure while reading a record from the input.
 */
public class ReadException extends ImportException {

    private final long recordNumber;

    public ReadException(long recordNumber, Throwable cause) {
        super("read error on entry #" + recordNumber + ": " + describe(cause), cause);
        this.recordNumber = recordNumber;
    }

    /** 1-based ordinal of the record that could not be read. */
    public long recordNumber() {
        return recordNumber;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
