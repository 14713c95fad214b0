package com.example.docimport;

/**
 * A record whose tokens could not be turned into a document.
 */
public class ConversionException extends ImportException {

    private final long index;

    public ConversionException(long index, String reason) {
        super("conversion error on document #" + (index + 1) + ": " + reason);
        this.index = index;
    }

    public ConversionException(long index, String reason, Throwable cause) {
        super("conversion error on document #" + (index + 1) + ": " + reason, cause);
        this.index = index;
    }

    /** 0-based sequence index of the failing record. */
    public long index() {
        return index;
    }

    /** 1-based position of the failing record in the input. */
    public long recordNumber() {
        return index + 1;
    }
}
