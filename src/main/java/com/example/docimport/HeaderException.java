package com.example.docimport;

/**
 * Missing, unreadable or invalid header. Raised before any record is streamed.
 */
public class HeaderException extends ImportException {

    public HeaderException(String message) {
        super(message);
    }

    public HeaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
