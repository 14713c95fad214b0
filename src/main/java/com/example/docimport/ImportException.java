package com.example.docimport;

/**
 * Base type of every failure an import can report to its caller.
 */
public class ImportException extends Exception {

    public ImportException(String message) {
        super(message);
    }

    public ImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
