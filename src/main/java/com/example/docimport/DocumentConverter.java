package com.example.docimport;

import java.util.List;

/**
 * Turns the tokens of one record into a document. Called concurrently from several workers on
 * independent records, so implementations must not hold mutable state.
 */
@FunctionalInterface
public interface DocumentConverter {
    Document convert(List<String> fields, List<String> tokens, long index) throws ConversionException;
}
