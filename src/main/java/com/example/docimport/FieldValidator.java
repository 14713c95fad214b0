package com.example.docimport;

import java.util.List;

/**
 * Rule applied to a field list once, before any record is read.
 */
@FunctionalInterface
public interface FieldValidator {
    void validate(List<String> fields) throws HeaderException;
}
