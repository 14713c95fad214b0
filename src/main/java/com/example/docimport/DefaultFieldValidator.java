package com.example.docimport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Field names must be non-empty and unique, may not start with '$', may not start or end with
 * '.', may not contain "..", and no name may be a dotted parent of another ("a" with "a.b").
 */
public class DefaultFieldValidator implements FieldValidator {

    @Override
    public void validate(List<String> fields) throws HeaderException {
        if (fields == null || fields.isEmpty()) {
            throw new HeaderException("no fields found in header");
        }
        List<String> sorted = new ArrayList<>(fields);
        for (int i = 0; i < sorted.size(); i++) {
            String field = sorted.get(i);
            if (field == null || field.trim().isEmpty()) {
                throw new HeaderException("field #" + (i + 1) + " has an empty name");
            }
        }
        Collections.sort(sorted);
        for (int i = 0; i < sorted.size(); i++) {
            String field = sorted.get(i);
            if (field.startsWith("$")) {
                throw new HeaderException("field '" + field + "' cannot start with a '$'");
            }
            if (field.startsWith(".")) {
                throw new HeaderException("field '" + field + "' cannot start with a '.'");
            }
            if (field.endsWith(".")) {
                throw new HeaderException("field '" + field + "' cannot end with a '.'");
            }
            if (field.contains("..")) {
                throw new HeaderException("field '" + field + "' cannot contain consecutive '.' characters");
            }
            // sorted order puts any duplicate or dotted child after its parent
            for (int j = i + 1; j < sorted.size(); j++) {
                String later = sorted.get(j);
                if (field.equals(later)) {
                    throw new HeaderException("fields cannot be identical: '" + field + "' and '" + later + "'");
                }
                if (later.startsWith(field + ".")) {
                    throw new HeaderException("fields '" + field + "' and '" + later + "' are incompatible");
                }
            }
        }
    }
}
