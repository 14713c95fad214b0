package com.example.docimport;

import java.util.List;
import java.util.Objects;

/**
 * One framed input record: the shared field list, its raw tokens and its position in the input.
 */
public final class RawRecord {

    private final List<String> fields;
    private final List<String> tokens;
    private final long index;

    public RawRecord(List<String> fields, List<String> tokens, long index) {
        this.fields = Objects.requireNonNull(fields, "fields");
        this.tokens = List.copyOf(tokens);
        this.index = index;
    }

    public List<String> fields() {
        return fields;
    }

    public List<String> tokens() {
        return tokens;
    }

    public long index() {
        return index;
    }

    @Override
    public String toString() {
        return "RawRecord{index=" + index + ", tokens=" + tokens + "}";
    }
}
