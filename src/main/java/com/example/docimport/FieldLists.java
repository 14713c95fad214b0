package com.example.docimport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Caller-supplied field lists, used when the input carries no header line.
 */
public final class FieldLists {

    private FieldLists() {}

    /** One field name per line; blank lines are ignored. */
    public static List<String> fromFile(Path path) throws IOException {
        List<String> fields = new ArrayList<>();
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            String name = line.strip();
            if (!name.isEmpty()) {
                fields.add(name);
            }
        }
        return fields;
    }

    /** Comma-separated names, surrounding whitespace trimmed. */
    public static List<String> parse(String names) {
        List<String> fields = new ArrayList<>();
        if (names == null) {
            return fields;
        }
        for (String part : names.split(",", -1)) {
            fields.add(part.trim());
        }
        return fields;
    }
}
