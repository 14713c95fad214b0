package com.example.docimport;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldListsTest {

    @TempDir
    Path tmp;

    @Test
    void readsOneNamePerLineSkippingBlanks() throws Exception {
        Path file = tmp.resolve("fields.txt");
        Files.writeString(file, "name\n\nage  \r\ncity\n", StandardCharsets.UTF_8);
        assertEquals(List.of("name", "age", "city"), FieldLists.fromFile(file));
    }

    @Test
    void parsesCommaSeparatedList() {
        assertEquals(List.of("a", "b", "c"), FieldLists.parse("a, b ,c"));
        assertTrue(FieldLists.parse(null).isEmpty());
    }
}
