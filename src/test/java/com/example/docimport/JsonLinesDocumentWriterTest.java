package com.example.docimport;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesDocumentWriterTest {

    @Test
    void writesOneObjectPerLineInEntryOrder() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (JsonLinesDocumentWriter writer = new JsonLinesDocumentWriter(out)) {
            writer.write(Document.builder().append("b", "x\"y").append("a", 7L).build());
            writer.write(Document.builder().append("k", 1.5).append("k", null).build());
            assertEquals(2, writer.written());
        }
        assertEquals("{\"b\":\"x\\\"y\",\"a\":7}\n{\"k\":1.5,\"k\":null}\n", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void emptyOutputHasNoStrayNewline() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new JsonLinesDocumentWriter(out).close();
        assertEquals(0, out.size());
    }
}
