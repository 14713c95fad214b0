package com.example.docimport;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;

/**
 * Writes documents as one JSON object per line, entries in document order. Repeated names are
 * written as repeated keys. The target stream stays open.
 */
public class JsonLinesDocumentWriter implements Closeable, Flushable {

    private static final JsonFactory FACTORY = new JsonFactory();

    private final JsonGenerator gen;
    private long written = 0;

    public JsonLinesDocumentWriter(OutputStream out) throws IOException {
        this.gen = FACTORY.createGenerator(out, JsonEncoding.UTF8);
        this.gen.setPrettyPrinter(new MinimalPrettyPrinter("\n"));
        this.gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    public void write(Document doc) throws IOException {
        gen.writeStartObject();
        for (Document.Entry e : doc.entries()) {
            gen.writeFieldName(e.name());
            writeValue(e.value());
        }
        gen.writeEndObject();
        written++;
    }

    /** {@link #write} for use as a stream consumer; I/O failures surface unchecked. */
    public void accept(Document doc) {
        try {
            write(doc);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public long written() {
        return written;
    }

    private void writeValue(Object value) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Long) {
            gen.writeNumber((Long) value);
        } else if (value instanceof Double) {
            gen.writeNumber((Double) value);
        } else {
            gen.writeString(value.toString());
        }
    }

    @Override
    public void flush() throws IOException {
        gen.flush();
    }

    @Override
    public void close() throws IOException {
        if (written > 0) {
            gen.writeRaw('\n');
        }
        gen.close();
    }
}
