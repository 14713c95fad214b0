package com.example.docimport;

import java.util.Objects;

/**
 * Converts raw records to documents on a pool of workers, optionally preserving input order.
 *
 * <pre>
 * DecodeEngine engine = new DecodeEngine(new TokenDocumentConverter(), cfg);
 * try (DocumentStream docs = engine.stream(reader::nextRecord)) {
 *     docs.drainTo(writer::write);
 * }
 * </pre>
 */
public class DecodeEngine {

    private final DocumentConverter converter;
    private final EngineConfig cfg;

    public DecodeEngine(DocumentConverter converter, EngineConfig cfg) {
        this.converter = Objects.requireNonNull(converter, "converter");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        if (cfg.getWorkers() < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got " + cfg.getWorkers());
        }
        if (cfg.getPollIntervalMillis() < 1) {
            throw new IllegalArgumentException("pollIntervalMillis must be >= 1");
        }
    }

    /** Starts reading from {@code source} and returns the stream of converted documents. */
    public DocumentStream stream(RecordSource source) {
        Objects.requireNonNull(source, "source");
        DocumentStream stream = new DocumentStream(converter, source, cfg);
        stream.start();
        return stream;
    }
}
