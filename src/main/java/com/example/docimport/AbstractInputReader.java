package com.example.docimport;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Shared bookkeeping for the format readers: byte counting, field list, sequence index and the
 * finished state after end of input or a read error.
 */
@Slf4j
public abstract class AbstractInputReader implements InputReader {

    private static final long PROGRESS_EVERY = 100_000;

    protected final SizeTrackingInputStream source;
    private final FieldValidator validator;

    private volatile List<String> fields = List.of();
    private volatile long recordsRead = 0;
    private boolean finished = false;

    /**
     * @param fields caller-supplied field list, validated here; null when a header line will supply it
     */
    protected AbstractInputReader(InputStream in, List<String> fields, FieldValidator validator) throws HeaderException {
        this.source = new SizeTrackingInputStream(in);
        this.validator = validator;
        if (fields != null) {
            setFields(fields);
        }
    }

    @Override
    public final List<String> readHeader() throws HeaderException {
        List<String> header;
        try {
            header = readHeaderTokens();
        } catch (IOException | RuntimeException e) {
            throw new HeaderException("unable to read header: " + e.getMessage(), e);
        }
        if (header == null) {
            throw new HeaderException("unable to read header: input is empty");
        }
        setFields(header);
        log.debug("Header fields: {}", this.fields);
        return this.fields;
    }

    @Override
    public final RawRecord nextRecord() throws ReadException {
        if (fields.isEmpty()) {
            throw new IllegalStateException("no field list: read the header or supply fields first");
        }
        if (finished) {
            return null;
        }
        List<String> tokens;
        try {
            tokens = readTokens();
        } catch (IOException | RuntimeException e) {
            finished = true;
            throw new ReadException(recordsRead + 1, e);
        }
        if (tokens == null) {
            finished = true;
            return null;
        }
        RawRecord record = new RawRecord(fields, tokens, recordsRead);
        recordsRead++;
        if (recordsRead % PROGRESS_EVERY == 0) {
            log.info("Read {} records ({} bytes)", recordsRead, source.bytesRead());
        }
        return record;
    }

    @Override
    public List<String> fields() {
        return fields;
    }

    @Override
    public long bytesConsumed() {
        return source.bytesRead();
    }

    @Override
    public long recordsRead() {
        return recordsRead;
    }

    /** Tokens of the header unit, or null on an empty input. */
    protected abstract List<String> readHeaderTokens() throws IOException;

    /** Tokens of the next record, or null at end of input. */
    protected abstract List<String> readTokens() throws IOException;

    private void setFields(List<String> candidate) throws HeaderException {
        validator.validate(candidate);
        this.fields = List.copyOf(candidate);
    }
}
