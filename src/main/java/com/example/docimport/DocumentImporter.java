package com.example.docimport;

import com.example.docimport.util.CharsetResolver;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.List;
import java.util.function.Consumer;

/**
 * Wires a format reader, a converter and the decode engine from {@link ImportOptions}.
 * The header is read and validated in {@link #open}, before any record is streamed.
 */
@Slf4j
public class DocumentImporter implements Closeable {

    private final InputReader reader;
    private final DecodeEngine engine;

    DocumentImporter(InputReader reader, DecodeEngine engine) {
        this.reader = reader;
        this.engine = engine;
    }

    public static DocumentImporter open(InputStream in, ImportOptions options) throws IOException, HeaderException {
        List<String> supplied = resolveFields(options);
        // a supplied list is validated at construction even when empty
        List<String> fields = options.isHeaderLine() ? null : supplied;

        Charset charset;
        if (CharsetResolver.AUTO.equalsIgnoreCase(options.getEncoding())) {
            BufferedInputStream buffered = new BufferedInputStream(in);
            charset = CharsetResolver.detect(buffered);
            in = buffered;
        } else {
            charset = CharsetResolver.resolve(options.getEncoding());
        }

        InputReader reader = newReader(in, charset, fields, options);
        try {
            if (options.isHeaderLine()) {
                reader.readHeader();
            }
        } catch (HeaderException e) {
            reader.close();
            throw e;
        }

        DocumentConverter converter = options.isInferTypes()
                ? new TypeInferringDocumentConverter(options.isIgnoreBlanks())
                : new TokenDocumentConverter(options.isIgnoreBlanks());
        EngineConfig cfg = new EngineConfig();
        cfg.setWorkers(options.getWorkers());
        cfg.setOrdered(options.isOrdered());
        return new DocumentImporter(reader, new DecodeEngine(converter, cfg));
    }

    public InputReader reader() {
        return reader;
    }

    /** Streams every record through the engine into {@code sink}; throws the first failure. */
    public ImportResult run(Consumer<Document> sink) throws ImportException, InterruptedException {
        try (DocumentStream docs = engine.stream(reader::nextRecord)) {
            long documents = docs.drainTo(sink);
            ImportResult result = new ImportResult(documents, reader.recordsRead(), reader.bytesConsumed());
            log.info("Imported {} documents ({} bytes)", documents, result.getBytes());
            return result;
        }
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    private static List<String> resolveFields(ImportOptions options) throws IOException {
        boolean explicit = !options.getFields().isEmpty() || options.getFieldFile() != null;
        if (options.isHeaderLine() && explicit) {
            throw new IllegalArgumentException("incompatible options: headerline and an explicit field list");
        }
        if (!options.isHeaderLine() && !explicit) {
            throw new IllegalArgumentException("a field list (fields or fieldFile) is required without headerline");
        }
        if (!options.getFields().isEmpty() && options.getFieldFile() != null) {
            throw new IllegalArgumentException("incompatible options: fields and fieldFile");
        }
        if (options.getFieldFile() != null) {
            return FieldLists.fromFile(options.getFieldFile());
        }
        return options.getFields();
    }

    private static InputReader newReader(InputStream in, Charset charset, List<String> fields, ImportOptions options)
            throws HeaderException {
        FieldValidator validator = new DefaultFieldValidator();
        if (options.getType() == InputType.TSV) {
            return new TsvInputReader(in, charset, fields, validator);
        }
        CsvFormatOptions csv = new CsvFormatOptions();
        csv.setParser(options.getCsvParser());
        csv.setDelimiter(options.getDelimiter());
        csv.setQuoteChar(options.getQuoteChar());
        return new CsvInputReader(in, charset, fields, validator, csv);
    }
}
