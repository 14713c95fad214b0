package com.example.docimport;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Apache Commons CSV implementation (alternative). Surrounding spaces of unquoted values are
 * trimmed on both sides.
 */
@Slf4j
public class CommonsCsvRecordFramer implements CsvRecordFramer {

    private final CsvFormatOptions cfg;
    private CSVParser parser;
    private Iterator<CSVRecord> records;

    public CommonsCsvRecordFramer(CsvFormatOptions cfg) {
        this.cfg = cfg;
    }

    @Override
    public void begin(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT
                .withDelimiter(cfg.getDelimiter())
                .withQuote(cfg.getQuoteChar())
                .withIgnoreEmptyLines(true)
                .withIgnoreSurroundingSpaces();
        parser = format.parse(reader);
        records = parser.iterator();
        log.debug("commons-csv framer started: delimiter='{}', quote='{}'", cfg.getDelimiter(), cfg.getQuoteChar());
    }

    @Override
    public List<String> next() {
        if (!records.hasNext()) {
            return null;
        }
        CSVRecord rec = records.next();
        List<String> tokens = new ArrayList<>(rec.size());
        for (String value : rec) {
            tokens.add(value);
        }
        return tokens;
    }

    @Override
    public void close() throws IOException {
        if (parser != null) {
            parser.close();
        }
    }
}
