package com.example.docimport;

import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import com.univocity.parsers.csv.UnescapedQuoteHandling;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.util.Arrays;
import java.util.List;

/**
 * uniVocity implementation (default).
 * <p>
 * Stray quotes inside a quoted value raise an error. uniVocity itself accepts a quoted value left
 * open at end of input, so the framer keeps one row of lookahead: when the lookahead hits end of
 * input while a quote is still open, the current row is the broken one.
 */
@Slf4j
public class UniVocityCsvRecordFramer implements CsvRecordFramer {

    private final CsvFormatOptions cfg;
    private CsvParser parser;
    private QuoteTrackingReader quotes;

    private boolean primed = false;
    private String[] pending;
    private RuntimeException pendingError;

    public UniVocityCsvRecordFramer(CsvFormatOptions cfg) {
        this.cfg = cfg;
    }

    @Override
    public void begin(Reader reader) {
        CsvParserSettings settings = new CsvParserSettings();
        settings.getFormat().setDelimiter(cfg.getDelimiter());
        settings.getFormat().setQuote(cfg.getQuoteChar());
        settings.getFormat().setQuoteEscape(cfg.getQuoteChar());
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setCommentProcessingEnabled(false);
        settings.setIgnoreLeadingWhitespaces(true);
        settings.setIgnoreTrailingWhitespaces(false);
        settings.setSkipEmptyLines(true);
        settings.setNullValue("");
        settings.setEmptyValue("");
        settings.setMaxCharsPerColumn(-1);
        settings.setMaxColumns(cfg.getMaxColumns());
        settings.setUnescapedQuoteHandling(UnescapedQuoteHandling.RAISE_ERROR);
        // bytes must be pulled on the caller's thread so the size counter stays single-writer
        settings.setReadInputOnSeparateThread(false);
        quotes = new QuoteTrackingReader(reader, cfg.getDelimiter(), cfg.getQuoteChar());
        parser = new CsvParser(settings);
        parser.beginParsing(quotes);
        log.debug("uniVocity framer started: delimiter='{}', quote='{}'", cfg.getDelimiter(), cfg.getQuoteChar());
    }

    @Override
    public List<String> next() throws IOException {
        if (!primed) {
            primed = true;
            pending = parser.parseNext();
        }
        if (pendingError != null) {
            RuntimeException e = pendingError;
            pendingError = null;
            throw e;
        }
        String[] row = pending;
        if (row == null) {
            return null;
        }
        try {
            pending = parser.parseNext();
        } catch (RuntimeException e) {
            pending = null;
            pendingError = e;
        }
        if (pending == null && pendingError == null && quotes.endedInsideQuote()) {
            throw new IOException("unterminated quoted field at end of input");
        }
        return Arrays.asList(row);
    }

    @Override
    public void close() {
        if (parser != null) {
            parser.stopParsing();
        }
    }
}
