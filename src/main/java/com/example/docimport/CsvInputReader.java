package com.example.docimport;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.List;

/**
 * CSV reader. Records may hold any number of tokens and quoted values may span lines.
 */
public class CsvInputReader extends AbstractInputReader {

    private final CsvRecordFramer framer;
    private final Charset charset;
    private boolean started = false;

    public CsvInputReader(InputStream in, Charset charset, List<String> fields, FieldValidator validator,
                          CsvFormatOptions options) throws HeaderException {
        super(in, fields, validator);
        this.framer = CsvRecordFramer.forOptions(options);
        this.charset = charset;
    }

    @Override
    protected List<String> readHeaderTokens() throws IOException {
        return readTokens();
    }

    @Override
    protected List<String> readTokens() throws IOException {
        if (!started) {
            started = true;
            framer.begin(new InputStreamReader(source, charset));
        }
        return framer.next();
    }

    @Override
    public void close() throws IOException {
        try {
            framer.close();
        } finally {
            source.close();
        }
    }
}
