package com.example.docimport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

/**
 * TSV reader: one record per newline-terminated line, tokens split on a literal tab, trailing
 * CR/LF characters stripped. A lone CR inside a line is data.
 * Empty tokens are kept, trailing ones included.
 */
public class TsvInputReader extends AbstractInputReader {

    static final char ENTRY_DELIMITER = '\n';
    static final char TOKEN_SEPARATOR = '\t';

    private final BufferedReader lines;

    public TsvInputReader(InputStream in, Charset charset, List<String> fields, FieldValidator validator)
            throws HeaderException {
        super(in, fields, validator);
        this.lines = new BufferedReader(new InputStreamReader(source, charset));
    }

    @Override
    protected List<String> readHeaderTokens() throws IOException {
        return readTokens();
    }

    @Override
    protected List<String> readTokens() throws IOException {
        String line = readLine();
        return line == null ? null : split(line);
    }

    /** Text up to the next '\n' with trailing '\r'/'\n' removed; a lone '\r' stays in the value. */
    private String readLine() throws IOException {
        StringBuilder sb = new StringBuilder();
        int c;
        while ((c = lines.read()) != -1) {
            if (c == ENTRY_DELIMITER) {
                return trimTerminators(sb);
            }
            sb.append((char) c);
        }
        return sb.length() == 0 ? null : trimTerminators(sb);
    }

    private static String trimTerminators(StringBuilder sb) {
        int end = sb.length();
        while (end > 0 && (sb.charAt(end - 1) == '\r' || sb.charAt(end - 1) == '\n')) {
            end--;
        }
        return sb.substring(0, end);
    }

    static List<String> split(String line) {
        List<String> tokens = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == TOKEN_SEPARATOR) {
                tokens.add(line.substring(start, i));
                start = i + 1;
            }
        }
        tokens.add(line.substring(start));
        return tokens;
    }

    @Override
    public void close() throws IOException {
        lines.close();
    }
}
