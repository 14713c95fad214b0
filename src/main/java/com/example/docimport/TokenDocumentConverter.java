package com.example.docimport;

import java.util.List;

/**
 * Pairs token i with field i and keeps the token text unchanged. A record with more tokens than
 * fields is rejected; a shorter record yields a shorter document.
 */
public class TokenDocumentConverter implements DocumentConverter {

    private final boolean ignoreBlanks;

    public TokenDocumentConverter() {
        this(false);
    }

    public TokenDocumentConverter(boolean ignoreBlanks) {
        this.ignoreBlanks = ignoreBlanks;
    }

    @Override
    public Document convert(List<String> fields, List<String> tokens, long index) throws ConversionException {
        if (tokens.size() > fields.size()) {
            throw new ConversionException(index,
                    "record has " + tokens.size() + " tokens but only " + fields.size() + " fields");
        }
        Document.Builder doc = Document.builder();
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (ignoreBlanks && token.isEmpty()) {
                continue;
            }
            doc.append(fields.get(i), valueOf(token, index));
        }
        return doc.build();
    }

    protected Object valueOf(String token, long index) throws ConversionException {
        return token;
    }
}
