package com.example.docimport;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenDocumentConverterTest {

    private static final List<String> FIELDS = List.of("a", "b", "c");

    @Test
    void pairsTokensWithFieldsVerbatim() throws Exception {
        Document doc = new TokenDocumentConverter().convert(FIELDS, List.of(" 1", "two words", "0042"), 0);
        assertEquals(List.of("a", "b", "c"), doc.names());
        assertEquals(" 1", doc.get("a"));
        assertEquals("two words", doc.get("b"));
        assertEquals("0042", doc.get("c"));
    }

    @Test
    void shortRecordGivesShorterDocument() throws Exception {
        Document doc = new TokenDocumentConverter().convert(FIELDS, List.of("1"), 3);
        assertEquals(1, doc.size());
        assertNull(doc.get("b"));
    }

    @Test
    void tooManyTokensIsConversionError() {
        ConversionException e = assertThrows(ConversionException.class,
                () -> new TokenDocumentConverter().convert(FIELDS, List.of("1", "2", "3", "4"), 6));
        assertEquals(6, e.index());
        assertEquals(7, e.recordNumber());
        assertTrue(e.getMessage().contains("#7"), e.getMessage());
    }

    @Test
    void ignoreBlanksDropsEmptyTokens() throws Exception {
        Document doc = new TokenDocumentConverter(true).convert(FIELDS, List.of("1", "", "3"), 0);
        assertEquals(List.of("a", "c"), doc.names());
    }

    @Test
    void duplicateFieldNamesStaySeparate() throws Exception {
        Document doc = new TokenDocumentConverter().convert(List.of("x", "x"), List.of("1", "2"), 0);
        assertEquals(2, doc.size());
        assertEquals("1", doc.entries().get(0).value());
        assertEquals("2", doc.entries().get(1).value());
    }

    @Test
    void inferringConverterParsesNumbers() throws Exception {
        TypeInferringDocumentConverter converter = new TypeInferringDocumentConverter(false);
        Document doc = converter.convert(List.of("i", "d", "s", "big", "exp"),
                List.of("-12", "3.5", "abc", "99999999999999999999", "1e3"), 0);
        assertEquals(-12L, doc.get("i"));
        assertEquals(3.5, doc.get("d"));
        assertEquals("abc", doc.get("s"));
        assertEquals(1e20, (Double) doc.get("big"), 1e5);
        assertEquals(1000.0, doc.get("exp"));
    }

    @Test
    void inferringConverterKeepsNonNumericText() throws Exception {
        Document doc = new TypeInferringDocumentConverter(false)
                .convert(List.of("a", "b", "c"), List.of("1.2.3", "", "NaN"), 0);
        assertEquals("1.2.3", doc.get("a"));
        assertEquals("", doc.get("b"));
        assertEquals("NaN", doc.get("c"));
    }
}
