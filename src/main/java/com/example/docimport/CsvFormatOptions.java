package com.example.docimport;

import lombok.Data;

/**
 * CSV dialect and framing engine selection.
 */
@Data
public class CsvFormatOptions {
    private char delimiter = ',';
    private char quoteChar = '"';
    private String parser = "univocity"; // or "commons"
    private int maxColumns = 4096;
}
