package com.example.docimport;

import lombok.Data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Data
public class ImportOptions {
    private InputType type = InputType.CSV;
    private String input = "-";
    private String output = "-";
    private boolean headerLine = false;
    private List<String> fields = new ArrayList<>();
    private Path fieldFile;
    private boolean ordered = true;
    private int workers = Runtime.getRuntime().availableProcessors();
    private String csvParser = "univocity"; // or "commons"
    private char delimiter = ',';
    private char quoteChar = '"';
    private boolean ignoreBlanks = false;
    private boolean inferTypes = false;
    private String encoding = "UTF-8"; // or "auto"
}
