package com.example.docimport;

import lombok.Data;

@Data
public class ImportResult {
    private final long documents;
    private final long records;
    private final long bytes;
}
