package com.example.docimport;

import lombok.Data;

@Data
public class EngineConfig {
    private int workers = Runtime.getRuntime().availableProcessors();
    private boolean ordered = true;
    private long pollIntervalMillis = 100;
}
