package com.example.docimport;

import java.util.Locale;

public enum InputType {
    CSV,
    TSV;

    public static InputType parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unsupported input type '" + name + "', expected csv or tsv", e);
        }
    }
}
