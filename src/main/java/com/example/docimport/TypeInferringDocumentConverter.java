package com.example.docimport;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Integer literals become {@link Long}, floating point literals become {@link Double}, anything
 * else stays a string.
 */
public class TypeInferringDocumentConverter extends TokenDocumentConverter {

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

    public TypeInferringDocumentConverter(boolean ignoreBlanks) {
        super(ignoreBlanks);
    }

    @Override
    protected Object valueOf(String token, long index) {
        if (INTEGER.matcher(token).matches() && new BigInteger(token).bitLength() < Long.SIZE) {
            return Long.parseLong(token);
        }
        if (DECIMAL.matcher(token).matches()) {
            return Double.parseDouble(token);
        }
        return token;
    }
}
