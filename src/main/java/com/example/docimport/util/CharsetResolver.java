package com.example.docimport.util;

import com.ibm.icu.text.CharsetDetector;
import com.ibm.icu.text.CharsetMatch;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Resolves input encodings by name, with alias fallbacks for code page style names, or detects
 * them from the leading bytes of the input with ICU4J.
 */
@Slf4j
public final class CharsetResolver {

    public static final String AUTO = "auto";

    private CharsetResolver() {}

    public static Charset resolve(String name) {
        if (name == null || name.trim().isEmpty()) {
            return StandardCharsets.UTF_8;
        }
        for (String candidate : candidates(name.trim())) {
            if (Charset.isSupported(candidate)) {
                Charset cs = Charset.forName(candidate);
                if (!candidate.equals(name.trim())) {
                    log.info("Resolved charset '{}' -> '{}'", name, cs.name());
                }
                return cs;
            }
        }
        throw new IllegalArgumentException("unsupported encoding: " + name);
    }

    /**
     * Guesses the charset of {@code in}, which must support mark/reset. No bytes are consumed.
     * Falls back to UTF-8 when ICU4J has no usable match.
     */
    public static Charset detect(InputStream in) throws IOException {
        if (!in.markSupported()) {
            throw new IllegalArgumentException("charset detection needs a stream that supports mark/reset");
        }
        CharsetDetector detector = new CharsetDetector();
        detector.setText(in);
        CharsetMatch match = detector.detect();
        if (match == null || !Charset.isSupported(match.getName())) {
            log.info("No charset detected, using UTF-8");
            return StandardCharsets.UTF_8;
        }
        log.info("Detected charset {} (confidence {})", match.getName(), match.getConfidence());
        return Charset.forName(match.getName());
    }

    static List<String> candidates(String original) {
        List<String> list = new ArrayList<>();
        list.add(original);
        String digits = original.replaceAll("\\D+", "");
        if (!digits.isEmpty()) {
            list.add("Cp" + digits);
            list.add("IBM" + digits);
            list.add("ibm-" + digits);
            list.add("windows-" + digits);
        }
        list.add(original.toUpperCase(Locale.ROOT).replace('_', '-'));
        List<String> out = new ArrayList<>();
        for (String s : list) {
            if (!out.contains(s) && isLegalName(s)) out.add(s);
        }
        return out;
    }

    private static boolean isLegalName(String name) {
        return name.matches("[A-Za-z0-9][A-Za-z0-9+\\-:._]*");
    }
}
