package com.example.docimport;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ImportMainTest {

    @TempDir
    Path tmp;

    @Test
    void parsesPositionalAndKeyValueArguments() {
        ImportOptions o = ImportMain.parseArgs(new String[]{
                "tsv", "in.tsv", "out.jsonl", "fields=a,b", "ordered=false", "workers=3",
                "delimiter=;", "ignoreBlanks=true", "encoding=auto"});
        assertEquals(InputType.TSV, o.getType());
        assertEquals("in.tsv", o.getInput());
        assertEquals("out.jsonl", o.getOutput());
        assertEquals(List.of("a", "b"), o.getFields());
        assertFalse(o.isOrdered());
        assertEquals(3, o.getWorkers());
        assertEquals(';', o.getDelimiter());
        assertTrue(o.isIgnoreBlanks());
        assertEquals("auto", o.getEncoding());
    }

    @Test
    void outputDefaultsToStdout() {
        ImportOptions o = ImportMain.parseArgs(new String[]{"csv", "-", "headerline=true", "delimiter=\\t"});
        assertEquals("-", o.getOutput());
        assertTrue(o.isHeaderLine());
        assertEquals('\t', o.getDelimiter());
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> ImportMain.parseArgs(new String[]{"xml", "in"}));
        assertThrows(IllegalArgumentException.class,
                () -> ImportMain.parseArgs(new String[]{"csv", "in", "out", "nosuch=1"}));
        assertThrows(IllegalArgumentException.class,
                () -> ImportMain.parseArgs(new String[]{"csv", "in", "out", "quote=ab"}));
        assertThrows(IllegalArgumentException.class,
                () -> ImportMain.parseArgs(new String[]{"csv", "in", "out", "headerline"}));
    }

    @Test
    void importsFileToJsonLines() throws Exception {
        Path in = tmp.resolve("people.csv");
        Path out = tmp.resolve("people.jsonl");
        Files.writeString(in, "name,age\nann,31\n\"bob, jr\",7\n", StandardCharsets.UTF_8);

        ImportMain.main(new String[]{"csv", in.toString(), out.toString(), "headerline=true", "inferTypes=true",
                "workers=2"});

        assertEquals(List.of("{\"name\":\"ann\",\"age\":31}", "{\"name\":\"bob, jr\",\"age\":7}"),
                Files.readAllLines(out, StandardCharsets.UTF_8));
    }

    @Test
    void failedImportPropagatesTheError() throws Exception {
        Path in = tmp.resolve("bad.csv");
        Files.writeString(in, "a,a\n1,2\n", StandardCharsets.UTF_8);
        assertThrows(HeaderException.class, () -> ImportMain.main(new String[]{
                "csv", in.toString(), tmp.resolve("out.jsonl").toString(), "headerline=true"}));
    }
}
