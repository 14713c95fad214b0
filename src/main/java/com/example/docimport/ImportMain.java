package com.example.docimport;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line entry point: imports a CSV or TSV file and writes one JSON document per line.
 *
 * Example usage:
 * java -jar docimport.jar csv people.csv people.jsonl headerline=true workers=8 ordered=false
 */
@Slf4j
public class ImportMain {

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.out.println("Usage: java -jar docimport.jar <csv|tsv> <inputFile|-> [outputFile|-] [key=value ...]");
            System.out.println("Keys: headerline, fields=a,b,c, fieldFile, ordered, workers, parser=univocity|commons,");
            System.out.println("      delimiter, quote, ignoreBlanks, inferTypes, encoding=<name>|auto");
            System.out.println("Example: java -jar docimport.jar csv input.csv out.jsonl headerline=true workers=4");
            return;
        }
        ImportOptions options = parseArgs(args);
        log.info("Options: {}", options);

        long start = System.currentTimeMillis();
        try (InputStream in = openInput(options.getInput());
             OutputStream out = openOutput(options.getOutput());
             JsonLinesDocumentWriter writer = new JsonLinesDocumentWriter(out);
             DocumentImporter importer = DocumentImporter.open(in, options)) {
            ImportResult result = importer.run(writer::accept);
            writer.flush();
            long end = System.currentTimeMillis();
            log.info("Completed. Documents: {}, Bytes: {}, Time(s): {}",
                    result.getDocuments(), result.getBytes(), (end - start) / 1000.0);
        } catch (Throwable t) {
            log.error("Import failed: {}", t.getMessage(), t);
            throw t;
        }
    }

    static ImportOptions parseArgs(String[] args) {
        ImportOptions options = new ImportOptions();
        options.setType(InputType.parse(args[0]));
        options.setInput(args[1]);
        int next = 2;
        if (args.length > 2 && !args[2].contains("=")) {
            options.setOutput(args[2]);
            next = 3;
        }
        for (int i = next; i < args.length; i++) {
            int eq = args[i].indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("expected key=value, got '" + args[i] + "'");
            }
            apply(options, args[i].substring(0, eq), args[i].substring(eq + 1));
        }
        return options;
    }

    private static void apply(ImportOptions options, String key, String value) {
        switch (key) {
            case "headerline":
                options.setHeaderLine(Boolean.parseBoolean(value));
                break;
            case "fields":
                options.setFields(FieldLists.parse(value));
                break;
            case "fieldFile":
                options.setFieldFile(Path.of(value));
                break;
            case "ordered":
                options.setOrdered(Boolean.parseBoolean(value));
                break;
            case "workers":
                options.setWorkers(Integer.parseInt(value));
                break;
            case "parser":
                options.setCsvParser(value);
                break;
            case "delimiter":
                options.setDelimiter(singleChar(key, value));
                break;
            case "quote":
                options.setQuoteChar(singleChar(key, value));
                break;
            case "ignoreBlanks":
                options.setIgnoreBlanks(Boolean.parseBoolean(value));
                break;
            case "inferTypes":
                options.setInferTypes(Boolean.parseBoolean(value));
                break;
            case "encoding":
                options.setEncoding(value);
                break;
            default:
                throw new IllegalArgumentException("unknown option '" + key + "'");
        }
    }

    private static char singleChar(String key, String value) {
        if ("\\t".equals(value)) return '\t';
        if (value.length() != 1) {
            throw new IllegalArgumentException(key + " must be a single character, got '" + value + "'");
        }
        return value.charAt(0);
    }

    private static InputStream openInput(String input) throws IOException {
        if ("-".equals(input)) {
            return System.in;
        }
        return Files.newInputStream(Path.of(input));
    }

    private static OutputStream openOutput(String output) throws IOException {
        if ("-".equals(output)) {
            return new BufferedOutputStream(System.out) {
                @Override
                public void close() throws IOException {
                    flush();
                }
            };
        }
        return new BufferedOutputStream(Files.newOutputStream(Path.of(output)));
    }
}
