/**
 * Reads delimited export files with Apache Commons CSV
 *
 * Features:
 * - Sniffs the delimiter from the header line (comma, semicolon, tab, pipe)
 * - UTF-8 with byte-order-mark stripping
 * - Trimmed values, empty lines ignored, rows shorter than the header padded
 * - Header-less single column files (bare ISBN lists) exposed under a synthetic column
 */
package com.williamcallahan.book_import_engine.service.csv;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

@Component
public class DelimitedFileReader {

    public static final String SYNTHETIC_ISBN_COLUMN = "ISBN";

    private static final char BOM = '\uFEFF';
    private static final char[] CANDIDATE_DELIMITERS = {',', ';', '\t', '|'};

    /**
     * Picks the candidate delimiter that occurs most often outside quotes in the header line;
     * comma wins ties and lines without any candidate.
     */
    public char sniffDelimiter(String headerLine) {
        if (headerLine == null) {
            return ',';
        }
        char best = ',';
        int bestCount = 0;
        for (char candidate : CANDIDATE_DELIMITERS) {
            int count = countOutsideQuotes(headerLine, candidate);
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    /**
     * First {@code maxLines} non-empty physical lines of the file, BOM removed.
     */
    public List<String> readSampleLines(Path path, int maxLines) throws IOException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while (lines.size() < maxLines && (line = reader.readLine()) != null) {
                if (lines.isEmpty()) {
                    line = stripBom(line);
                }
                if (!line.isBlank()) {
                    lines.add(line);
                }
            }
        }
        return lines;
    }

    /**
     * Reads only the header record of the file.
     */
    public List<String> readHeaders(Path path) throws IOException {
        List<String> sample = readSampleLines(path, 1);
        char delimiter = sniffDelimiter(sample.isEmpty() ? null : sample.get(0));
        try (RowStream stream = open(path, delimiter, true)) {
            return stream.headers();
        }
    }

    /**
     * Counts data rows without materializing them.
     */
    public int countRows(Path path, char delimiter, boolean hasHeader) throws IOException {
        int count = 0;
        try (RowStream stream = open(path, delimiter, hasHeader)) {
            while (stream.hasNext()) {
                stream.next();
                count++;
            }
        }
        return count;
    }

    /**
     * Opens a streaming view of the data rows.
     *
     * @param hasHeader when {@code false} the file is treated as a single-column identifier list
     *                  exposed under {@link #SYNTHETIC_ISBN_COLUMN}
     */
    public RowStream open(Path path, char delimiter, boolean hasHeader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setDelimiter(delimiter)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();
        Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        try {
            return new RowStream(new CSVParser(reader, format), hasHeader);
        } catch (IOException | RuntimeException e) {
            reader.close();
            throw e;
        }
    }

    private static int countOutsideQuotes(String line, char delimiter) {
        int count = 0;
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == delimiter && !quoted) {
                count++;
            }
        }
        return count;
    }

    static String stripBom(String value) {
        if (value != null && !value.isEmpty() && value.charAt(0) == BOM) {
            return value.substring(1);
        }
        return value;
    }

    public static class RowStream implements Iterator<ImportRow>, Closeable {
        private final CSVParser parser;
        private final Iterator<CSVRecord> iterator;
        private final List<String> headers;
        private int rowNumber;

        RowStream(CSVParser parser, boolean hasHeader) {
            this.parser = parser;
            this.iterator = parser.iterator();
            if (hasHeader && iterator.hasNext()) {
                this.headers = List.copyOf(uniqueHeaders(iterator.next()));
            } else if (hasHeader) {
                this.headers = List.of();
            } else {
                this.headers = List.of(SYNTHETIC_ISBN_COLUMN);
            }
        }

        public List<String> headers() {
            return headers;
        }

        @Override
        public boolean hasNext() {
            return iterator.hasNext();
        }

        @Override
        public ImportRow next() {
            if (!iterator.hasNext()) {
                throw new NoSuchElementException();
            }
            CSVRecord record = iterator.next();
            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < headers.size(); i++) {
                String value = i < record.size() ? record.get(i) : "";
                if (rowNumber == 0 && i == 0) {
                    value = stripBom(value);
                }
                values.put(headers.get(i), value);
            }
            rowNumber++;
            return new ImportRow(rowNumber, values);
        }

        @Override
        public void close() throws IOException {
            parser.close();
        }

        private static List<String> uniqueHeaders(CSVRecord record) {
            List<String> names = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < record.size(); i++) {
                String name = record.get(i);
                if (i == 0) {
                    name = stripBom(name);
                }
                name = name == null || name.isBlank() ? "column_" + (i + 1) : name.trim();
                String unique = name;
                int suffix = 2;
                while (!seen.add(unique)) {
                    unique = name + "_" + suffix++;
                }
                names.add(unique);
            }
            return names;
        }
    }
}
