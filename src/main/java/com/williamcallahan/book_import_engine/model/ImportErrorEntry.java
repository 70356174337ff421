package com.williamcallahan.book_import_engine.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a job's bounded error log.
 *
 * @param row 1-based data row number (header excluded), or 0 for job-level entries
 * @param type error classification
 * @param message human readable reason
 * @param isbn identifier exactly as it appeared in the row, if any
 * @param title title from the row, if any
 * @param author primary author from the row, if any
 * @param rawRow the source row, column name to cell value
 * @param timestamp when the error was recorded
 */
public record ImportErrorEntry(int row,
                               ImportErrorType type,
                               String message,
                               String isbn,
                               String title,
                               String author,
                               Map<String, String> rawRow,
                               Instant timestamp) {

    public ImportErrorEntry {
        rawRow = rawRow == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(rawRow));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static ImportErrorEntry of(int row, ImportErrorType type, String message,
                                      String isbn, String title, String author,
                                      Map<String, String> rawRow) {
        return new ImportErrorEntry(row, type, message, isbn, title, author, rawRow, Instant.now());
    }
}
