package com.williamcallahan.book_import_engine.service.history;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A validated reading-history row waiting for its group's book to be resolved. Durations are
 * already defaulted, so at least one of them is positive.
 */
public record ReadingHistoryEntryDraft(int rowNumber,
                                       String bookName,
                                       LocalDate date,
                                       int pagesRead,
                                       int minutesRead,
                                       String notes,
                                       Map<String, String> rawRow) {

    public ReadingHistoryEntryDraft {
        rawRow = rawRow == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawRow));
    }
}
