package com.williamcallahan.book_import_engine.model;

import java.time.LocalDate;

/**
 * One dated reading session tied to exactly one catalog book (or the unassigned placeholder).
 *
 * @param owner owner of the log
 * @param bookId resolved catalog book id
 * @param date day of the session
 * @param pagesRead pages read, zero when only minutes were tracked
 * @param minutesRead minutes read, zero when only pages were tracked
 * @param notes optional free text
 * @param sourceRow row number in the import file
 */
public record ReadingLogEntry(String owner,
                              String bookId,
                              LocalDate date,
                              int pagesRead,
                              int minutesRead,
                              String notes,
                              int sourceRow) {

    public ReadingLogEntry {
        if (pagesRead < 0 || minutesRead < 0) {
            throw new IllegalArgumentException("Reading durations must not be negative");
        }
        if (pagesRead == 0 && minutesRead == 0) {
            throw new IllegalArgumentException("A reading log entry needs pages or minutes greater than zero");
        }
    }
}
