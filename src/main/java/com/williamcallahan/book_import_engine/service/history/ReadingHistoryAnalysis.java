package com.williamcallahan.book_import_engine.service.history;

import com.williamcallahan.book_import_engine.model.ImportErrorEntry;

import java.util.List;

/**
 * Result of the analyzing phase.
 *
 * @param groups entry groups in first-seen order
 * @param validationErrors one entry per rejected row
 * @param blankRows rows with no content at all
 */
public record ReadingHistoryAnalysis(List<ReadingHistoryGroup> groups,
                                     List<ImportErrorEntry> validationErrors,
                                     int blankRows) {

    public ReadingHistoryAnalysis {
        groups = List.copyOf(groups);
        validationErrors = List.copyOf(validationErrors);
    }

    public int entryCount() {
        return groups.stream().mapToInt(ReadingHistoryGroup::size).sum();
    }

    public int rowCount() {
        return entryCount() + validationErrors.size() + blankRows;
    }
}
