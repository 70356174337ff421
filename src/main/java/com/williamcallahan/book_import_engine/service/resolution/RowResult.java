package com.williamcallahan.book_import_engine.service.resolution;

import com.williamcallahan.book_import_engine.model.ImportErrorEntry;
import com.williamcallahan.book_import_engine.model.RowOutcome;

/**
 * Outcome of resolving one row.
 *
 * @param outcome result class
 * @param bookId catalog id on success or merge
 * @param label book label for activity lines
 * @param activity activity line describing the outcome
 * @param error error entry, present for errors and validation skips
 */
public record RowResult(RowOutcome outcome, String bookId, String label, String activity, ImportErrorEntry error) {

    public static RowResult success(String bookId, String label) {
        return new RowResult(RowOutcome.SUCCESS, bookId, label, "Added: " + label, null);
    }

    public static RowResult merged(String bookId, String label) {
        return new RowResult(RowOutcome.MERGED, bookId, label, "Merged with existing: " + label, null);
    }

    public static RowResult skipped(String label, String reason) {
        return new RowResult(RowOutcome.SKIPPED, null, label, "Skipped: " + reason, null);
    }

    public static RowResult skipped(String label, String reason, ImportErrorEntry error) {
        return new RowResult(RowOutcome.SKIPPED, null, label, "Skipped: " + reason, error);
    }

    public static RowResult error(String label, ImportErrorEntry error) {
        return new RowResult(RowOutcome.ERROR, null, label,
            "Error (" + error.type().getWireValue() + "): " + label, error);
    }
}
