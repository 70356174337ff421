package com.williamcallahan.book_import_engine.model;

/**
 * Immutable snapshot of a job's progress counters as exposed to pollers.
 */
public record ImportCounters(int total,
                             int processed,
                             int success,
                             int merged,
                             int errors,
                             int skipped,
                             int booksCreated) {

    public static ImportCounters empty() {
        return new ImportCounters(0, 0, 0, 0, 0, 0, 0);
    }

    public static ImportCounters ofTotal(int total) {
        return new ImportCounters(total, 0, 0, 0, 0, 0, 0);
    }

    public double progressPercentage() {
        if (total <= 0) {
            return 0.0;
        }
        return Math.min(100.0, (double) processed / total * 100);
    }
}
