package com.williamcallahan.book_import_engine.service.telemetry;

import com.williamcallahan.book_import_engine.model.ImportCounters;
import com.williamcallahan.book_import_engine.model.RowOutcome;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ImportProgressTrackerTest {

    @Test
    void processedIsSumOfOutcomes() {
        ImportProgressTracker tracker = new ImportProgressTracker(6);

        tracker.record(RowOutcome.SUCCESS);
        tracker.record(RowOutcome.MERGED);
        tracker.record(RowOutcome.ERROR);
        tracker.record(RowOutcome.SKIPPED, 2);
        tracker.incrementBooksCreated();

        ImportCounters counters = tracker.snapshot();
        assertThat(counters.processed()).isEqualTo(5);
        assertThat(counters.success() + counters.merged() + counters.errors() + counters.skipped())
            .isEqualTo(counters.processed());
        assertThat(counters.booksCreated()).isEqualTo(1);
        assertThat(counters.progressPercentage()).isCloseTo(83.33, within(0.01));
    }

    @Test
    void resumeContinuesFromSnapshot() {
        ImportProgressTracker tracker = ImportProgressTracker.resume(new ImportCounters(10, 4, 1, 0, 1, 2, 1));

        tracker.record(RowOutcome.SUCCESS);

        assertThat(tracker.snapshot()).isEqualTo(new ImportCounters(10, 5, 2, 0, 1, 2, 1));
    }

    @Test
    void zeroTotalReportsZeroPercent() {
        assertThat(new ImportProgressTracker(0).snapshot().progressPercentage()).isZero();
    }
}
