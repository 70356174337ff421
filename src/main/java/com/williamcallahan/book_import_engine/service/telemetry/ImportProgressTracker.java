package com.williamcallahan.book_import_engine.service.telemetry;

import com.williamcallahan.book_import_engine.model.ImportCounters;
import com.williamcallahan.book_import_engine.model.RowOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Running counters for one import job, snapshotted into {@link ImportCounters} for each emit.
 */
public class ImportProgressTracker {
    private static final Logger log = LoggerFactory.getLogger(ImportProgressTracker.class);

    private final AtomicInteger total = new AtomicInteger(0);
    private final AtomicInteger processed = new AtomicInteger(0);
    private final AtomicInteger success = new AtomicInteger(0);
    private final AtomicInteger merged = new AtomicInteger(0);
    private final AtomicInteger errors = new AtomicInteger(0);
    private final AtomicInteger skipped = new AtomicInteger(0);
    private final AtomicInteger booksCreated = new AtomicInteger(0);
    private final Instant startTime = Instant.now();

    public ImportProgressTracker(int total) {
        this.total.set(total);
    }

    /**
     * Resumes counting from an earlier snapshot, e.g. after a reading-history job was unblocked.
     */
    public static ImportProgressTracker resume(ImportCounters counters) {
        ImportProgressTracker tracker = new ImportProgressTracker(counters.total());
        tracker.processed.set(counters.processed());
        tracker.success.set(counters.success());
        tracker.merged.set(counters.merged());
        tracker.errors.set(counters.errors());
        tracker.skipped.set(counters.skipped());
        tracker.booksCreated.set(counters.booksCreated());
        return tracker;
    }

    public void setTotal(int total) {
        this.total.set(total);
    }

    /**
     * Counts one processed row (or reading-history entry) under its outcome.
     */
    public void record(RowOutcome outcome) {
        processed.incrementAndGet();
        switch (outcome) {
            case SUCCESS -> success.incrementAndGet();
            case MERGED -> merged.incrementAndGet();
            case SKIPPED -> skipped.incrementAndGet();
            case ERROR -> errors.incrementAndGet();
        }
    }

    /**
     * Counts several entries as one outcome, e.g. every entry of a skipped reading-history group.
     */
    public void record(RowOutcome outcome, int count) {
        for (int i = 0; i < count; i++) {
            record(outcome);
        }
    }

    public void incrementBooksCreated() {
        booksCreated.incrementAndGet();
    }

    public int getProcessed() {
        return processed.get();
    }

    public int getErrors() {
        return errors.get();
    }

    public ImportCounters snapshot() {
        return new ImportCounters(total.get(), processed.get(), success.get(), merged.get(),
            errors.get(), skipped.get(), booksCreated.get());
    }

    public Duration getElapsedTime() {
        return Duration.between(startTime, Instant.now());
    }

    public void logProgress(String jobId) {
        ImportCounters counters = snapshot();
        log.info("Import {} progress: {}% - Success: {}, Merged: {}, Errors: {}, Skipped: {}, Total: {}, Elapsed: {}",
            jobId,
            String.format("%.2f", counters.progressPercentage()),
            counters.success(),
            counters.merged(),
            counters.errors(),
            counters.skipped(),
            counters.total(),
            getElapsedTime());
    }
}
