/**
 * Background tasks for reading-history imports
 *
 * Features:
 * - Analysis validates and groups rows, then tries automatic matching
 * - Jobs with unmatched groups park their plan and wait in needs_book_matching
 * - Finalization runs on its own task once resolutions arrive
 * - The source file is released as soon as analysis is done
 */
package com.williamcallahan.book_import_engine.service.job;

import com.williamcallahan.book_import_engine.model.BookResolution;
import com.williamcallahan.book_import_engine.model.FieldMapping;
import com.williamcallahan.book_import_engine.model.ImportErrorEntry;
import com.williamcallahan.book_import_engine.model.ImportJobStatus;
import com.williamcallahan.book_import_engine.model.ImportJobUpdate;
import com.williamcallahan.book_import_engine.model.MatchingGroupView;
import com.williamcallahan.book_import_engine.model.RowOutcome;
import com.williamcallahan.book_import_engine.service.csv.DelimitedFileReader;
import com.williamcallahan.book_import_engine.service.csv.DelimitedFileReader.RowStream;
import com.williamcallahan.book_import_engine.service.detect.FormatDetectionResult;
import com.williamcallahan.book_import_engine.service.history.BookMatcher;
import com.williamcallahan.book_import_engine.service.history.PendingReadingHistoryPlans;
import com.williamcallahan.book_import_engine.service.history.ReadingDefaults;
import com.williamcallahan.book_import_engine.service.history.ReadingHistoryAnalysis;
import com.williamcallahan.book_import_engine.service.history.ReadingHistoryAnalyzer;
import com.williamcallahan.book_import_engine.service.history.ReadingHistoryFinalizer;
import com.williamcallahan.book_import_engine.service.history.ReadingHistoryGroup;
import com.williamcallahan.book_import_engine.service.history.ReadingHistoryPlan;
import com.williamcallahan.book_import_engine.service.telemetry.ImportProgressTracker;
import com.williamcallahan.book_import_engine.service.telemetry.ProgressTelemetryEmitter;
import com.williamcallahan.book_import_engine.service.telemetry.ProgressTelemetryEmitter.ProgressSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class ReadingHistoryJobRunner {

    public record Task(String owner,
                       String jobId,
                       Path sourcePath,
                       FormatDetectionResult detection,
                       FieldMapping mapping,
                       ReadingDefaults ownerDefaults,
                       String defaultReadingStatus) {
    }

    private final ImportJobStore jobStore;
    private final DelimitedFileReader fileReader;
    private final ReadingHistoryAnalyzer analyzer;
    private final BookMatcher bookMatcher;
    private final ReadingHistoryFinalizer finalizer;
    private final PendingReadingHistoryPlans pendingPlans;
    private final ProgressTelemetryEmitter telemetryEmitter;
    private final Clock clock;

    public ReadingHistoryJobRunner(ImportJobStore jobStore,
                                   DelimitedFileReader fileReader,
                                   ReadingHistoryAnalyzer analyzer,
                                   BookMatcher bookMatcher,
                                   ReadingHistoryFinalizer finalizer,
                                   PendingReadingHistoryPlans pendingPlans,
                                   ProgressTelemetryEmitter telemetryEmitter,
                                   Clock clock) {
        this.jobStore = jobStore;
        this.fileReader = fileReader;
        this.analyzer = analyzer;
        this.bookMatcher = bookMatcher;
        this.finalizer = finalizer;
        this.pendingPlans = pendingPlans;
        this.telemetryEmitter = telemetryEmitter;
        this.clock = clock;
    }

    /**
     * Analyzing phase. Ends either blocked in {@code needs_book_matching} or, when every group
     * was resolved automatically, by running finalization directly.
     */
    @Async("importJobExecutor")
    public void analyze(Task task) {
        ProgressSession session = telemetryEmitter.open(task.owner(), task.jobId());
        ImportProgressTracker tracker = new ImportProgressTracker(0);
        CancellationToken cancellation = new JobStoreCancellationToken(jobStore, task.owner(), task.jobId());
        ReadingHistoryPlan plan;
        List<MatchingGroupView> unresolved = new ArrayList<>();
        List<MatchingGroupView> booklessViews = new ArrayList<>();
        try {
            ReadingHistoryAnalysis analysis;
            try (RowStream rows = fileReader.open(task.sourcePath(), task.detection().delimiter(), task.detection().hasHeader())) {
                analysis = analyzer.analyze(rows, task.mapping(), task.ownerDefaults());
            }
            tracker.setTotal(analysis.rowCount());
            tracker.record(RowOutcome.SKIPPED, analysis.blankRows());
            for (ImportErrorEntry error : analysis.validationErrors()) {
                tracker.record(RowOutcome.SKIPPED);
                session.record(RowOutcome.SKIPPED, tracker.snapshot(), null,
                    "Skipped row " + error.row() + ": " + error.message(), error);
            }

            Map<String, BookResolution> autoResolutions = new LinkedHashMap<>();
            for (ReadingHistoryGroup group : analysis.groups()) {
                if (cancellation.isCancellationRequested()) {
                    finish(task, session, tracker, ImportJobStatus.CANCELLED, "Import cancelled", null);
                    return;
                }
                if (group.isBookless()) {
                    autoResolutions.put(group.getKey(), BookResolution.bookless());
                    booklessViews.add(new MatchingGroupView(group.getKey(), group.getDisplayName(), group.size(), List.of()));
                    continue;
                }
                Optional<String> match = bookMatcher.autoMatch(task.owner(), group.getDisplayName());
                if (match.isPresent()) {
                    autoResolutions.put(group.getKey(), BookResolution.match(match.get()));
                } else {
                    unresolved.add(new MatchingGroupView(group.getKey(), group.getDisplayName(), group.size(),
                        bookMatcher.candidates(task.owner(), group.getDisplayName())));
                }
            }
            plan = new ReadingHistoryPlan(task.jobId(), task.owner(), analysis.groups(), autoResolutions,
                tracker.snapshot(), task.defaultReadingStatus());
            log.info("Reading history import {} analyzed: {} groups, {} matched automatically, {} need matching",
                task.jobId(), analysis.groups().size(), autoResolutions.size(), unresolved.size());
        } catch (IOException | RuntimeException e) {
            log.error("Reading history analysis for job {} failed", task.jobId(), e);
            finish(task, session, tracker, ImportJobStatus.FAILED, "Import failed: " + e.getMessage(), e.getMessage());
            return;
        } finally {
            ImportSourceFiles.delete(task.sourcePath(), task.jobId());
        }

        if (cancellation.isCancellationRequested()) {
            finish(task, session, tracker, ImportJobStatus.CANCELLED, "Import cancelled", null);
            return;
        }
        if (unresolved.isEmpty()) {
            jobStore.update(task.owner(), task.jobId(), ImportJobUpdate.builder()
                .status(ImportJobStatus.RUNNING)
                .counters(tracker.snapshot())
                .build());
            finalizePlan(plan, Map.of());
            return;
        }
        // bookless groups are listed as well; a resolution may still assign them a book
        List<MatchingGroupView> views = new ArrayList<>(unresolved);
        views.addAll(booklessViews);
        pendingPlans.put(plan);
        session.flush(tracker.snapshot());
        jobStore.update(task.owner(), task.jobId(), ImportJobUpdate.builder()
            .status(ImportJobStatus.NEEDS_BOOK_MATCHING)
            .matchingGroups(views)
            .activityLine(unresolved.size() + " books need matching")
            .build());
    }

    /**
     * Processing phase for a plan taken from the pending store (or produced by analysis).
     */
    @Async("importJobExecutor")
    public void finalizePlan(ReadingHistoryPlan plan, Map<String, BookResolution> resolutions) {
        ProgressSession session = telemetryEmitter.open(plan.owner(), plan.jobId());
        ImportProgressTracker tracker = ImportProgressTracker.resume(plan.analysisCounters());
        CancellationToken cancellation = new JobStoreCancellationToken(jobStore, plan.owner(), plan.jobId());
        jobStore.update(plan.owner(), plan.jobId(), ImportJobUpdate.builder()
            .status(ImportJobStatus.PROCESSING)
            .matchingGroups(List.of())
            .build());
        try {
            ImportJobStatus status = finalizer.finalizePlan(plan, resolutions, tracker, session, cancellation);
            String message = switch (status) {
                case CANCELLED -> "Import cancelled";
                case COMPLETED_WITH_ERRORS -> "Import finished with " + tracker.getErrors() + " errors";
                default -> "Import finished";
            };
            finish(plan.owner(), plan.jobId(), session, tracker, status, message, null);
            tracker.logProgress(plan.jobId());
        } catch (RuntimeException e) {
            log.error("Reading history finalization for job {} failed", plan.jobId(), e);
            finish(plan.owner(), plan.jobId(), session, tracker, ImportJobStatus.FAILED,
                "Import failed: " + e.getMessage(), e.getMessage());
        }
    }

    private void finish(Task task, ProgressSession session, ImportProgressTracker tracker,
                        ImportJobStatus status, String message, String failure) {
        finish(task.owner(), task.jobId(), session, tracker, status, message, failure);
    }

    private void finish(String owner, String jobId, ProgressSession session, ImportProgressTracker tracker,
                        ImportJobStatus status, String message, String failure) {
        session.flush(tracker.snapshot());
        jobStore.update(owner, jobId, ImportJobUpdate.builder()
            .status(status)
            .activityLine(message)
            .failureMessage(failure)
            .completedAt(clock.instant())
            .build());
    }
}
