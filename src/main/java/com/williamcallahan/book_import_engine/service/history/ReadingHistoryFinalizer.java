/**
 * Processing phase of a reading-history import
 *
 * Features:
 * - Resolves each group to a catalog book id according to its resolution
 * - Creates one reading-log entry per source row of the group
 * - Group and entry failures are counted and logged without stopping the job
 * - Honors cancellation between entries
 */
package com.williamcallahan.book_import_engine.service.history;

import com.williamcallahan.book_import_engine.catalog.CatalogGateway;
import com.williamcallahan.book_import_engine.catalog.CreateResult;
import com.williamcallahan.book_import_engine.catalog.ReadingLogGateway;
import com.williamcallahan.book_import_engine.exception.CatalogOperationException;
import com.williamcallahan.book_import_engine.model.BookResolution;
import com.williamcallahan.book_import_engine.model.CandidateBook;
import com.williamcallahan.book_import_engine.model.ImportErrorEntry;
import com.williamcallahan.book_import_engine.model.ImportErrorType;
import com.williamcallahan.book_import_engine.model.ImportJobStatus;
import com.williamcallahan.book_import_engine.model.MetadataRecord;
import com.williamcallahan.book_import_engine.model.ReadingLogEntry;
import com.williamcallahan.book_import_engine.model.RowOutcome;
import com.williamcallahan.book_import_engine.service.job.CancellationToken;
import com.williamcallahan.book_import_engine.service.provider.MetadataLookupService;
import com.williamcallahan.book_import_engine.service.resolution.CandidateBookFactory;
import com.williamcallahan.book_import_engine.service.resolution.EnrichmentMerger;
import com.williamcallahan.book_import_engine.service.telemetry.ImportProgressTracker;
import com.williamcallahan.book_import_engine.service.telemetry.ProgressTelemetryEmitter.ProgressSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class ReadingHistoryFinalizer {

    private static final Duration LOOKUP_TIMEOUT = Duration.ofSeconds(20);

    private final CatalogGateway catalog;
    private final ReadingLogGateway readingLogs;
    private final MetadataLookupService lookupService;
    private final EnrichmentMerger enrichmentMerger;

    public ReadingHistoryFinalizer(CatalogGateway catalog,
                                   ReadingLogGateway readingLogs,
                                   MetadataLookupService lookupService,
                                   EnrichmentMerger enrichmentMerger) {
        this.catalog = catalog;
        this.readingLogs = readingLogs;
        this.lookupService = lookupService;
        this.enrichmentMerger = enrichmentMerger;
    }

    /**
     * Runs every group of the plan.
     *
     * @param resolutions human-supplied resolutions; they override automatic ones and groups
     *                    with neither are skipped
     * @return the terminal status for the job
     */
    public ImportJobStatus finalizePlan(ReadingHistoryPlan plan,
                                        Map<String, BookResolution> resolutions,
                                        ImportProgressTracker tracker,
                                        ProgressSession session,
                                        CancellationToken cancellation) {
        for (ReadingHistoryGroup group : plan.groups()) {
            if (cancellation.isCancellationRequested()) {
                log.info("Reading history import {} cancelled before group '{}'", plan.jobId(), group.getDisplayName());
                return ImportJobStatus.CANCELLED;
            }
            BookResolution resolution = resolutionFor(group, plan, resolutions);
            if (resolution.action() == BookResolution.Action.SKIP) {
                tracker.record(RowOutcome.SKIPPED, group.size());
                session.record(RowOutcome.SKIPPED, tracker.snapshot(), group.getDisplayName(),
                    "Skipped " + group.size() + " entries for: " + group.getDisplayName(), null);
                continue;
            }

            String bookId;
            try {
                bookId = resolveBookId(plan, group, resolution, tracker);
            } catch (RuntimeException e) {
                ImportErrorType type = groupErrorType(e);
                if (type == ImportErrorType.EXCEPTION) {
                    log.error("Unexpected failure resolving book for group '{}' of job {}", group.getKey(), plan.jobId(), e);
                } else {
                    log.warn("Could not resolve book for group '{}' of job {}: {}", group.getKey(), plan.jobId(), e.getMessage());
                }
                failGroup(group, type, e.getMessage(), tracker, session);
                continue;
            }

            for (ReadingHistoryEntryDraft entry : group.getEntries()) {
                if (cancellation.isCancellationRequested()) {
                    log.info("Reading history import {} cancelled at row {}", plan.jobId(), entry.rowNumber());
                    return ImportJobStatus.CANCELLED;
                }
                createEntry(plan, group, entry, bookId, tracker, session);
            }
        }
        return tracker.getErrors() > 0 ? ImportJobStatus.COMPLETED_WITH_ERRORS : ImportJobStatus.COMPLETED;
    }

    static BookResolution resolutionFor(ReadingHistoryGroup group, ReadingHistoryPlan plan,
                                        Map<String, BookResolution> resolutions) {
        BookResolution supplied = resolutions == null ? null : resolutions.get(group.getKey());
        if (supplied != null) {
            return supplied;
        }
        return plan.autoResolutions().getOrDefault(group.getKey(), BookResolution.skip());
    }

    private String resolveBookId(ReadingHistoryPlan plan, ReadingHistoryGroup group,
                                 BookResolution resolution, ImportProgressTracker tracker) {
        return switch (resolution.action()) {
            case MATCH -> {
                if (resolution.bookId() == null || catalog.findById(resolution.bookId()).isEmpty()) {
                    throw new IllegalArgumentException("Matched book " + resolution.bookId() + " does not exist");
                }
                yield resolution.bookId();
            }
            case BOOKLESS -> catalog.unassignedBookId();
            case CREATE -> createBook(plan, group, resolution, tracker);
            case SKIP -> throw new IllegalStateException("Skipped groups have no book");
        };
    }

    private String createBook(ReadingHistoryPlan plan, ReadingHistoryGroup group,
                              BookResolution resolution, ImportProgressTracker tracker) {
        CandidateBook candidate = new CandidateBook();
        candidate.setTitle(resolution.title() != null && !resolution.title().isBlank()
            ? resolution.title().trim() : group.getDisplayName());
        candidate.setAuthors(resolution.authors());
        candidate.setReadingStatus(plan.defaultReadingStatus());
        if (resolution.isbn() != null) {
            CandidateBookFactory.applyIdentifier(candidate, resolution.isbn());
        }
        if (candidate.hasValidIsbn()) {
            fetchMetadata(candidate.getPreferredIsbn())
                .ifPresent(record -> enrichmentMerger.merge(candidate, record));
        }

        CreateResult result = catalog.create(candidate);
        if (result.isCreated()) {
            tracker.incrementBooksCreated();
            log.info("Created book {} ('{}') for reading history import {}", result.bookId(), candidate.getTitle(), plan.jobId());
        }
        catalog.upsertPersonalData(plan.owner(), result.bookId(), candidate.toPersonalData());
        return result.bookId();
    }

    private Optional<MetadataRecord> fetchMetadata(String isbn) {
        try {
            return lookupService.lookupByIsbn(isbn).blockOptional(LOOKUP_TIMEOUT);
        } catch (RuntimeException e) {
            log.warn("Metadata re-fetch for ISBN {} failed: {}", isbn, e.getMessage());
            return Optional.empty();
        }
    }

    private void createEntry(ReadingHistoryPlan plan, ReadingHistoryGroup group, ReadingHistoryEntryDraft entry,
                             String bookId, ImportProgressTracker tracker, ProgressSession session) {
        try {
            readingLogs.createEntry(new ReadingLogEntry(plan.owner(), bookId, entry.date(),
                entry.pagesRead(), entry.minutesRead(), entry.notes(), entry.rowNumber()));
            tracker.record(RowOutcome.SUCCESS);
            session.record(RowOutcome.SUCCESS, tracker.snapshot(), group.getDisplayName(),
                "Logged " + entry.date() + " for: " + group.getDisplayName(), null);
        } catch (RuntimeException e) {
            ImportErrorType type = e instanceof CatalogOperationException ? ImportErrorType.ADD_FAILED : ImportErrorType.EXCEPTION;
            log.warn("Reading log entry for row {} of job {} failed: {}", entry.rowNumber(), plan.jobId(), e.getMessage());
            tracker.record(RowOutcome.ERROR);
            ImportErrorEntry error = ImportErrorEntry.of(entry.rowNumber(), type, e.getMessage(), null,
                group.isBookless() ? null : group.getDisplayName(), null, entry.rawRow());
            session.record(RowOutcome.ERROR, tracker.snapshot(), group.getDisplayName(),
                "Error (" + type.getWireValue() + "): row " + entry.rowNumber(), error);
        }
    }

    /**
     * Rejections by the catalog, including a matched book that does not exist, are
     * {@code add_failed}; anything else is an unexpected {@code exception}.
     */
    static ImportErrorType groupErrorType(RuntimeException e) {
        return e instanceof CatalogOperationException || e instanceof IllegalArgumentException
            ? ImportErrorType.ADD_FAILED : ImportErrorType.EXCEPTION;
    }

    private void failGroup(ReadingHistoryGroup group, ImportErrorType type, String message,
                           ImportProgressTracker tracker, ProgressSession session) {
        for (ReadingHistoryEntryDraft entry : group.getEntries()) {
            tracker.record(RowOutcome.ERROR);
            ImportErrorEntry error = ImportErrorEntry.of(entry.rowNumber(), type, message,
                null, group.getDisplayName(), null, entry.rawRow());
            session.record(RowOutcome.ERROR, tracker.snapshot(), group.getDisplayName(),
                "Error (" + type.getWireValue() + "): row " + entry.rowNumber(), error);
        }
    }
}
