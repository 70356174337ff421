/**
 * Background task for standard book imports
 *
 * Features:
 * - Provisions custom fields before the row loop, typing unknown ones from the first rows
 * - Runs one enrichment pass over every identifier in the file, then the row loop
 * - Rows are resolved strictly in file order
 * - Cancellation is checked between rows and keeps what was already written
 * - Only an unreadable file or a fault outside the row boundary fails the job
 */
package com.williamcallahan.book_import_engine.service.job;

import com.williamcallahan.book_import_engine.model.CanonicalField;
import com.williamcallahan.book_import_engine.model.FieldMapping;
import com.williamcallahan.book_import_engine.model.ImportJobStatus;
import com.williamcallahan.book_import_engine.model.ImportJobUpdate;
import com.williamcallahan.book_import_engine.model.RowOutcome;
import com.williamcallahan.book_import_engine.service.csv.DelimitedFileReader;
import com.williamcallahan.book_import_engine.service.csv.DelimitedFileReader.RowStream;
import com.williamcallahan.book_import_engine.service.csv.ImportRow;
import com.williamcallahan.book_import_engine.service.detect.FormatDetectionResult;
import com.williamcallahan.book_import_engine.service.enrichment.EnrichmentIndex;
import com.williamcallahan.book_import_engine.service.enrichment.MetadataEnrichmentBatcher;
import com.williamcallahan.book_import_engine.service.resolution.BookResolutionEngine;
import com.williamcallahan.book_import_engine.service.resolution.CustomFieldProvisioner;
import com.williamcallahan.book_import_engine.service.resolution.CustomFieldTypeInferrer;
import com.williamcallahan.book_import_engine.service.resolution.ResolutionContext;
import com.williamcallahan.book_import_engine.service.resolution.RowResult;
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

@Component
@Slf4j
public class BookImportJobRunner {

    /**
     * Everything the background task needs, fixed when the job is created.
     */
    public record Task(String owner,
                       String jobId,
                       Path sourcePath,
                       FormatDetectionResult detection,
                       FieldMapping mapping,
                       boolean enrichmentEnabled,
                       String defaultReadingStatus) {
    }

    private final ImportJobStore jobStore;
    private final DelimitedFileReader fileReader;
    private final CustomFieldProvisioner customFieldProvisioner;
    private final MetadataEnrichmentBatcher enrichmentBatcher;
    private final BookResolutionEngine resolutionEngine;
    private final ProgressTelemetryEmitter telemetryEmitter;
    private final Clock clock;

    public BookImportJobRunner(ImportJobStore jobStore,
                               DelimitedFileReader fileReader,
                               CustomFieldProvisioner customFieldProvisioner,
                               MetadataEnrichmentBatcher enrichmentBatcher,
                               BookResolutionEngine resolutionEngine,
                               ProgressTelemetryEmitter telemetryEmitter,
                               Clock clock) {
        this.jobStore = jobStore;
        this.fileReader = fileReader;
        this.customFieldProvisioner = customFieldProvisioner;
        this.enrichmentBatcher = enrichmentBatcher;
        this.resolutionEngine = resolutionEngine;
        this.telemetryEmitter = telemetryEmitter;
        this.clock = clock;
    }

    @Async("importJobExecutor")
    public void run(Task task) {
        ProgressSession session = telemetryEmitter.open(task.owner(), task.jobId());
        ImportProgressTracker tracker = new ImportProgressTracker(0);
        CancellationToken cancellation = new JobStoreCancellationToken(jobStore, task.owner(), task.jobId());
        FormatDetectionResult detection = task.detection();
        try {
            jobStore.update(task.owner(), task.jobId(), ImportJobUpdate.status(ImportJobStatus.RUNNING));
            tracker.setTotal(fileReader.countRows(task.sourcePath(), detection.delimiter(), detection.hasHeader()));
            log.info("Starting book import {} for owner {}: {} rows, format {}",
                task.jobId(), task.owner(), tracker.snapshot().total(), detection.format().getWireValue());

            CustomFieldProvisioner.Result provisioned = customFieldProvisioner.provision(task.owner(), task.mapping(),
                sampleCustomColumns(task));
            FieldMapping mapping = provisioned.mapping();
            jobStore.update(task.owner(), task.jobId(), ImportJobUpdate.builder()
                .fieldMapping(mapping.toTokens())
                .activityLines(provisioned.messages())
                .counters(tracker.snapshot())
                .build());

            EnrichmentIndex enrichment = EnrichmentIndex.notAttempted();
            if (task.enrichmentEnabled() && mapping.maps(CanonicalField.ISBN)) {
                List<String> identifiers = collectIdentifiers(task, mapping);
                session.note("Looking up metadata for " + identifiers.size() + " identifiers", tracker.snapshot());
                enrichment = enrichmentBatcher.enrich(task.jobId(), identifiers);
            }

            ResolutionContext context = new ResolutionContext(task.jobId(), task.owner(), mapping, enrichment,
                task.defaultReadingStatus());
            boolean cancelled = processRows(task, context, tracker, session, cancellation);

            ImportJobStatus finalStatus = cancelled ? ImportJobStatus.CANCELLED : ImportJobStatus.COMPLETED;
            session.flush(tracker.snapshot());
            jobStore.update(task.owner(), task.jobId(), ImportJobUpdate.builder()
                .status(finalStatus)
                .activityLine(cancelled ? "Import cancelled" : "Import finished")
                .completedAt(clock.instant())
                .build());
            tracker.logProgress(task.jobId());
        } catch (IOException | RuntimeException e) {
            log.error("Book import {} failed", task.jobId(), e);
            session.flush(tracker.snapshot());
            jobStore.update(task.owner(), task.jobId(), ImportJobUpdate.builder()
                .status(ImportJobStatus.FAILED)
                .failureMessage(e.getMessage())
                .activityLine("Import failed: " + e.getMessage())
                .completedAt(clock.instant())
                .build());
        } finally {
            ImportSourceFiles.delete(task.sourcePath(), task.jobId());
        }
    }

    /**
     * Non-empty values of each custom-mapped column within the first rows of the file.
     */
    private Map<String, List<String>> sampleCustomColumns(Task task) throws IOException {
        Map<String, List<String>> samples = new LinkedHashMap<>();
        if (task.mapping().customTargets().isEmpty()) {
            return samples;
        }
        try (RowStream rows = fileReader.open(task.sourcePath(), task.detection().delimiter(), task.detection().hasHeader())) {
            for (int read = 0; read < CustomFieldTypeInferrer.SAMPLE_SIZE && rows.hasNext(); read++) {
                ImportRow row = rows.next();
                for (String column : task.mapping().customTargets().keySet()) {
                    String value = row.value(column);
                    if (value != null && !value.isBlank()) {
                        samples.computeIfAbsent(column, key -> new ArrayList<>()).add(value);
                    }
                }
            }
        }
        return samples;
    }

    private List<String> collectIdentifiers(Task task, FieldMapping mapping) throws IOException {
        List<String> columns = mapping.columnsFor(CanonicalField.ISBN);
        List<String> identifiers = new ArrayList<>();
        try (RowStream rows = fileReader.open(task.sourcePath(), task.detection().delimiter(), task.detection().hasHeader())) {
            while (rows.hasNext()) {
                ImportRow row = rows.next();
                for (String column : columns) {
                    String value = row.value(column);
                    if (value != null) {
                        identifiers.add(value);
                    }
                }
            }
        }
        return identifiers;
    }

    /**
     * @return {@code true} if the loop stopped because of a cancellation request
     */
    private boolean processRows(Task task, ResolutionContext context, ImportProgressTracker tracker,
                                ProgressSession session, CancellationToken cancellation) throws IOException {
        try (RowStream rows = fileReader.open(task.sourcePath(), task.detection().delimiter(), task.detection().hasHeader())) {
            while (rows.hasNext()) {
                if (cancellation.isCancellationRequested()) {
                    log.info("Book import {} cancelled after {} rows", task.jobId(), tracker.getProcessed());
                    return true;
                }
                ImportRow row = rows.next();
                RowResult result = resolutionEngine.resolve(row, context);
                tracker.record(result.outcome());
                if (result.outcome() == RowOutcome.SUCCESS) {
                    tracker.incrementBooksCreated();
                }
                session.record(result.outcome(), tracker.snapshot(), result.label(), result.activity(), result.error());
            }
        }
        return false;
    }
}
