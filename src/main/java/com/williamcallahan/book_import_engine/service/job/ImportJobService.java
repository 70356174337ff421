/**
 * Entry point for triggering and observing import jobs
 *
 * Features:
 * - Detects the file format and validates the mapping before a job exists
 * - Maps files through an override, a chosen template, a detected template or the detected format
 * - Creates the job and hands it to a background runner, returning immediately
 * - Accepts book-matching resolutions exactly once per blocked reading-history job
 * - Cooperative cancellation and on-demand error reports
 */
package com.williamcallahan.book_import_engine.service.job;

import com.williamcallahan.book_import_engine.config.ImportProperties;
import com.williamcallahan.book_import_engine.exception.ImportJobNotFoundException;
import com.williamcallahan.book_import_engine.exception.ImportJobStateException;
import com.williamcallahan.book_import_engine.exception.UnsupportedImportFileException;
import com.williamcallahan.book_import_engine.model.BookResolution;
import com.williamcallahan.book_import_engine.model.CanonicalField;
import com.williamcallahan.book_import_engine.model.FieldMapping;
import com.williamcallahan.book_import_engine.model.ImportJob;
import com.williamcallahan.book_import_engine.model.ImportJobKind;
import com.williamcallahan.book_import_engine.model.ImportJobStatus;
import com.williamcallahan.book_import_engine.model.ImportJobUpdate;
import com.williamcallahan.book_import_engine.model.MappingTemplate;
import com.williamcallahan.book_import_engine.service.detect.FieldMapper;
import com.williamcallahan.book_import_engine.service.detect.FormatDetectionResult;
import com.williamcallahan.book_import_engine.service.detect.FormatDetector;
import com.williamcallahan.book_import_engine.service.detect.ImportFormat;
import com.williamcallahan.book_import_engine.service.history.PendingReadingHistoryPlans;
import com.williamcallahan.book_import_engine.service.history.ReadingHistoryGroup;
import com.williamcallahan.book_import_engine.service.history.ReadingHistoryPlan;
import com.williamcallahan.book_import_engine.service.telemetry.ImportErrorReportWriter;
import com.williamcallahan.book_import_engine.service.template.MappingTemplateService;
import com.williamcallahan.book_import_engine.util.ImportValueUtils;
import com.williamcallahan.book_import_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Collectors;

@Service
public class ImportJobService {

    private static final Logger logger = LoggerFactory.getLogger(ImportJobService.class);

    private final ImportJobStore jobStore;
    private final FormatDetector formatDetector;
    private final FieldMapper fieldMapper;
    private final BookImportJobRunner bookImportRunner;
    private final ReadingHistoryJobRunner readingHistoryRunner;
    private final PendingReadingHistoryPlans pendingPlans;
    private final ImportErrorReportWriter errorReportWriter;
    private final MappingTemplateService templateService;
    private final ImportProperties properties;
    private final Clock clock;

    public ImportJobService(ImportJobStore jobStore,
                            FormatDetector formatDetector,
                            FieldMapper fieldMapper,
                            BookImportJobRunner bookImportRunner,
                            ReadingHistoryJobRunner readingHistoryRunner,
                            PendingReadingHistoryPlans pendingPlans,
                            ImportErrorReportWriter errorReportWriter,
                            MappingTemplateService templateService,
                            ImportProperties properties,
                            Clock clock) {
        this.jobStore = jobStore;
        this.formatDetector = formatDetector;
        this.fieldMapper = fieldMapper;
        this.bookImportRunner = bookImportRunner;
        this.readingHistoryRunner = readingHistoryRunner;
        this.pendingPlans = pendingPlans;
        this.errorReportWriter = errorReportWriter;
        this.templateService = templateService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Classifies a file for a mapping preview without creating a job.
     *
     * @throws UnsupportedImportFileException when the file is unreadable or not importable
     */
    public FormatDetectionResult detect(Path path) {
        try {
            return formatDetector.detect(path);
        } catch (IOException e) {
            throw new UnsupportedImportFileException("Could not read import file: " + e.getMessage(), e);
        }
    }

    public ImportJob startBookImport(BookImportRequest request) {
        Objects.requireNonNull(request.owner(), "owner");
        FormatDetectionResult detection = detect(request.sourcePath());
        ResolvedMapping resolved = effectiveMapping(request.owner(), detection, request.mappingOverride(),
            request.mappingTemplateId(), detection.format(), ImportJobService::usableForBooks);
        FieldMapping mapping = resolved.mapping();
        if (!usableForBooks(mapping)) {
            throw new UnsupportedImportFileException("Mapping must include a title or an ISBN column");
        }
        boolean enrichment = request.enableEnrichment() != null
            ? request.enableEnrichment() : properties.getEnrichment().isEnabled();
        String readingStatus = defaultReadingStatus(request.defaultReadingStatus());

        ImportJob job = newJob(request.owner(), ImportJobKind.BOOK_IMPORT, ImportJobStatus.PENDING,
            request.sourcePath(), request.sourceFilename(), detection, mapping);
        job.setEnrichmentEnabled(enrichment);
        jobStore.create(request.owner(), job.getId(), job);
        noteTemplateUse(request.owner(), job.getId(), resolved.template());
        logger.info("Queued book import {} for owner {} ({}, confidence {})", job.getId(), request.owner(),
            detection.format().getWireValue(), String.format("%.2f", detection.confidence()));

        bookImportRunner.run(new BookImportJobRunner.Task(request.owner(), job.getId(), request.sourcePath(),
            detection, mapping, enrichment, readingStatus));
        return getJob(request.owner(), job.getId());
    }

    public ImportJob startReadingHistoryImport(ReadingHistoryImportRequest request) {
        Objects.requireNonNull(request.owner(), "owner");
        FormatDetectionResult detection = detect(request.sourcePath());
        ResolvedMapping resolved = effectiveMapping(request.owner(), detection, request.mappingOverride(),
            request.mappingTemplateId(), ImportFormat.READING_HISTORY, mapping -> mapping.maps(CanonicalField.DATE));
        FieldMapping mapping = resolved.mapping();
        if (!mapping.maps(CanonicalField.DATE)) {
            throw new UnsupportedImportFileException("Reading history mapping must include a date column");
        }

        ImportJob job = newJob(request.owner(), ImportJobKind.READING_HISTORY_IMPORT, ImportJobStatus.ANALYZING,
            request.sourcePath(), request.sourceFilename(), detection, mapping);
        job.setFormat(ImportFormat.READING_HISTORY.getWireValue());
        jobStore.create(request.owner(), job.getId(), job);
        noteTemplateUse(request.owner(), job.getId(), resolved.template());
        logger.info("Queued reading history import {} for owner {}", job.getId(), request.owner());

        readingHistoryRunner.analyze(new ReadingHistoryJobRunner.Task(request.owner(), job.getId(),
            request.sourcePath(), detection, mapping, request.ownerDefaults(),
            defaultReadingStatus(null)));
        return getJob(request.owner(), job.getId());
    }

    /**
     * Supplies book-matching decisions for a job blocked in {@code needs_book_matching}. Groups
     * without a decision are skipped.
     *
     * @throws ImportJobStateException if the job is not waiting for matching or resolutions were
     *                                 already submitted
     */
    public ImportJob submitBookResolutions(String owner, String jobId, Map<String, BookResolution> resolutions) {
        ImportJob job = getJob(owner, jobId);
        if (job.getStatus() != ImportJobStatus.NEEDS_BOOK_MATCHING) {
            throw new ImportJobStateException("Import job " + jobId + " is " + job.getStatus().getWireValue()
                + ", not waiting for book matching");
        }
        Map<String, BookResolution> supplied = resolutions == null ? Map.of() : resolutions;
        supplied.forEach(ImportJobService::validateResolution);

        ReadingHistoryPlan plan = pendingPlans.take(owner, jobId)
            .orElseThrow(() -> new ImportJobStateException("Resolutions for import job " + jobId + " were already submitted"));
        Set<String> known = plan.groups().stream().map(ReadingHistoryGroup::getKey).collect(Collectors.toSet());
        List<String> unknown = supplied.keySet().stream().filter(key -> !known.contains(key)).toList();
        if (!unknown.isEmpty()) {
            logger.warn("Ignoring resolutions for unknown groups {} of import job {}", unknown, jobId);
        }

        jobStore.update(owner, jobId, ImportJobUpdate.builder()
            .status(ImportJobStatus.RUNNING)
            .activityLine("Received " + supplied.size() + " book resolutions")
            .build());
        readingHistoryRunner.finalizePlan(plan, supplied);
        return getJob(owner, jobId);
    }

    /**
     * Flags a job for cancellation. A job parked in {@code needs_book_matching} has no running
     * loop and is cancelled right away.
     */
    public ImportJob requestCancellation(String owner, String jobId) {
        ImportJob job = getJob(owner, jobId);
        if (job.getStatus().isTerminal()) {
            throw new ImportJobStateException("Import job " + jobId + " already finished as " + job.getStatus().getWireValue());
        }
        if (job.getStatus() == ImportJobStatus.NEEDS_BOOK_MATCHING && pendingPlans.take(owner, jobId).isPresent()) {
            jobStore.update(owner, jobId, ImportJobUpdate.builder()
                .status(ImportJobStatus.CANCELLED)
                .cancelRequested(true)
                .matchingGroups(List.of())
                .activityLine("Import cancelled")
                .completedAt(clock.instant())
                .build());
        } else {
            jobStore.update(owner, jobId, ImportJobUpdate.builder()
                .cancelRequested(true)
                .activityLine("Cancellation requested")
                .build());
        }
        logger.info("Cancellation requested for import job {} (owner {})", jobId, owner);
        return getJob(owner, jobId);
    }

    public ImportJob getJob(String owner, String jobId) {
        return jobStore.get(owner, jobId).orElseThrow(() -> new ImportJobNotFoundException(owner, jobId));
    }

    public List<ImportJob> listJobs(String owner) {
        return jobStore.listForOwner(owner);
    }

    public byte[] renderErrorReport(String owner, String jobId) {
        ImportJob job = getJob(owner, jobId);
        return errorReportWriter.render(job.getErrorLog(), job.getSourceFilename());
    }

    /**
     * Mapping a job runs with, plus the template it came from, if any.
     */
    private record ResolvedMapping(FieldMapping mapping, MappingTemplate template) {
    }

    /**
     * Precedence: explicit override, requested template, detected template (when its mapping
     * is usable for this kind of import), then the detected or proposed format mapping.
     */
    private ResolvedMapping effectiveMapping(String owner, FormatDetectionResult detection, Map<String, String> override,
                                             String templateId, ImportFormat proposalFormat,
                                             Predicate<FieldMapping> usable) {
        if (override != null && !override.isEmpty()) {
            return new ResolvedMapping(fieldMapper.validateOverride(override, detection.headers()), null);
        }
        if (ValidationUtils.hasText(templateId)) {
            MappingTemplate template = templateService.getTemplate(owner, templateId);
            Map<String, String> columns = templateService.mappingFor(template, detection.headers());
            if (columns.isEmpty()) {
                throw new UnsupportedImportFileException("Mapping template '" + template.name()
                    + "' maps none of the file's columns");
            }
            return new ResolvedMapping(fieldMapper.validateOverride(columns, detection.headers()), template);
        }
        Optional<ResolvedMapping> detected = templateService.detectTemplate(owner, detection.headers())
            .map(template -> new ResolvedMapping(FieldMapping.fromTokens(
                templateService.mappingFor(template, detection.headers())), template))
            .filter(candidate -> usable.test(candidate.mapping()));
        if (detected.isPresent()) {
            return detected.get();
        }
        if (proposalFormat != detection.format()) {
            return new ResolvedMapping(fieldMapper.propose(proposalFormat, detection.headers()), null);
        }
        return new ResolvedMapping(detection.mapping(), null);
    }

    private void noteTemplateUse(String owner, String jobId, MappingTemplate template) {
        if (template == null) {
            return;
        }
        MappingTemplate used = templateService.recordUse(template);
        jobStore.update(owner, jobId, ImportJobUpdate.builder()
            .activityLine("Using mapping template '" + used.name() + "'")
            .build());
        logger.info("Import job {} mapped with template {} (used {} times)", jobId, used.id(), used.timesUsed());
    }

    private static boolean usableForBooks(FieldMapping mapping) {
        return mapping.maps(CanonicalField.TITLE) || mapping.maps(CanonicalField.ISBN);
    }

    private ImportJob newJob(String owner, ImportJobKind kind, ImportJobStatus status, Path sourcePath,
                             String sourceFilename, FormatDetectionResult detection, FieldMapping mapping) {
        ImportJob job = ImportJob.newJob(UUID.randomUUID().toString(), owner, kind, status, clock.instant());
        job.setSourcePath(sourcePath);
        job.setSourceFilename(sourceFilename != null ? sourceFilename
            : sourcePath.getFileName() != null ? sourcePath.getFileName().toString() : null);
        job.setFormat(detection.format().getWireValue());
        job.setFieldMapping(mapping.toTokens());
        return job;
    }

    private String defaultReadingStatus(String requested) {
        String normalized = ImportValueUtils.normalizeReadingStatus(requested);
        if (normalized != null) {
            return normalized;
        }
        String configured = ImportValueUtils.normalizeReadingStatus(properties.getDefaultReadingStatus());
        return configured != null ? configured : ImportValueUtils.STATUS_PLAN_TO_READ;
    }

    private static void validateResolution(String groupKey, BookResolution resolution) {
        if (resolution == null || resolution.action() == null) {
            throw new IllegalArgumentException("Resolution for group '" + groupKey + "' has no action");
        }
        if (resolution.action() == BookResolution.Action.MATCH && !ValidationUtils.hasText(resolution.bookId())) {
            throw new IllegalArgumentException("Match resolution for group '" + groupKey + "' needs a bookId");
        }
        if (resolution.action() == BookResolution.Action.CREATE && !ValidationUtils.hasText(resolution.title())
            && !ValidationUtils.hasText(resolution.isbn())) {
            throw new IllegalArgumentException("Create resolution for group '" + groupKey + "' needs a title or an ISBN");
        }
    }
}
