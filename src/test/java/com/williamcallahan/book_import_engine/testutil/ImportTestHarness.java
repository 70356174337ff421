package com.williamcallahan.book_import_engine.testutil;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.book_import_engine.catalog.memory.InMemoryCatalog;
import com.williamcallahan.book_import_engine.config.ImportProperties;
import com.williamcallahan.book_import_engine.service.csv.DelimitedFileReader;
import com.williamcallahan.book_import_engine.service.detect.FieldMapper;
import com.williamcallahan.book_import_engine.service.detect.FormatDetector;
import com.williamcallahan.book_import_engine.service.enrichment.MetadataEnrichmentBatcher;
import com.williamcallahan.book_import_engine.service.history.BookMatcher;
import com.williamcallahan.book_import_engine.service.history.PendingReadingHistoryPlans;
import com.williamcallahan.book_import_engine.service.history.ReadingHistoryAnalyzer;
import com.williamcallahan.book_import_engine.service.history.ReadingHistoryFinalizer;
import com.williamcallahan.book_import_engine.service.job.BookImportJobRunner;
import com.williamcallahan.book_import_engine.service.job.ImportJobService;
import com.williamcallahan.book_import_engine.service.job.InMemoryImportJobStore;
import com.williamcallahan.book_import_engine.service.job.ReadingHistoryJobRunner;
import com.williamcallahan.book_import_engine.service.provider.MetadataLookupService;
import com.williamcallahan.book_import_engine.service.provider.MetadataProvider;
import com.williamcallahan.book_import_engine.service.resolution.BookMergePlanner;
import com.williamcallahan.book_import_engine.service.resolution.BookResolutionEngine;
import com.williamcallahan.book_import_engine.service.resolution.CandidateBookFactory;
import com.williamcallahan.book_import_engine.service.resolution.CustomFieldProvisioner;
import com.williamcallahan.book_import_engine.service.resolution.EnrichmentMerger;
import com.williamcallahan.book_import_engine.service.telemetry.ImportErrorReportWriter;
import com.williamcallahan.book_import_engine.service.telemetry.ProgressTelemetryEmitter;
import com.williamcallahan.book_import_engine.service.template.MappingTemplateService;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Wires the import pipeline by hand. Runners are called directly, so jobs run synchronously on
 * the test thread.
 */
public class ImportTestHarness {

    public final ImportProperties properties = new ImportProperties();
    public final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    public final InMemoryCatalog catalog;
    public final InMemoryImportJobStore jobStore;
    public final MetadataLookupService lookupService;
    public final PendingReadingHistoryPlans pendingPlans;
    public final MappingTemplateService templates;
    public final ImportJobService service;

    public ImportTestHarness(MetadataProvider... providers) {
        this(new InMemoryCatalog(), providers);
    }

    public ImportTestHarness(InMemoryCatalog catalog, MetadataProvider... providers) {
        this.catalog = catalog;
        properties.getEnrichment().setJitterMin(Duration.ZERO);
        properties.getEnrichment().setJitterMax(Duration.ZERO);

        jobStore = new InMemoryImportJobStore(properties, clock);
        lookupService = new MetadataLookupService(List.of(providers));
        pendingPlans = new PendingReadingHistoryPlans(properties);
        templates = new MappingTemplateService(catalog, clock);

        DelimitedFileReader fileReader = new DelimitedFileReader();
        FieldMapper fieldMapper = new FieldMapper();
        EnrichmentMerger merger = new EnrichmentMerger();
        ProgressTelemetryEmitter emitter = new ProgressTelemetryEmitter(jobStore, properties, clock);

        BookImportJobRunner bookRunner = new BookImportJobRunner(jobStore, fileReader,
            new CustomFieldProvisioner(catalog),
            new MetadataEnrichmentBatcher(lookupService, properties),
            new BookResolutionEngine(catalog, new CandidateBookFactory(), merger, new BookMergePlanner()),
            emitter, clock);
        ReadingHistoryJobRunner historyRunner = new ReadingHistoryJobRunner(jobStore, fileReader,
            new ReadingHistoryAnalyzer(properties),
            new BookMatcher(catalog, lookupService, properties),
            new ReadingHistoryFinalizer(catalog, catalog, lookupService, merger),
            pendingPlans, emitter, clock);

        service = new ImportJobService(jobStore, new FormatDetector(fileReader, fieldMapper, properties), fieldMapper,
            bookRunner, historyRunner, pendingPlans, new ImportErrorReportWriter(new ObjectMapper()), templates,
            properties, clock);
    }
}
