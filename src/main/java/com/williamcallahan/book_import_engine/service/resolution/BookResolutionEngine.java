/**
 * Per-row create / duplicate-merge / skip / error decision for book imports
 *
 * Features:
 * - Builds the candidate from the row and merges enrichment found under any ISBN form
 * - Skips rows with neither title nor identifier without touching the catalog
 * - Never creates a placeholder book from a bare identifier
 * - Duplicate handling through the catalog's explicit already-exists result
 * - Writes the owner's personal data on both create and merge
 * - Every fault is classified and returned; nothing escapes the row boundary
 */
package com.williamcallahan.book_import_engine.service.resolution;

import com.williamcallahan.book_import_engine.catalog.CatalogGateway;
import com.williamcallahan.book_import_engine.catalog.CreateResult;
import com.williamcallahan.book_import_engine.exception.CatalogOperationException;
import com.williamcallahan.book_import_engine.model.BookPatch;
import com.williamcallahan.book_import_engine.model.CandidateBook;
import com.williamcallahan.book_import_engine.model.CatalogBook;
import com.williamcallahan.book_import_engine.model.ImportErrorEntry;
import com.williamcallahan.book_import_engine.model.ImportErrorType;
import com.williamcallahan.book_import_engine.model.MetadataRecord;
import com.williamcallahan.book_import_engine.service.csv.ImportRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@Slf4j
public class BookResolutionEngine {

    private final CatalogGateway catalog;
    private final CandidateBookFactory candidateFactory;
    private final EnrichmentMerger enrichmentMerger;
    private final BookMergePlanner mergePlanner;

    public BookResolutionEngine(CatalogGateway catalog,
                                CandidateBookFactory candidateFactory,
                                EnrichmentMerger enrichmentMerger,
                                BookMergePlanner mergePlanner) {
        this.catalog = catalog;
        this.candidateFactory = candidateFactory;
        this.enrichmentMerger = enrichmentMerger;
        this.mergePlanner = mergePlanner;
    }

    public RowResult resolve(ImportRow row, ResolutionContext context) {
        CandidateBook candidate = null;
        try {
            candidate = candidateFactory.build(row, context.mapping(), context.defaultReadingStatus());
            if (candidate.hasValidIsbn()) {
                Optional<MetadataRecord> record = context.enrichment().find(candidate.getPreferredIsbn());
                if (record.isPresent()) {
                    enrichmentMerger.merge(candidate, record.get());
                }
            }
            return decide(row, context, candidate);
        } catch (RuntimeException e) {
            log.warn("Job {}: unexpected failure on row {}: {}", context.jobId(), row.rowNumber(), e.getMessage(), e);
            String label = candidate != null ? candidate.describe() : "row " + row.rowNumber();
            return RowResult.error(label, errorEntry(row, candidate, ImportErrorType.EXCEPTION, e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    private RowResult decide(ImportRow row, ResolutionContext context, CandidateBook candidate) {
        if (!candidate.hasTitle() && !candidate.hasIdentifier()) {
            return RowResult.skipped("row " + row.rowNumber(), "no title or ISBN");
        }
        if (!candidate.hasTitle()) {
            if (context.enrichment().isAttempted()) {
                String message = candidate.hasValidIsbn()
                    ? "No metadata found for ISBN " + candidate.getPreferredIsbn() + " and the row has no title"
                    : "Invalid ISBN '" + candidate.getRawIdentifier() + "' and the row has no title";
                return RowResult.error(candidate.describe(), errorEntry(row, candidate, ImportErrorType.LOOKUP_FAILED, message));
            }
            return RowResult.skipped(candidate.describe(), "ISBN without title while enrichment is disabled",
                errorEntry(row, candidate, ImportErrorType.VALIDATION_ERROR, "Row has an identifier but no title and enrichment is disabled"));
        }

        CreateResult created;
        try {
            created = catalog.create(candidate);
        } catch (CatalogOperationException e) {
            log.warn("Job {}: catalog rejected '{}': {}", context.jobId(), candidate.describe(), e.getMessage());
            return RowResult.error(candidate.describe(), errorEntry(row, candidate, ImportErrorType.ADD_FAILED, e.getMessage()));
        }

        if (created.isCreated()) {
            try {
                catalog.upsertPersonalData(context.owner(), created.bookId(), candidate.toPersonalData());
            } catch (RuntimeException e) {
                return RowResult.error(candidate.describe(), errorEntry(row, candidate, ImportErrorType.ADD_FAILED,
                    "Book created but personal data could not be saved: " + e.getMessage()));
            }
            log.debug("Job {}: row {} created book {}", context.jobId(), row.rowNumber(), created.bookId());
            return RowResult.success(created.bookId(), candidate.describe());
        }
        return mergeIntoExisting(row, context, candidate, created.bookId());
    }

    private RowResult mergeIntoExisting(ImportRow row, ResolutionContext context, CandidateBook candidate, String bookId) {
        try {
            Optional<CatalogBook> existing = catalog.findById(bookId);
            if (existing.isEmpty()) {
                return mergeFailed(row, candidate, "Duplicate " + bookId + " disappeared before it could be merged");
            }
            BookPatch patch = mergePlanner.plan(existing.get(), candidate);
            if (!patch.isEmpty() && !catalog.update(bookId, patch)) {
                return mergeFailed(row, candidate, "Catalog refused the merge update for " + bookId);
            }
            catalog.upsertPersonalData(context.owner(), bookId, candidate.toPersonalData());
            log.debug("Job {}: row {} merged into {} ({})", context.jobId(), row.rowNumber(), bookId, patch.isEmpty() ? "no-op" : "patched");
            return RowResult.merged(bookId, candidate.describe());
        } catch (RuntimeException e) {
            log.warn("Job {}: merge into {} failed: {}", context.jobId(), bookId, e.getMessage());
            return mergeFailed(row, candidate, e.getMessage());
        }
    }

    private RowResult mergeFailed(ImportRow row, CandidateBook candidate, String message) {
        return RowResult.error(candidate.describe(), errorEntry(row, candidate, ImportErrorType.DUPLICATE_MERGE_FAILED, message));
    }

    static ImportErrorEntry errorEntry(ImportRow row, CandidateBook candidate, ImportErrorType type, String message) {
        return ImportErrorEntry.of(row.rowNumber(), type, message,
            candidate == null ? null : candidate.getRawIdentifier(),
            candidate == null ? null : candidate.getTitle(),
            candidate == null ? null : candidate.getPrimaryAuthor(),
            row.values());
    }
}
