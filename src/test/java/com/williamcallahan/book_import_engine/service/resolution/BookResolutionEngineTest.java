/**
 * Tests for BookResolutionEngine row decisions
 *
 * Features:
 * - Create, merge, skip and each error classification
 * - Catalog faults never escape the row boundary
 */
package com.williamcallahan.book_import_engine.service.resolution;

import com.williamcallahan.book_import_engine.catalog.CatalogGateway;
import com.williamcallahan.book_import_engine.catalog.CreateResult;
import com.williamcallahan.book_import_engine.catalog.memory.InMemoryCatalog;
import com.williamcallahan.book_import_engine.config.ImportProperties;
import com.williamcallahan.book_import_engine.exception.CatalogOperationException;
import com.williamcallahan.book_import_engine.model.CatalogBook;
import com.williamcallahan.book_import_engine.model.FieldMapping;
import com.williamcallahan.book_import_engine.model.ImportErrorType;
import com.williamcallahan.book_import_engine.model.PersonalBookData;
import com.williamcallahan.book_import_engine.model.RowOutcome;
import com.williamcallahan.book_import_engine.service.csv.ImportRow;
import com.williamcallahan.book_import_engine.service.enrichment.EnrichmentIndex;
import com.williamcallahan.book_import_engine.service.enrichment.MetadataEnrichmentBatcher;
import com.williamcallahan.book_import_engine.service.provider.MetadataLookupService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookResolutionEngineTest {

    private static final FieldMapping MAPPING = FieldMapping.fromTokens(orderedTokens());

    @Mock
    private CatalogGateway catalogMock;

    private static Map<String, String> orderedTokens() {
        Map<String, String> tokens = new LinkedHashMap<>();
        tokens.put("Title", "title");
        tokens.put("Author", "author");
        tokens.put("ISBN", "isbn");
        tokens.put("Shelf", "reading_status");
        return tokens;
    }

    private static ImportRow row(String title, String author, String isbn) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("Title", title);
        values.put("Author", author);
        values.put("ISBN", isbn);
        values.put("Shelf", "read");
        return new ImportRow(4, values);
    }

    private static ResolutionContext context(EnrichmentIndex enrichment) {
        return new ResolutionContext("job-1", "reader-1", MAPPING, enrichment, "plan_to_read");
    }

    private static EnrichmentIndex attemptedEmptyIndex() {
        return new MetadataEnrichmentBatcher(new MetadataLookupService(List.of()), new ImportProperties())
            .enrich("job-1", List.of());
    }

    private BookResolutionEngine engine(CatalogGateway catalog) {
        return new BookResolutionEngine(catalog, new CandidateBookFactory(), new EnrichmentMerger(), new BookMergePlanner());
    }

    @Test
    void rowWithoutTitleOrIdentifierIsSkippedWithoutCatalogCalls() {
        RowResult result = engine(catalogMock).resolve(row("", "", ""), context(EnrichmentIndex.notAttempted()));

        assertThat(result.outcome()).isEqualTo(RowOutcome.SKIPPED);
        assertThat(result.error()).isNull();
        verifyNoInteractions(catalogMock);
    }

    @Test
    void identifierWithoutTitleAndNoEnrichmentIsValidationSkip() {
        RowResult result = engine(catalogMock).resolve(row("", "", "9780441172719"), context(EnrichmentIndex.notAttempted()));

        assertThat(result.outcome()).isEqualTo(RowOutcome.SKIPPED);
        assertThat(result.error().type()).isEqualTo(ImportErrorType.VALIDATION_ERROR);
        verifyNoInteractions(catalogMock);
    }

    @Test
    void newBookIsCreatedWithPersonalData() {
        when(catalogMock.create(any())).thenReturn(CreateResult.created("book-9"));

        RowResult result = engine(catalogMock).resolve(row("Dune", "Frank Herbert", ""), context(EnrichmentIndex.notAttempted()));

        assertThat(result.outcome()).isEqualTo(RowOutcome.SUCCESS);
        assertThat(result.bookId()).isEqualTo("book-9");
        assertThat(result.activity()).isEqualTo("Added: Dune");
        verify(catalogMock).upsertPersonalData(eq("reader-1"), eq("book-9"),
            eq(new PersonalBookData("read", null, null, null, null, null, Map.of())));
    }

    @Test
    void duplicateIsMergedThroughPatch() {
        CatalogBook existing = new CatalogBook();
        existing.setId("book-1");
        existing.setTitle("Dune");
        when(catalogMock.create(any())).thenReturn(CreateResult.alreadyExists("book-1"));
        when(catalogMock.findById("book-1")).thenReturn(Optional.of(existing));
        when(catalogMock.update(eq("book-1"), any())).thenReturn(true);

        RowResult result = engine(catalogMock).resolve(row("Dune", "Frank Herbert", ""), context(EnrichmentIndex.notAttempted()));

        assertThat(result.outcome()).isEqualTo(RowOutcome.MERGED);
        verify(catalogMock).update(eq("book-1"), any());
        verify(catalogMock).upsertPersonalData(eq("reader-1"), eq("book-1"), any());
    }

    @Test
    void refusedMergeIsDuplicateMergeFailure() {
        CatalogBook existing = new CatalogBook();
        existing.setId("book-1");
        when(catalogMock.create(any())).thenReturn(CreateResult.alreadyExists("book-1"));
        when(catalogMock.findById("book-1")).thenReturn(Optional.of(existing));
        when(catalogMock.update(anyString(), any())).thenReturn(false);

        RowResult result = engine(catalogMock).resolve(row("Dune", "Frank Herbert", ""), context(EnrichmentIndex.notAttempted()));

        assertThat(result.outcome()).isEqualTo(RowOutcome.ERROR);
        assertThat(result.error().type()).isEqualTo(ImportErrorType.DUPLICATE_MERGE_FAILED);
    }

    @Test
    void catalogRejectionIsAddFailure() {
        when(catalogMock.create(any())).thenThrow(new CatalogOperationException("storage full"));

        RowResult result = engine(catalogMock).resolve(row("Dune", "Frank Herbert", ""), context(EnrichmentIndex.notAttempted()));

        assertThat(result.outcome()).isEqualTo(RowOutcome.ERROR);
        assertThat(result.error().type()).isEqualTo(ImportErrorType.ADD_FAILED);
        assertThat(result.error().message()).isEqualTo("storage full");
        assertThat(result.error().row()).isEqualTo(4);
        assertThat(result.error().rawRow()).containsEntry("Title", "Dune");
    }

    @Test
    void unexpectedFaultIsClassifiedAsException() {
        when(catalogMock.create(any())).thenThrow(new IllegalStateException("boom"));

        RowResult result = engine(catalogMock).resolve(row("Dune", "Frank Herbert", ""), context(EnrichmentIndex.notAttempted()));

        assertThat(result.error().type()).isEqualTo(ImportErrorType.EXCEPTION);
        assertThat(result.error().message()).contains("IllegalStateException").contains("boom");
    }

    @Test
    void invalidIdentifierWithoutTitleIsLookupFailureWhenEnrichmentRan() {
        InMemoryCatalog catalog = new InMemoryCatalog();

        RowResult result = engine(catalog).resolve(row("", "", "12345"),
            context(attemptedEmptyIndex()));

        assertThat(result.outcome()).isEqualTo(RowOutcome.ERROR);
        assertThat(result.error().type()).isEqualTo(ImportErrorType.LOOKUP_FAILED);
        assertThat(result.error().isbn()).isEqualTo("12345");
        assertThat(catalog.bookCount()).isZero();
    }

    @Test
    void sameBookTwiceMergesInRealCatalog() {
        InMemoryCatalog catalog = new InMemoryCatalog();
        BookResolutionEngine engine = engine(catalog);

        RowResult first = engine.resolve(row("Dune", "Frank Herbert", "9780441172719"), context(EnrichmentIndex.notAttempted()));
        RowResult second = engine.resolve(row("Dune", "Frank Herbert", "0441172717"), context(EnrichmentIndex.notAttempted()));

        assertThat(first.outcome()).isEqualTo(RowOutcome.SUCCESS);
        assertThat(second.outcome()).isEqualTo(RowOutcome.MERGED);
        assertThat(second.bookId()).isEqualTo(first.bookId());
        assertThat(catalog.allBooks()).extracting(CatalogBook::getIsbn10).containsExactly("0441172717");
        assertThat(catalog.findPersonalData("reader-1", first.bookId()))
            .map(PersonalBookData::readingStatus)
            .contains("read");
    }
}
