package com.williamcallahan.book_import_engine.service.resolution;

import com.williamcallahan.book_import_engine.model.CandidateBook;
import com.williamcallahan.book_import_engine.model.MetadataRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EnrichmentMergerTest {

    private final EnrichmentMerger merger = new EnrichmentMerger();

    private static MetadataRecord record() {
        return MetadataRecord.builder()
            .title("Dune")
            .author("Frank Herbert")
            .publisher("Ace")
            .pageCount(604)
            .description("Desert planet")
            .category("Science Fiction")
            .isbn13("9780441172719")
            .isbn10("0441172717")
            .googleBooksId("gb-1")
            .build();
    }

    @Test
    @DisplayName("row values win over enrichment for every field except categories")
    void rowDataIsNeverOverwritten() {
        CandidateBook candidate = new CandidateBook();
        candidate.setTitle("Dune (Deluxe)");
        candidate.setPublisher("Chilton");
        candidate.setCategories(List.of("to-read", "favorites"));

        merger.merge(candidate, record());

        assertThat(candidate.getTitle()).isEqualTo("Dune (Deluxe)");
        assertThat(candidate.getPublisher()).isEqualTo("Chilton");
        assertThat(candidate.getAuthors()).containsExactly("Frank Herbert");
        assertThat(candidate.getPageCount()).isEqualTo(604);
        assertThat(candidate.getCategories()).containsExactly("Science Fiction");
        assertThat(candidate.isCategoriesFromEnrichment()).isTrue();
        assertThat(candidate.getGlobalCustomMetadata()).containsEntry(EnrichmentMerger.GOOGLE_BOOKS_ID, "gb-1");
        assertThat(candidate.isEnriched()).isTrue();
    }

    @Test
    void emptyEnrichmentCategoriesKeepRowCategories() {
        CandidateBook candidate = new CandidateBook();
        candidate.setCategories(List.of("Classics"));

        merger.merge(candidate, MetadataRecord.builder().title("Dune").build());

        assertThat(candidate.getTitle()).isEqualTo("Dune");
        assertThat(candidate.getCategories()).containsExactly("Classics");
        assertThat(candidate.isCategoriesFromEnrichment()).isFalse();
    }

    @Test
    void nullRecordIsIgnored() {
        CandidateBook candidate = new CandidateBook();

        merger.merge(candidate, null);

        assertThat(candidate.isEnriched()).isFalse();
    }
}
