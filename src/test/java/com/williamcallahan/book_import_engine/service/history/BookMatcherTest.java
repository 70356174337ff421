package com.williamcallahan.book_import_engine.service.history;

import com.williamcallahan.book_import_engine.catalog.CatalogGateway;
import com.williamcallahan.book_import_engine.config.ImportProperties;
import com.williamcallahan.book_import_engine.model.BookCandidateView;
import com.williamcallahan.book_import_engine.model.CatalogBook;
import com.williamcallahan.book_import_engine.model.MetadataRecord;
import com.williamcallahan.book_import_engine.service.provider.MetadataLookupService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookMatcherTest {

    @Mock
    private CatalogGateway catalog;

    @Mock
    private MetadataLookupService lookupService;

    private BookMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new BookMatcher(catalog, lookupService, new ImportProperties());
    }

    private static CatalogBook book(String id, String title) {
        CatalogBook book = new CatalogBook();
        book.setId(id);
        book.setTitle(title);
        book.setAuthors(List.of("Frank Herbert"));
        book.setIsbn13("9780441172719");
        return book;
    }

    @Test
    void autoMatchUsesTrimmedExactTitleLookup() {
        when(catalog.findOwnedByTitle("alice", "dune")).thenReturn(Optional.of("b-2"));

        assertThat(matcher.autoMatch("alice", " dune ")).contains("b-2");
        verify(catalog, never()).search(anyString(), anyString(), anyInt());
    }

    @Test
    void autoMatchFindsNothingWithoutExactTitle() {
        when(catalog.findOwnedByTitle("alice", "Dune")).thenReturn(Optional.empty());

        assertThat(matcher.autoMatch("alice", "Dune")).isEmpty();
    }

    @Test
    void blankNamesAreNeverMatched() {
        assertThat(matcher.autoMatch("alice", "  ")).isEmpty();
        verifyNoInteractions(catalog);
    }

    @Test
    void candidatesListCatalogBooksBeforeExternalResults() {
        when(catalog.search("Dune", "alice", 5)).thenReturn(List.of(book("b-1", "Dune Messiah")));
        when(lookupService.searchByTitle("Dune", 5)).thenReturn(Flux.just(MetadataRecord.builder()
            .title("Dune")
            .author("Frank Herbert")
            .isbn13("9780441013593")
            .source("google_books")
            .build()));

        List<BookCandidateView> candidates = matcher.candidates("alice", "Dune");

        assertThat(candidates).hasSize(2);
        assertThat(candidates.get(0)).isEqualTo(new BookCandidateView("b-1", "Dune Messiah",
            List.of("Frank Herbert"), "9780441172719", BookMatcher.CATALOG_SOURCE));
        assertThat(candidates.get(1).bookId()).isNull();
        assertThat(candidates.get(1).isbn()).isEqualTo("9780441013593");
        assertThat(candidates.get(1).source()).isEqualTo("google_books");
    }

    @Test
    void externalSearchFailureLeavesCatalogCandidates() {
        when(catalog.search(anyString(), anyString(), anyInt())).thenReturn(List.of(book("b-1", "Dune")));
        when(lookupService.searchByTitle("Dune", 5)).thenReturn(Flux.error(new IllegalStateException("offline")));

        assertThat(matcher.candidates("alice", "Dune"))
            .extracting(BookCandidateView::bookId)
            .containsExactly("b-1");
    }
}
