/**
 * Matches reading-history book names against the owner's catalog
 *
 * Features:
 * - Automatic match only on exact, case-insensitive title equality
 * - Candidate lists mix catalog hits with external title-search results
 * - Provider failures shrink the candidate list instead of failing the job
 */
package com.williamcallahan.book_import_engine.service.history;

import com.williamcallahan.book_import_engine.catalog.CatalogGateway;
import com.williamcallahan.book_import_engine.config.ImportProperties;
import com.williamcallahan.book_import_engine.model.BookCandidateView;
import com.williamcallahan.book_import_engine.model.CatalogBook;
import com.williamcallahan.book_import_engine.model.MetadataRecord;
import com.williamcallahan.book_import_engine.service.provider.MetadataLookupService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
public class BookMatcher {

    private static final Logger logger = LoggerFactory.getLogger(BookMatcher.class);
    static final String CATALOG_SOURCE = "catalog";
    private static final Duration SEARCH_TIMEOUT = Duration.ofSeconds(15);

    private final CatalogGateway catalog;
    private final MetadataLookupService lookupService;
    private final ImportProperties properties;

    public BookMatcher(CatalogGateway catalog, MetadataLookupService lookupService, ImportProperties properties) {
        this.catalog = catalog;
        this.lookupService = lookupService;
        this.properties = properties;
    }

    /**
     * Exact, case-insensitive title match against the owner's library.
     */
    public Optional<String> autoMatch(String owner, String bookName) {
        if (bookName == null || bookName.isBlank()) {
            return Optional.empty();
        }
        return catalog.findOwnedByTitle(owner, bookName.trim());
    }

    public List<BookCandidateView> candidates(String owner, String bookName) {
        int limit = properties.getReadingHistory().getCandidateLimit();
        List<BookCandidateView> candidates = new ArrayList<>();
        for (CatalogBook book : catalog.search(bookName, owner, limit)) {
            String isbn = book.getIsbn13() != null ? book.getIsbn13() : book.getIsbn10();
            candidates.add(new BookCandidateView(book.getId(), book.getTitle(), book.getAuthors(), isbn, CATALOG_SOURCE));
        }
        List<MetadataRecord> external = lookupService.searchByTitle(bookName, limit)
            .collectList()
            .onErrorResume(e -> {
                logger.warn("External candidate search failed for '{}': {}", bookName, e.getMessage());
                return Mono.just(List.of());
            })
            .block(SEARCH_TIMEOUT);
        if (external != null) {
            for (MetadataRecord record : external) {
                String isbn = record.getIsbn13() != null ? record.getIsbn13() : record.getIsbn10();
                String source = record.getSources().isEmpty() ? "external" : record.getSources().get(0);
                candidates.add(new BookCandidateView(null, record.getTitle(), record.getAuthors(), isbn, source));
            }
        }
        return candidates;
    }
}
