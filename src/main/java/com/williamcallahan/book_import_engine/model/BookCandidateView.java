package com.williamcallahan.book_import_engine.model;

import java.util.List;

/**
 * A possible match offered to a human while a reading-history job waits for book matching.
 *
 * @param bookId catalog id when the candidate already exists in the catalog, otherwise {@code null}
 * @param title candidate title
 * @param authors candidate authors
 * @param isbn identifier usable for a {@code create} resolution
 * @param source {@code catalog} or the provider name
 */
public record BookCandidateView(String bookId, String title, List<String> authors, String isbn, String source) {

    public BookCandidateView {
        authors = authors == null ? List.of() : List.copyOf(authors);
    }
}
