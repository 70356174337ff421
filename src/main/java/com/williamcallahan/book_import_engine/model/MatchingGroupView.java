package com.williamcallahan.book_import_engine.model;

import java.util.List;

/**
 * An unresolved book-name group as exposed on the job document.
 */
public record MatchingGroupView(String groupKey, String bookName, int entryCount, List<BookCandidateView> candidates) {

    public MatchingGroupView {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }
}
