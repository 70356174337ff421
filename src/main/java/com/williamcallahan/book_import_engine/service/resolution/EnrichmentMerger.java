package com.williamcallahan.book_import_engine.service.resolution;

import com.williamcallahan.book_import_engine.model.CandidateBook;
import com.williamcallahan.book_import_engine.model.MetadataRecord;
import com.williamcallahan.book_import_engine.util.ValidationUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * Merges an enrichment record into a candidate without overwriting row data.
 *
 * <p>Every field the row already populated is kept. Categories are the exception: non-empty
 * enrichment categories replace the row's, since export "genres" are mostly personal shelves.</p>
 */
@Component
public class EnrichmentMerger {

    static final String GOOGLE_BOOKS_ID = "google_books_id";
    static final String OPENLIBRARY_ID = "openlibrary_id";

    public void merge(CandidateBook candidate, MetadataRecord record) {
        if (record == null) {
            return;
        }
        if (!candidate.hasTitle()) {
            candidate.setTitle(record.getTitle());
        }
        if (!ValidationUtils.hasText(candidate.getSubtitle())) {
            candidate.setSubtitle(record.getSubtitle());
        }
        if (candidate.getAuthors().isEmpty()) {
            candidate.setAuthors(new ArrayList<>(record.getAuthors()));
        }
        if (candidate.getIsbn13() == null) {
            candidate.setIsbn13(record.getIsbn13());
        }
        if (candidate.getIsbn10() == null) {
            candidate.setIsbn10(record.getIsbn10());
        }
        if (!ValidationUtils.hasText(candidate.getPublisher())) {
            candidate.setPublisher(record.getPublisher());
        }
        if (!ValidationUtils.hasText(candidate.getPublishedDate())) {
            candidate.setPublishedDate(record.getPublishedDate());
        }
        if (candidate.getPageCount() == null) {
            candidate.setPageCount(record.getPageCount());
        }
        if (!ValidationUtils.hasText(candidate.getLanguage())) {
            candidate.setLanguage(record.getLanguage());
        }
        if (!ValidationUtils.hasText(candidate.getDescription())) {
            candidate.setDescription(record.getDescription());
        }
        if (!ValidationUtils.hasText(candidate.getCoverUrl())) {
            candidate.setCoverUrl(record.getCoverUrl());
        }
        if (candidate.getAverageRating() == null) {
            candidate.setAverageRating(record.getAverageRating());
        }
        if (candidate.getRatingCount() == null) {
            candidate.setRatingCount(record.getRatingCount());
        }
        if (!record.getCategories().isEmpty()) {
            candidate.setCategories(new ArrayList<>(record.getCategories()));
            candidate.setCategoriesFromEnrichment(true);
        }
        if (record.getGoogleBooksId() != null) {
            candidate.getGlobalCustomMetadata().putIfAbsent(GOOGLE_BOOKS_ID, record.getGoogleBooksId());
        }
        if (record.getOpenLibraryId() != null) {
            candidate.getGlobalCustomMetadata().putIfAbsent(OPENLIBRARY_ID, record.getOpenLibraryId());
        }
        candidate.setEnriched(true);
    }
}
