package com.williamcallahan.book_import_engine.service.resolution;

import com.williamcallahan.book_import_engine.model.BookPatch;
import com.williamcallahan.book_import_engine.model.CandidateBook;
import com.williamcallahan.book_import_engine.model.CatalogBook;
import com.williamcallahan.book_import_engine.util.ValidationUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the patch that folds a duplicate candidate into the existing catalog record.
 *
 * <p>Only fields that are currently empty on the existing record are patched, and custom metadata
 * keys the record does not have yet are added. Categories supplied by enrichment replace the
 * existing ones when they differ. An empty patch means the record already holds everything.</p>
 */
@Component
public class BookMergePlanner {

    public BookPatch plan(CatalogBook existing, CandidateBook candidate) {
        BookPatch patch = new BookPatch();
        if (isBlank(existing.getSubtitle()) && !isBlank(candidate.getSubtitle())) {
            patch.setSubtitle(candidate.getSubtitle());
        }
        if (existing.getAuthors().isEmpty() && !candidate.getAuthors().isEmpty()) {
            patch.setAuthors(new ArrayList<>(candidate.getAuthors()));
        }
        if (isBlank(existing.getIsbn10()) && candidate.getIsbn10() != null) {
            patch.setIsbn10(candidate.getIsbn10());
        }
        if (isBlank(existing.getIsbn13()) && candidate.getIsbn13() != null) {
            patch.setIsbn13(candidate.getIsbn13());
        }
        if (isBlank(existing.getAsin()) && !isBlank(candidate.getAsin())) {
            patch.setAsin(candidate.getAsin());
        }
        if (isBlank(existing.getPublisher()) && !isBlank(candidate.getPublisher())) {
            patch.setPublisher(candidate.getPublisher());
        }
        if (isBlank(existing.getPublishedDate()) && !isBlank(candidate.getPublishedDate())) {
            patch.setPublishedDate(candidate.getPublishedDate());
        }
        if (existing.getPageCount() == null && candidate.getPageCount() != null) {
            patch.setPageCount(candidate.getPageCount());
        }
        if (isBlank(existing.getLanguage()) && !isBlank(candidate.getLanguage())) {
            patch.setLanguage(candidate.getLanguage());
        }
        if (isBlank(existing.getDescription()) && !isBlank(candidate.getDescription())) {
            patch.setDescription(candidate.getDescription());
        }
        if (isBlank(existing.getCoverUrl()) && !isBlank(candidate.getCoverUrl())) {
            patch.setCoverUrl(candidate.getCoverUrl());
        }
        if (existing.getAverageRating() == null && candidate.getAverageRating() != null) {
            patch.setAverageRating(candidate.getAverageRating());
        }
        if (existing.getRatingCount() == null && candidate.getRatingCount() != null) {
            patch.setRatingCount(candidate.getRatingCount());
        }
        boolean enrichedCategories = candidate.isCategoriesFromEnrichment() && !candidate.getCategories().isEmpty();
        if (enrichedCategories && !Objects.equals(existing.getCategories(), candidate.getCategories())) {
            patch.setCategories(new ArrayList<>(candidate.getCategories()));
        } else if (existing.getCategories().isEmpty() && !candidate.getCategories().isEmpty()) {
            patch.setCategories(new ArrayList<>(candidate.getCategories()));
        }
        for (Map.Entry<String, String> entry : candidate.getGlobalCustomMetadata().entrySet()) {
            if (!existing.getGlobalCustomMetadata().containsKey(entry.getKey())) {
                patch.getGlobalCustomMetadata().put(entry.getKey(), entry.getValue());
            }
        }
        return patch;
    }

    private static boolean isBlank(String value) {
        return !ValidationUtils.hasText(value);
    }
}
