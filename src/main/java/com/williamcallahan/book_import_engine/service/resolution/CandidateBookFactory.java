/**
 * Builds a candidate book from one import row and its validated field mapping
 *
 * Features:
 * - Multi-author cells split on commas, additional authors appended after the primary author
 * - ISBN cells check-digit validated; the first valid one wins and both forms are derived
 * - Invalid identifiers kept as the raw identifier for error reporting
 * - Bare publication years widened to {@code yyyy-01-01}
 * - Reading status normalized, falling back to "read" when a read date exists, then to the job default
 * - Custom columns routed to global or personal custom metadata by scope
 */
package com.williamcallahan.book_import_engine.service.resolution;

import com.williamcallahan.book_import_engine.model.CandidateBook;
import com.williamcallahan.book_import_engine.model.FieldMapping;
import com.williamcallahan.book_import_engine.model.FieldScope;
import com.williamcallahan.book_import_engine.model.MappingTarget;
import com.williamcallahan.book_import_engine.service.csv.ImportRow;
import com.williamcallahan.book_import_engine.util.ImportValueUtils;
import com.williamcallahan.book_import_engine.util.IsbnUtils;
import com.williamcallahan.book_import_engine.util.ValidationUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class CandidateBookFactory {

    public CandidateBook build(ImportRow row, FieldMapping mapping, String defaultReadingStatus) {
        CandidateBook candidate = new CandidateBook();
        List<String> authors = new ArrayList<>();
        List<String> additionalAuthors = new ArrayList<>();
        List<String> categories = new ArrayList<>();

        for (Map.Entry<String, MappingTarget> entry : mapping.getTargets().entrySet()) {
            MappingTarget target = entry.getValue();
            String value = row.value(entry.getKey());
            if (value == null || target.isIgnored()) {
                continue;
            }
            if (target.isCustom()) {
                Map<String, String> custom = target.scope() == FieldScope.GLOBAL
                    ? candidate.getGlobalCustomMetadata()
                    : candidate.getPersonalCustomMetadata();
                custom.putIfAbsent(target.customName(), value);
                continue;
            }
            switch (target.field()) {
                case TITLE -> candidate.setTitle(firstNonNull(candidate.getTitle(), value));
                case SUBTITLE -> candidate.setSubtitle(firstNonNull(candidate.getSubtitle(), value));
                case AUTHOR -> authors.addAll(ImportValueUtils.splitList(value));
                case ADDITIONAL_AUTHORS -> additionalAuthors.addAll(ImportValueUtils.splitList(value));
                case ISBN -> applyIdentifier(candidate, value);
                case ASIN -> candidate.setAsin(firstNonNull(candidate.getAsin(), value));
                case PUBLISHER -> candidate.setPublisher(firstNonNull(candidate.getPublisher(), value));
                case PAGE_COUNT -> ImportValueUtils.parseInteger(value)
                    .filter(pages -> pages > 0 && candidate.getPageCount() == null)
                    .ifPresent(candidate::setPageCount);
                case PUBLICATION_YEAR, PUBLISHED_DATE -> candidate.setPublishedDate(
                    firstNonNull(candidate.getPublishedDate(), ImportValueUtils.publicationDateFromYear(value)));
                case LANGUAGE -> candidate.setLanguage(firstNonNull(candidate.getLanguage(), value));
                case DESCRIPTION -> candidate.setDescription(firstNonNull(candidate.getDescription(), value));
                case COVER_URL -> candidate.setCoverUrl(firstNonNull(candidate.getCoverUrl(), value));
                case CATEGORIES -> categories.addAll(ImportValueUtils.splitList(value));
                case AVERAGE_RATING -> ImportValueUtils.parseDouble(value)
                    .filter(rating -> rating > 0)
                    .ifPresent(candidate::setAverageRating);
                case RATING_COUNT -> ImportValueUtils.parseInteger(value).ifPresent(candidate::setRatingCount);
                // 0 is how exports say "not rated"
                case USER_RATING -> ImportValueUtils.parseDouble(value)
                    .filter(rating -> rating > 0)
                    .ifPresent(candidate::setUserRating);
                case READING_STATUS -> candidate.setReadingStatus(ImportValueUtils.normalizeReadingStatus(value));
                case DATE_READ -> ImportValueUtils.parseDate(value).ifPresent(candidate::setDateRead);
                case DATE_ADDED -> ImportValueUtils.parseDate(value).ifPresent(candidate::setDateAdded);
                case START_DATE -> ImportValueUtils.parseDate(value).ifPresent(candidate::setStartDate);
                case PERSONAL_NOTES -> candidate.setPersonalNotes(firstNonNull(candidate.getPersonalNotes(), value));
                default -> {
                    // reading-history columns carry no book data
                }
            }
        }

        authors.addAll(additionalAuthors);
        candidate.setAuthors(authors);
        candidate.setCategories(categories.stream().distinct().toList());
        if (candidate.getReadingStatus() == null) {
            candidate.setReadingStatus(candidate.getDateRead() != null ? ImportValueUtils.STATUS_READ : defaultReadingStatus);
        }
        return candidate;
    }

    public static void applyIdentifier(CandidateBook candidate, String value) {
        if (candidate.getRawIdentifier() == null) {
            candidate.setRawIdentifier(ValidationUtils.stripExportWrapper(value));
        }
        if (candidate.hasValidIsbn()) {
            return;
        }
        String normalized = IsbnUtils.normalize(value);
        if (normalized == null) {
            return;
        }
        candidate.setRawIdentifier(ValidationUtils.stripExportWrapper(value));
        if (normalized.length() == 13) {
            candidate.setIsbn13(normalized);
            candidate.setIsbn10(IsbnUtils.toIsbn10(normalized));
        } else {
            candidate.setIsbn10(normalized);
            candidate.setIsbn13(IsbnUtils.toIsbn13(normalized));
        }
    }

    private static String firstNonNull(String current, String value) {
        return current != null ? current : value;
    }
}
