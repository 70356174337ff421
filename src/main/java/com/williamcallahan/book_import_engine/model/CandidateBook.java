/**
 * In-memory book assembled from one import row plus any enrichment
 *
 * Features:
 * - Never persisted directly and never shared across rows
 * - Becomes either a new catalog entry or a merge patch against an existing one
 * - Separates catalog-level data from the owner's personal data for the book
 */
package com.williamcallahan.book_import_engine.model;

import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Getter
@Setter
public class CandidateBook {

    private String title;
    private String subtitle;
    private List<String> authors = new ArrayList<>();
    private String isbn10;
    private String isbn13;
    /** Identifier cell as it appeared in the row, kept even when it fails validation. */
    private String rawIdentifier;
    private String asin;
    private String publisher;
    private String publishedDate;
    private Integer pageCount;
    private String language;
    private String description;
    private String coverUrl;
    private List<String> categories = new ArrayList<>();
    private Double averageRating;
    private Integer ratingCount;
    private Map<String, String> globalCustomMetadata = new LinkedHashMap<>();

    // personal data
    private Double userRating;
    private String readingStatus;
    private LocalDate dateRead;
    private LocalDate dateAdded;
    private LocalDate startDate;
    private String personalNotes;
    private Map<String, String> personalCustomMetadata = new LinkedHashMap<>();

    private boolean enriched;
    /** Set when categories were replaced by enrichment rather than read from the row. */
    private boolean categoriesFromEnrichment;

    public void setAuthors(List<String> authors) {
        if (authors == null) {
            this.authors = new ArrayList<>();
            return;
        }
        List<String> cleaned = new ArrayList<>();
        for (String author : authors) {
            if (author == null) {
                continue;
            }
            String trimmed = author.trim();
            if (!trimmed.isEmpty() && cleaned.stream().noneMatch(existing -> existing.equalsIgnoreCase(trimmed))) {
                cleaned.add(trimmed);
            }
        }
        this.authors = cleaned;
    }

    public void setCategories(List<String> categories) {
        this.categories = categories == null ? new ArrayList<>() : new ArrayList<>(categories);
    }

    public void setGlobalCustomMetadata(Map<String, String> globalCustomMetadata) {
        this.globalCustomMetadata = globalCustomMetadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(globalCustomMetadata);
    }

    public void setPersonalCustomMetadata(Map<String, String> personalCustomMetadata) {
        this.personalCustomMetadata = personalCustomMetadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(personalCustomMetadata);
    }

    public String getPrimaryAuthor() {
        return authors.isEmpty() ? null : authors.get(0);
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    /**
     * True when the row carried any identifier at all, valid or not.
     */
    public boolean hasIdentifier() {
        return isbn13 != null || isbn10 != null || (rawIdentifier != null && !rawIdentifier.isBlank());
    }

    public boolean hasValidIsbn() {
        return isbn13 != null || isbn10 != null;
    }

    public String getPreferredIsbn() {
        return isbn13 != null ? isbn13 : isbn10;
    }

    /**
     * Label used in activity lines and error entries.
     */
    public String describe() {
        if (hasTitle()) {
            return title;
        }
        return Objects.requireNonNullElse(getPreferredIsbn(), Objects.requireNonNullElse(rawIdentifier, "(untitled)"));
    }

    public PersonalBookData toPersonalData() {
        return new PersonalBookData(readingStatus, userRating, personalNotes, dateRead, dateAdded, startDate, personalCustomMetadata);
    }
}
