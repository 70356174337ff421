/**
 * Normalized enrichment result for one edition
 *
 * Features:
 * - Built by metadata providers from their JSON payloads
 * - Carries every ISBN form the provider reported so the batcher can index it under each
 * - Records which providers contributed to it
 */
package com.williamcallahan.book_import_engine.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Getter
@Builder(toBuilder = true)
public class MetadataRecord {

    private final String title;
    private final String subtitle;
    @Singular
    private final List<String> authors;
    private final String publisher;
    private final String publishedDate;
    private final Integer pageCount;
    private final String language;
    private final String description;
    private final String coverUrl;
    @Singular
    private final List<String> categories;
    private final Double averageRating;
    private final Integer ratingCount;
    @Singular("isbn10")
    private final List<String> isbn10s;
    @Singular("isbn13")
    private final List<String> isbn13s;
    private final String googleBooksId;
    private final String openLibraryId;
    @Singular
    private final List<String> sources;

    public String getIsbn10() {
        return isbn10s.isEmpty() ? null : isbn10s.get(0);
    }

    public String getIsbn13() {
        return isbn13s.isEmpty() ? null : isbn13s.get(0);
    }

    /**
     * Every ISBN form carried by this record, ISBN-13 forms first.
     */
    public Set<String> isbnForms() {
        Set<String> forms = new LinkedHashSet<>(isbn13s);
        forms.addAll(isbn10s);
        return forms;
    }

    public boolean hasUsableData() {
        return title != null && !title.isBlank();
    }
}
