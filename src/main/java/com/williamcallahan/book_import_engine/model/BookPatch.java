package com.williamcallahan.book_import_engine.model;

import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partial update for a catalog book; {@code null} means "leave unchanged".
 */
@Getter
@Setter
public class BookPatch {

    private String subtitle;
    private List<String> authors;
    private String isbn10;
    private String isbn13;
    private String asin;
    private String publisher;
    private String publishedDate;
    private Integer pageCount;
    private String language;
    private String description;
    private String coverUrl;
    private List<String> categories;
    private Double averageRating;
    private Integer ratingCount;
    private Map<String, String> globalCustomMetadata = new LinkedHashMap<>();

    public boolean isEmpty() {
        return subtitle == null && authors == null && isbn10 == null && isbn13 == null && asin == null
            && publisher == null && publishedDate == null && pageCount == null && language == null
            && description == null && coverUrl == null && categories == null && averageRating == null
            && ratingCount == null && globalCustomMetadata.isEmpty();
    }
}
