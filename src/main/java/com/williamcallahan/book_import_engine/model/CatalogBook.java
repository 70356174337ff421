package com.williamcallahan.book_import_engine.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A book as currently held by the catalog collaborator.
 */
@Getter
@Setter
public class CatalogBook {

    private String id;
    private String title;
    private String subtitle;
    private List<String> authors = new ArrayList<>();
    private String isbn10;
    private String isbn13;
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

    public static CatalogBook fromCandidate(String id, CandidateBook candidate) {
        CatalogBook book = new CatalogBook();
        book.setId(id);
        book.setTitle(candidate.getTitle());
        book.setSubtitle(candidate.getSubtitle());
        book.setAuthors(new ArrayList<>(candidate.getAuthors()));
        book.setIsbn10(candidate.getIsbn10());
        book.setIsbn13(candidate.getIsbn13());
        book.setAsin(candidate.getAsin());
        book.setPublisher(candidate.getPublisher());
        book.setPublishedDate(candidate.getPublishedDate());
        book.setPageCount(candidate.getPageCount());
        book.setLanguage(candidate.getLanguage());
        book.setDescription(candidate.getDescription());
        book.setCoverUrl(candidate.getCoverUrl());
        book.setCategories(new ArrayList<>(candidate.getCategories()));
        book.setAverageRating(candidate.getAverageRating());
        book.setRatingCount(candidate.getRatingCount());
        book.setGlobalCustomMetadata(new LinkedHashMap<>(candidate.getGlobalCustomMetadata()));
        return book;
    }

    public CatalogBook copy() {
        CatalogBook copy = new CatalogBook();
        copy.setId(id);
        copy.setTitle(title);
        copy.setSubtitle(subtitle);
        copy.setAuthors(new ArrayList<>(authors));
        copy.setIsbn10(isbn10);
        copy.setIsbn13(isbn13);
        copy.setAsin(asin);
        copy.setPublisher(publisher);
        copy.setPublishedDate(publishedDate);
        copy.setPageCount(pageCount);
        copy.setLanguage(language);
        copy.setDescription(description);
        copy.setCoverUrl(coverUrl);
        copy.setCategories(new ArrayList<>(categories));
        copy.setAverageRating(averageRating);
        copy.setRatingCount(ratingCount);
        copy.setGlobalCustomMetadata(new LinkedHashMap<>(globalCustomMetadata));
        return copy;
    }
}
