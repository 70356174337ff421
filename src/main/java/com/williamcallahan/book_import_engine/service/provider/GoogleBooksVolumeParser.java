/**
 * Converts Google Books volume JSON into metadata records
 *
 * Features:
 * - Reads volumeInfo fields and industry identifiers
 * - Picks the largest available cover and upgrades it to https
 * - Returns null for items without a usable title
 */
package com.williamcallahan.book_import_engine.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.book_import_engine.model.MetadataRecord;
import com.williamcallahan.book_import_engine.util.IsbnUtils;
import com.williamcallahan.book_import_engine.util.ValidationUtils;

public final class GoogleBooksVolumeParser {

    static final String SOURCE = "google_books";

    private static final String[] COVER_SIZES = {"extraLarge", "large", "medium", "thumbnail", "smallThumbnail"};

    private GoogleBooksVolumeParser() {
    }

    public static MetadataRecord parseVolume(JsonNode item) {
        if (item == null || !item.isObject()) {
            return null;
        }
        JsonNode volumeInfo = item.path("volumeInfo");
        String title = textOrNull(volumeInfo, "title");
        if (!ValidationUtils.hasText(title)) {
            return null;
        }
        MetadataRecord.MetadataRecordBuilder builder = MetadataRecord.builder()
            .title(title)
            .subtitle(textOrNull(volumeInfo, "subtitle"))
            .publisher(textOrNull(volumeInfo, "publisher"))
            .publishedDate(textOrNull(volumeInfo, "publishedDate"))
            .description(textOrNull(volumeInfo, "description"))
            .language(textOrNull(volumeInfo, "language"))
            .googleBooksId(textOrNull(item, "id"))
            .coverUrl(coverUrl(volumeInfo.path("imageLinks")))
            .source(SOURCE);

        if (volumeInfo.path("pageCount").isInt() && volumeInfo.path("pageCount").asInt() > 0) {
            builder.pageCount(volumeInfo.path("pageCount").asInt());
        }
        if (volumeInfo.path("averageRating").isNumber()) {
            builder.averageRating(volumeInfo.path("averageRating").asDouble());
        }
        if (volumeInfo.path("ratingsCount").isInt()) {
            builder.ratingCount(volumeInfo.path("ratingsCount").asInt());
        }
        for (JsonNode author : volumeInfo.path("authors")) {
            if (ValidationUtils.hasText(author.asText(null))) {
                builder.author(author.asText().trim());
            }
        }
        for (JsonNode category : volumeInfo.path("categories")) {
            if (ValidationUtils.hasText(category.asText(null))) {
                builder.category(category.asText().trim());
            }
        }
        for (JsonNode identifier : volumeInfo.path("industryIdentifiers")) {
            String type = identifier.path("type").asText("");
            String value = IsbnUtils.normalize(identifier.path("identifier").asText(null));
            if (value == null) {
                continue;
            }
            if ("ISBN_13".equals(type) && value.length() == 13) {
                builder.isbn13(value);
            } else if ("ISBN_10".equals(type) && value.length() == 10) {
                builder.isbn10(value);
            }
        }
        return builder.build();
    }

    /**
     * True when the volume lists the ISBN (in either form) among its identifiers.
     */
    static boolean carriesIsbn(MetadataRecord record, String isbn) {
        return record != null && IsbnUtils.allForms(isbn).stream().anyMatch(record.isbnForms()::contains);
    }

    private static String coverUrl(JsonNode imageLinks) {
        if (imageLinks == null || !imageLinks.isObject()) {
            return null;
        }
        for (String size : COVER_SIZES) {
            String url = textOrNull(imageLinks, size);
            if (url != null) {
                return url.startsWith("http://") ? "https://" + url.substring("http://".length()) : url;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return ValidationUtils.hasText(text) ? text.trim() : null;
    }
}
