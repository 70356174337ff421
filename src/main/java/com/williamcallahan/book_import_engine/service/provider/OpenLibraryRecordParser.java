/**
 * Converts OpenLibrary "data" view and search documents into metadata records
 */
package com.williamcallahan.book_import_engine.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.book_import_engine.model.MetadataRecord;
import com.williamcallahan.book_import_engine.util.IsbnUtils;
import com.williamcallahan.book_import_engine.util.ValidationUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class OpenLibraryRecordParser {

    static final String SOURCE = "openlibrary";

    private static final Pattern YEAR = Pattern.compile("(\\d{4})");
    private static final String COVER_BY_ID = "https://covers.openlibrary.org/b/id/%d-M.jpg";

    private OpenLibraryRecordParser() {
    }

    /**
     * Parses one entry of the {@code /api/books?jscmd=data} response.
     *
     * @param queriedIsbn ISBN the request was made for; kept as a form when identifiers omit it
     */
    public static MetadataRecord parseBookData(JsonNode node, String queriedIsbn) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String title = textOrNull(node, "title");
        if (!ValidationUtils.hasText(title)) {
            return null;
        }
        MetadataRecord.MetadataRecordBuilder builder = MetadataRecord.builder()
            .title(title)
            .subtitle(textOrNull(node, "subtitle"))
            .publishedDate(extractYear(textOrNull(node, "publish_date")))
            .openLibraryId(lastPathSegment(textOrNull(node, "key")))
            .source(SOURCE);

        for (JsonNode author : node.path("authors")) {
            String name = textOrNull(author, "name");
            if (name != null) {
                builder.author(name);
            }
        }
        JsonNode publishers = node.path("publishers");
        if (publishers.isArray() && publishers.size() > 0) {
            builder.publisher(textOrNull(publishers.get(0), "name"));
        }
        if (node.path("number_of_pages").isInt() && node.path("number_of_pages").asInt() > 0) {
            builder.pageCount(node.path("number_of_pages").asInt());
        }
        for (JsonNode subject : node.path("subjects")) {
            String name = subject.isObject() ? textOrNull(subject, "name") : subject.asText(null);
            if (ValidationUtils.hasText(name)) {
                builder.category(name.trim());
            }
        }
        JsonNode cover = node.path("cover");
        if (cover.isObject()) {
            String url = textOrNull(cover, "large");
            builder.coverUrl(url != null ? url : textOrNull(cover, "medium"));
        }

        JsonNode identifiers = node.path("identifiers");
        boolean sawIdentifier = false;
        for (JsonNode value : identifiers.path("isbn_13")) {
            String isbn = IsbnUtils.normalize(value.asText(null));
            if (isbn != null && isbn.length() == 13) {
                builder.isbn13(isbn);
                sawIdentifier = true;
            }
        }
        for (JsonNode value : identifiers.path("isbn_10")) {
            String isbn = IsbnUtils.normalize(value.asText(null));
            if (isbn != null && isbn.length() == 10) {
                builder.isbn10(isbn);
                sawIdentifier = true;
            }
        }
        String queried = IsbnUtils.normalize(queriedIsbn);
        if (!sawIdentifier && queried != null) {
            if (queried.length() == 13) {
                builder.isbn13(queried);
            } else {
                builder.isbn10(queried);
            }
        }
        return builder.build();
    }

    /**
     * Parses one document of the {@code /search.json} response.
     */
    public static MetadataRecord parseSearchDoc(JsonNode doc) {
        if (doc == null || !doc.isObject()) {
            return null;
        }
        String title = textOrNull(doc, "title");
        if (!ValidationUtils.hasText(title)) {
            return null;
        }
        MetadataRecord.MetadataRecordBuilder builder = MetadataRecord.builder()
            .title(title)
            .subtitle(textOrNull(doc, "subtitle"))
            .openLibraryId(lastPathSegment(textOrNull(doc, "key")))
            .source(SOURCE);
        for (JsonNode author : doc.path("author_name")) {
            if (ValidationUtils.hasText(author.asText(null))) {
                builder.author(author.asText().trim());
            }
        }
        if (doc.path("first_publish_year").isInt()) {
            builder.publishedDate(String.valueOf(doc.path("first_publish_year").asInt()));
        }
        JsonNode publishers = doc.path("publisher");
        if (publishers.isArray() && publishers.size() > 0) {
            builder.publisher(publishers.get(0).asText(null));
        }
        if (doc.path("number_of_pages_median").isInt()) {
            builder.pageCount(doc.path("number_of_pages_median").asInt());
        }
        if (doc.path("cover_i").isNumber()) {
            builder.coverUrl(String.format(COVER_BY_ID, doc.path("cover_i").asLong()));
        }
        // search documents list every edition's ISBN; one of each form is enough for a candidate
        boolean has13 = false;
        boolean has10 = false;
        for (JsonNode value : doc.path("isbn")) {
            String isbn = IsbnUtils.normalize(value.asText(null));
            if (isbn == null) {
                continue;
            }
            if (isbn.length() == 13 && !has13) {
                builder.isbn13(isbn);
                has13 = true;
            } else if (isbn.length() == 10 && !has10) {
                builder.isbn10(isbn);
                has10 = true;
            }
        }
        return builder.build();
    }

    static String extractYear(String publishDate) {
        if (publishDate == null) {
            return null;
        }
        Matcher matcher = YEAR.matcher(publishDate);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static String lastPathSegment(String key) {
        if (key == null) {
            return null;
        }
        return key.contains("/") ? key.substring(key.lastIndexOf('/') + 1) : key;
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
