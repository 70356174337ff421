/**
 * Declarative header alias tables per source format
 *
 * Features:
 * - One lower-case header to mapping-token table per known format
 * - Service-specific shelves, moods and tags routed to scoped custom fields instead of categories
 * - Keyword table plus substring fallback for files of unknown origin
 * - Every token is parsed once when the class loads, so a bad table entry fails fast
 */
package com.williamcallahan.book_import_engine.service.detect;

import com.williamcallahan.book_import_engine.model.CanonicalField;
import com.williamcallahan.book_import_engine.model.MappingTarget;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class FieldAliasTable {

    private static final Map<ImportFormat, Map<String, MappingTarget>> TABLES = new EnumMap<>(ImportFormat.class);

    static {
        TABLES.put(ImportFormat.GOODREADS, parse(
            "book id", "custom_global_goodreads_book_id",
            "title", "title",
            "author", "author",
            "additional authors", "additional_authors",
            "isbn", "isbn",
            "isbn13", "isbn",
            "my rating", "user_rating",
            "average rating", "average_rating",
            "publisher", "publisher",
            "number of pages", "page_count",
            "year published", "publication_year",
            "original publication year", "custom_global_original_publication_year",
            "date read", "date_read",
            "date added", "date_added",
            "bookshelves", "custom_personal_goodreads_shelves",
            "bookshelves with positions", "custom_global_shelf_positions",
            "exclusive shelf", "reading_status",
            "my review", "personal_notes",
            "private notes", "custom_personal_private_notes",
            "binding", "custom_global_binding_type",
            "spoiler", "custom_personal_spoiler_flag",
            "read count", "custom_personal_read_count",
            "owned copies", "custom_personal_owned_copies"));

        TABLES.put(ImportFormat.STORYGRAPH, parse(
            "title", "title",
            "authors", "author",
            "author", "author",
            "contributors", "additional_authors",
            "isbn/uid", "isbn",
            "isbn", "isbn",
            "isbn13", "isbn",
            "format", "custom_global_format",
            "read status", "reading_status",
            "date added", "date_added",
            "date started", "start_date",
            "last date read", "date_read",
            "date finished", "date_read",
            "dates read", "ignore",
            "read count", "custom_personal_read_count",
            "star rating", "user_rating",
            "review", "personal_notes",
            "tags", "custom_personal_storygraph_tags",
            "moods", "custom_global_moods",
            "pace", "custom_global_pace",
            "character- or plot-driven?", "custom_global_character_plot_driven",
            "strong character development?", "custom_personal_character_development",
            "loveable characters?", "custom_personal_loveable_characters",
            "diverse characters?", "custom_personal_diverse_characters",
            "flawed characters?", "custom_personal_flawed_characters",
            "content warnings", "custom_personal_content_warnings",
            "content warning description", "custom_personal_content_warning_description",
            "owned?", "custom_personal_owned"));

        TABLES.put(ImportFormat.READING_HISTORY, parse(
            "date", "date",
            "reading date", "date",
            "session date", "date",
            "book name", "book_name",
            "book", "book_name",
            "book title", "book_name",
            "pages read", "pages_read",
            "pages", "pages_read",
            "minutes read", "minutes_read",
            "minutes", "minutes_read",
            "start page", "start_page",
            "end page", "end_page",
            "notes", "notes"));

        TABLES.put(ImportFormat.UNKNOWN, parse(
            "title", "title",
            "book title", "title",
            "name", "title",
            "book name", "title",
            "subtitle", "subtitle",
            "author", "author",
            "author name", "author",
            "writer", "author",
            "authors", "author",
            "main author", "author",
            "primary author", "author",
            "additional authors", "additional_authors",
            "co-authors", "additional_authors",
            "other authors", "additional_authors",
            "isbn", "isbn",
            "isbn10", "isbn",
            "isbn13", "isbn",
            "isbn-10", "isbn",
            "isbn-13", "isbn",
            "ean", "isbn",
            "asin", "asin",
            "rating", "user_rating",
            "my rating", "user_rating",
            "user rating", "user_rating",
            "personal rating", "user_rating",
            "publisher", "publisher",
            "publishing company", "publisher",
            "pages", "page_count",
            "page count", "page_count",
            "number of pages", "page_count",
            "total pages", "page_count",
            "year", "publication_year",
            "publication year", "publication_year",
            "published year", "publication_year",
            "year published", "publication_year",
            "published date", "published_date",
            "publication date", "published_date",
            "language", "language",
            "description", "description",
            "summary", "description",
            "categories", "categories",
            "genre", "categories",
            "genres", "categories",
            "subjects", "categories",
            "date read", "date_read",
            "reading date", "date_read",
            "finished date", "date_read",
            "date added", "date_added",
            "added date", "date_added",
            "status", "reading_status",
            "reading status", "reading_status",
            "shelf", "reading_status",
            "notes", "personal_notes",
            "review", "personal_notes",
            "my review", "personal_notes",
            "comments", "personal_notes",
            "cover", "cover_url",
            "cover url", "cover_url",
            "series", "custom_global_series"));
    }

    private FieldAliasTable() {
    }

    /**
     * Exact alias lookup for a header in the table of the given format.
     */
    public static Optional<MappingTarget> lookup(ImportFormat format, String header) {
        if (header == null) {
            return Optional.empty();
        }
        Map<String, MappingTarget> table = TABLES.get(format == ImportFormat.ISBN_LIST ? ImportFormat.UNKNOWN : format);
        return Optional.ofNullable(table.get(normalize(header)));
    }

    /**
     * Substring fallback for headers that no table recognizes, e.g. "Book ISBN (13)".
     */
    public static Optional<MappingTarget> keywordFallback(String header) {
        String normalized = normalize(header);
        if (normalized.contains("isbn")) {
            return Optional.of(MappingTarget.core(CanonicalField.ISBN));
        }
        if (normalized.contains("title")) {
            return Optional.of(MappingTarget.core(CanonicalField.TITLE));
        }
        if (normalized.contains("author")) {
            return Optional.of(MappingTarget.core(CanonicalField.AUTHOR));
        }
        return Optional.empty();
    }

    public static Map<String, MappingTarget> table(ImportFormat format) {
        return Collections.unmodifiableMap(TABLES.getOrDefault(format, Map.of()));
    }

    static String normalize(String header) {
        return header == null ? "" : header.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, MappingTarget> parse(String... pairs) {
        Map<String, MappingTarget> table = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            table.put(pairs[i], MappingTarget.parse(pairs[i + 1]));
        }
        return table;
    }
}
