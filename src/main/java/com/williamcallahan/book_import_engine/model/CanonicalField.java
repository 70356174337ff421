package com.williamcallahan.book_import_engine.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Canonical fields an import column can be mapped onto.
 *
 * <p>Custom metadata columns are not part of this enum; they are carried by
 * {@link MappingTarget} with a {@link FieldScope}.</p>
 */
public enum CanonicalField {
    TITLE("title"),
    SUBTITLE("subtitle"),
    AUTHOR("author"),
    ADDITIONAL_AUTHORS("additional_authors"),
    ISBN("isbn"),
    ASIN("asin"),
    PUBLISHER("publisher"),
    PAGE_COUNT("page_count"),
    PUBLICATION_YEAR("publication_year"),
    PUBLISHED_DATE("published_date"),
    LANGUAGE("language"),
    DESCRIPTION("description"),
    COVER_URL("cover_url"),
    CATEGORIES("categories"),
    AVERAGE_RATING("average_rating"),
    RATING_COUNT("rating_count"),
    USER_RATING("user_rating"),
    READING_STATUS("reading_status"),
    DATE_READ("date_read"),
    DATE_ADDED("date_added"),
    START_DATE("start_date"),
    PERSONAL_NOTES("personal_notes"),

    // reading history columns
    DATE("date"),
    BOOK_NAME("book_name"),
    PAGES_READ("pages_read"),
    MINUTES_READ("minutes_read"),
    START_PAGE("start_page"),
    END_PAGE("end_page"),
    NOTES("notes"),

    IGNORE("ignore");

    private static final Map<String, CanonicalField> BY_TOKEN = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(CanonicalField::getToken, Function.identity()));

    private final String token;

    CanonicalField(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static Optional<CanonicalField> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TOKEN.get(token.trim().toLowerCase(Locale.ROOT)));
    }
}
