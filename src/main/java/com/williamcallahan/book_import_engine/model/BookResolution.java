package com.williamcallahan.book_import_engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Decision for one book-name group of a reading-history import.
 *
 * @param action what to do with the group
 * @param bookId existing catalog id for {@link Action#MATCH}
 * @param title title for {@link Action#CREATE}
 * @param authors authors for {@link Action#CREATE}
 * @param isbn optional external identifier re-fetched before a {@link Action#CREATE}
 */
public record BookResolution(Action action, String bookId, String title, List<String> authors, String isbn) {

    public enum Action {
        MATCH,
        CREATE,
        SKIP,
        BOOKLESS;

        @JsonValue
        public String wireValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Action fromWireValue(String value) {
            return Action.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public BookResolution {
        authors = authors == null ? List.of() : List.copyOf(authors);
    }

    public static BookResolution match(String bookId) {
        return new BookResolution(Action.MATCH, bookId, null, null, null);
    }

    public static BookResolution create(String title, List<String> authors, String isbn) {
        return new BookResolution(Action.CREATE, null, title, authors, isbn);
    }

    public static BookResolution skip() {
        return new BookResolution(Action.SKIP, null, null, null, null);
    }

    public static BookResolution bookless() {
        return new BookResolution(Action.BOOKLESS, null, null, null, null);
    }
}
