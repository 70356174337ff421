package com.williamcallahan.book_import_engine.service.detect;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Header signatures of the recognized export formats.
 */
public final class FormatSignatures {

    private FormatSignatures() {
    }

    public static final FormatSignature GOODREADS = new FormatSignature(ImportFormat.GOODREADS, weights(
        "book id", 2.0,
        "title", 1.0,
        "author", 1.0,
        "my rating", 2.0,
        "exclusive shelf", 2.0,
        "bookshelves", 1.5,
        "bookshelves with positions", 2.0,
        "private notes", 1.5,
        "read count", 1.5,
        "owned copies", 1.5,
        "original publication year", 1.5,
        "date read", 1.0,
        "date added", 1.0,
        "binding", 1.0));

    public static final FormatSignature STORYGRAPH = new FormatSignature(ImportFormat.STORYGRAPH, weights(
        "title", 1.0,
        "authors", 1.0,
        "star rating", 2.0,
        "read status", 2.0,
        "date started", 2.0,
        "date finished", 2.0,
        "tags", 1.5,
        "moods", 2.0,
        "pace", 2.0,
        "character- or plot-driven?", 2.5,
        "strong character development?", 2.0,
        "loveable characters?", 2.0,
        "diverse characters?", 2.0,
        "flawed characters?", 2.0,
        "content warnings", 1.5,
        "format", 1.0));

    public static final FormatSignature READING_HISTORY = new FormatSignature(ImportFormat.READING_HISTORY, weights(
        "date", 2.0,
        "book name", 2.0,
        "pages read", 2.0,
        "minutes read", 2.0,
        "start page", 1.0,
        "end page", 1.0,
        "notes", 0.5));

    public static List<FormatSignature> all() {
        return List.of(GOODREADS, STORYGRAPH, READING_HISTORY);
    }

    private static Map<String, Double> weights(Object... pairs) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (Double) pairs[i + 1]);
        }
        return map;
    }
}
