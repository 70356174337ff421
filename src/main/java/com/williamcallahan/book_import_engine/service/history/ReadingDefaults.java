package com.williamcallahan.book_import_engine.service.history;

/**
 * Pages and minutes applied to a reading session that recorded neither. {@code null} means
 * "not configured".
 */
public record ReadingDefaults(Integer pages, Integer minutes) {

    public static ReadingDefaults none() {
        return new ReadingDefaults(null, null);
    }

    public boolean isConfigured() {
        return positive(pages) || positive(minutes);
    }

    public int pagesOrZero() {
        return positive(pages) ? pages : 0;
    }

    public int minutesOrZero() {
        return positive(minutes) ? minutes : 0;
    }

    private static boolean positive(Integer value) {
        return value != null && value > 0;
    }
}
