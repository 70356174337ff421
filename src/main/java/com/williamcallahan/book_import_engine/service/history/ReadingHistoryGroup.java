package com.williamcallahan.book_import_engine.service.history;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * All entries of a reading-history file naming the same book, compared case-insensitively.
 */
public class ReadingHistoryGroup {

    public static final String BOOKLESS_KEY = "__bookless__";

    private final String key;
    private final String displayName;
    private final List<ReadingHistoryEntryDraft> entries = new ArrayList<>();

    public ReadingHistoryGroup(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    /**
     * Grouping key for a raw book name; blank names share {@link #BOOKLESS_KEY}.
     */
    public static String keyFor(String bookName) {
        if (bookName == null || bookName.isBlank()) {
            return BOOKLESS_KEY;
        }
        return bookName.trim().toLowerCase(Locale.ROOT);
    }

    public void add(ReadingHistoryEntryDraft entry) {
        entries.add(entry);
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<ReadingHistoryEntryDraft> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isBookless() {
        return BOOKLESS_KEY.equals(key);
    }
}
