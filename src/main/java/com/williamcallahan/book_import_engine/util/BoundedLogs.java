package com.williamcallahan.book_import_engine.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity list helpers for job activity and error logs; the oldest entries are dropped first.
 */
public final class BoundedLogs {

    private BoundedLogs() {
    }

    /**
     * Returns a new list holding {@code existing} followed by {@code additions}, keeping only the
     * newest {@code capacity} entries.
     */
    public static <T> List<T> append(List<T> existing, List<T> additions, int capacity) {
        List<T> combined = new ArrayList<>((existing == null ? 0 : existing.size()) + (additions == null ? 0 : additions.size()));
        if (existing != null) {
            combined.addAll(existing);
        }
        if (additions != null) {
            combined.addAll(additions);
        }
        return keepNewest(combined, capacity);
    }

    public static <T> List<T> keepNewest(List<T> entries, int capacity) {
        if (capacity <= 0) {
            return new ArrayList<>();
        }
        if (entries.size() <= capacity) {
            return new ArrayList<>(entries);
        }
        return new ArrayList<>(entries.subList(entries.size() - capacity, entries.size()));
    }
}
