package com.williamcallahan.book_import_engine.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The owner's relationship to a catalog book: status, rating, notes and personal custom values.
 */
public record PersonalBookData(String readingStatus,
                               Double userRating,
                               String personalNotes,
                               LocalDate dateRead,
                               LocalDate dateAdded,
                               LocalDate startDate,
                               Map<String, String> customMetadata) {

    public PersonalBookData {
        customMetadata = customMetadata == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(customMetadata));
    }
}
