package com.williamcallahan.book_import_engine.service.detect;

import com.fasterxml.jackson.annotation.JsonValue;
import com.williamcallahan.book_import_engine.model.ImportJobKind;

/**
 * Source formats the detector can recognize.
 */
public enum ImportFormat {
    GOODREADS("goodreads"),
    STORYGRAPH("storygraph"),
    READING_HISTORY("reading_history"),
    ISBN_LIST("isbn_list"),
    UNKNOWN("unknown");

    private final String wireValue;

    ImportFormat(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public ImportJobKind jobKind() {
        return this == READING_HISTORY ? ImportJobKind.READING_HISTORY_IMPORT : ImportJobKind.BOOK_IMPORT;
    }
}
