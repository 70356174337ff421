package com.williamcallahan.book_import_engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The two import pipelines a job can run through.
 */
public enum ImportJobKind {
    BOOK_IMPORT("book_import"),
    READING_HISTORY_IMPORT("reading_history_import");

    private final String wireValue;

    ImportJobKind(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
