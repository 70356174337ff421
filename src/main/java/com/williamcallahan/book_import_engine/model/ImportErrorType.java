package com.williamcallahan.book_import_engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Row-level error taxonomy recorded in a job's error log.
 */
public enum ImportErrorType {
    /** Bad or missing required row data; the row is skipped. */
    VALIDATION_ERROR("validation_error"),
    /** Identifier present, enrichment unusable, and the row carried no title. */
    LOOKUP_FAILED("lookup_failed"),
    /** The catalog rejected a create that was not a duplicate. */
    ADD_FAILED("add_failed"),
    /** A duplicate was found but patching it failed. */
    DUPLICATE_MERGE_FAILED("duplicate_merge_failed"),
    /** Any unhandled fault caught at the row boundary. */
    EXCEPTION("exception");

    private final String wireValue;

    ImportErrorType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
