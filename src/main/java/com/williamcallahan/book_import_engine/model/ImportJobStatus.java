package com.williamcallahan.book_import_engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle states shared by book imports and reading-history imports.
 *
 * <p>Book imports move {@code pending -> running -> completed|failed|cancelled}.
 * Reading-history imports move {@code analyzing -> (needs_book_matching | running) -> processing
 * -> completed|completed_with_errors|failed}, and may also be cancelled.</p>
 */
public enum ImportJobStatus {
    PENDING("pending"),
    ANALYZING("analyzing"),
    NEEDS_BOOK_MATCHING("needs_book_matching"),
    RUNNING("running"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    COMPLETED_WITH_ERRORS("completed_with_errors"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String wireValue;

    ImportJobStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == COMPLETED_WITH_ERRORS || this == FAILED || this == CANCELLED;
    }
}
