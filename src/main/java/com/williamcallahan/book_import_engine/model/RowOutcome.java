package com.williamcallahan.book_import_engine.model;

/**
 * Result class of a single processed row.
 */
public enum RowOutcome {
    SUCCESS,
    MERGED,
    SKIPPED,
    ERROR;

    /**
     * Non-success outcomes are published to pollers immediately instead of waiting for the
     * progress throttle window.
     */
    public boolean bypassesThrottle() {
        return this == SKIPPED || this == ERROR;
    }
}
