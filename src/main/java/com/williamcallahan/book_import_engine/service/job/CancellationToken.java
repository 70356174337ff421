package com.williamcallahan.book_import_engine.service.job;

/**
 * Cooperative cancellation signal checked by row loops between rows.
 */
@FunctionalInterface
public interface CancellationToken {

    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();
}
