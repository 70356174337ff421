package com.williamcallahan.book_import_engine.exception;

/**
 * A catalog write was rejected for a reason other than the record already existing.
 */
public class CatalogOperationException extends RuntimeException {

    public CatalogOperationException(String message) {
        super(message);
    }

    public CatalogOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
