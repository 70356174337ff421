package com.williamcallahan.book_import_engine.exception;

/**
 * Raised synchronously when an uploaded file has no parseable header and is not a bare ISBN list.
 * No job is created in that case.
 */
public class UnsupportedImportFileException extends RuntimeException {

    public UnsupportedImportFileException(String message) {
        super(message);
    }

    public UnsupportedImportFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
