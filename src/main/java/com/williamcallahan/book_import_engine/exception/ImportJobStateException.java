package com.williamcallahan.book_import_engine.exception;

/**
 * The requested operation is not legal for the job's current status.
 */
public class ImportJobStateException extends RuntimeException {

    public ImportJobStateException(String message) {
        super(message);
    }
}
