package com.williamcallahan.book_import_engine.exception;

public class ImportJobNotFoundException extends RuntimeException {

    public ImportJobNotFoundException(String owner, String jobId) {
        super("Import job " + jobId + " not found for owner " + owner);
    }
}
