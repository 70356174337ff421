package com.williamcallahan.book_import_engine.service.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Cleanup of uploaded temp files once a job no longer needs them.
 */
final class ImportSourceFiles {

    private static final Logger logger = LoggerFactory.getLogger(ImportSourceFiles.class);

    private ImportSourceFiles() {
    }

    static void delete(Path path, String jobId) {
        if (path == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(path)) {
                logger.debug("Deleted source file {} of import job {}", path, jobId);
            }
        } catch (IOException e) {
            logger.warn("Could not delete source file {} of import job {}: {}", path, jobId, e.getMessage());
        }
    }
}
