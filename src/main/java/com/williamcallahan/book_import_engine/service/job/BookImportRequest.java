package com.williamcallahan.book_import_engine.service.job;

import java.nio.file.Path;
import java.util.Map;

/**
 * Input for a standard book import, as handed over by the upload boundary.
 *
 * @param owner importing user
 * @param sourcePath locally readable temp file; deleted once the job ends
 * @param sourceFilename original file name, used in reports
 * @param mappingOverride column to token mapping replacing the detected one, or {@code null}
 * @param mappingTemplateId saved template to map the file with when there is no override, or {@code null}
 * @param enableEnrichment {@code null} uses the configured default
 * @param defaultReadingStatus status for rows without one, or {@code null} for the configured default
 */
public record BookImportRequest(String owner,
                                Path sourcePath,
                                String sourceFilename,
                                Map<String, String> mappingOverride,
                                String mappingTemplateId,
                                Boolean enableEnrichment,
                                String defaultReadingStatus) {

    public static BookImportRequest of(String owner, Path sourcePath, String sourceFilename) {
        return new BookImportRequest(owner, sourcePath, sourceFilename, null, null, null, null);
    }
}
