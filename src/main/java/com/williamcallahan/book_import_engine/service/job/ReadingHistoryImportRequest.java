package com.williamcallahan.book_import_engine.service.job;

import com.williamcallahan.book_import_engine.service.history.ReadingDefaults;

import java.nio.file.Path;
import java.util.Map;

/**
 * Input for a reading-history import.
 *
 * @param mappingTemplateId saved template to map the file with when there is no override, or {@code null}
 * @param ownerDefaults the owner's configured pages/minutes per session, or {@code null}
 */
public record ReadingHistoryImportRequest(String owner,
                                          Path sourcePath,
                                          String sourceFilename,
                                          Map<String, String> mappingOverride,
                                          String mappingTemplateId,
                                          ReadingDefaults ownerDefaults) {

    public static ReadingHistoryImportRequest of(String owner, Path sourcePath, String sourceFilename) {
        return new ReadingHistoryImportRequest(owner, sourcePath, sourceFilename, null, null, null);
    }
}
