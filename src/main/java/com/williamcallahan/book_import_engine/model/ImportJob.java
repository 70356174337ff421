/**
 * Status document for one triggered import, owned by the job store
 *
 * Features:
 * - Counters, bounded activity log and bounded error log for polling callers
 * - Field mapping and detected format used for the run
 * - Matching groups exposed while a reading-history import waits for a human
 * - Cancellation flag read cooperatively at each row boundary
 */
package com.williamcallahan.book_import_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
public class ImportJob {

    private String id;
    private String owner;
    private ImportJobKind kind;
    private ImportJobStatus status;
    private ImportCounters counters = ImportCounters.empty();
    private String currentItem;
    private List<String> activityLog = new ArrayList<>();
    private List<ImportErrorEntry> errorLog = new ArrayList<>();
    @JsonIgnore
    private Path sourcePath;
    private String sourceFilename;
    private String format;
    private Map<String, String> fieldMapping = new LinkedHashMap<>();
    private List<MatchingGroupView> matchingGroups = new ArrayList<>();
    private boolean enrichmentEnabled = true;
    private boolean cancelRequested;
    private String failureMessage;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    public static ImportJob newJob(String id, String owner, ImportJobKind kind, ImportJobStatus status, Instant now) {
        ImportJob job = new ImportJob();
        job.setId(id);
        job.setOwner(owner);
        job.setKind(kind);
        job.setStatus(status);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        return job;
    }

    @JsonProperty("progressPercentage")
    public double getProgressPercentage() {
        return counters == null ? 0.0 : counters.progressPercentage();
    }

    public ImportJob copy() {
        ImportJob copy = new ImportJob();
        copy.setId(id);
        copy.setOwner(owner);
        copy.setKind(kind);
        copy.setStatus(status);
        copy.setCounters(counters);
        copy.setCurrentItem(currentItem);
        copy.setActivityLog(new ArrayList<>(activityLog));
        copy.setErrorLog(new ArrayList<>(errorLog));
        copy.setSourcePath(sourcePath);
        copy.setSourceFilename(sourceFilename);
        copy.setFormat(format);
        copy.setFieldMapping(new LinkedHashMap<>(fieldMapping));
        copy.setMatchingGroups(new ArrayList<>(matchingGroups));
        copy.setEnrichmentEnabled(enrichmentEnabled);
        copy.setCancelRequested(cancelRequested);
        copy.setFailureMessage(failureMessage);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        copy.setCompletedAt(completedAt);
        return copy;
    }
}
