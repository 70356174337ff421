package com.williamcallahan.book_import_engine.model;

import com.williamcallahan.book_import_engine.util.BoundedLogs;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partial update applied atomically by the job store. Unset fields leave the job unchanged; log
 * additions are appended and capped.
 */
@Getter
@Builder
public class ImportJobUpdate {

    private final ImportJobStatus status;
    private final ImportCounters counters;
    private final String currentItem;
    @Singular
    private final List<String> activityLines;
    @Singular
    private final List<ImportErrorEntry> errors;
    private final Map<String, String> fieldMapping;
    private final String format;
    private final List<MatchingGroupView> matchingGroups;
    private final Boolean cancelRequested;
    private final String failureMessage;
    private final Instant completedAt;

    public static ImportJobUpdate status(ImportJobStatus status) {
        return ImportJobUpdate.builder().status(status).build();
    }

    public void applyTo(ImportJob job, int activityCap, int errorCap, Instant now) {
        if (status != null) {
            job.setStatus(status);
        }
        if (counters != null) {
            job.setCounters(counters);
        }
        if (currentItem != null) {
            job.setCurrentItem(currentItem);
        }
        if (!activityLines.isEmpty() || job.getActivityLog().size() > activityCap) {
            job.setActivityLog(BoundedLogs.append(job.getActivityLog(), activityLines, activityCap));
        }
        if (!errors.isEmpty() || job.getErrorLog().size() > errorCap) {
            job.setErrorLog(BoundedLogs.append(job.getErrorLog(), errors, errorCap));
        }
        if (fieldMapping != null) {
            job.setFieldMapping(new LinkedHashMap<>(fieldMapping));
        }
        if (format != null) {
            job.setFormat(format);
        }
        if (matchingGroups != null) {
            job.setMatchingGroups(new ArrayList<>(matchingGroups));
        }
        if (cancelRequested != null) {
            job.setCancelRequested(cancelRequested);
        }
        if (failureMessage != null) {
            job.setFailureMessage(failureMessage);
        }
        if (completedAt != null) {
            job.setCompletedAt(completedAt);
        }
        job.setUpdatedAt(now);
    }
}
