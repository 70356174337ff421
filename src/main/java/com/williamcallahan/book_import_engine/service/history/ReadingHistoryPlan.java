package com.williamcallahan.book_import_engine.service.history;

import com.williamcallahan.book_import_engine.model.BookResolution;
import com.williamcallahan.book_import_engine.model.ImportCounters;

import java.util.List;
import java.util.Map;

/**
 * Analyzed reading-history job waiting for finalization.
 *
 * @param jobId job the plan belongs to
 * @param owner job owner
 * @param groups entry groups in first-seen order
 * @param autoResolutions resolutions decided without a human, keyed by group key
 * @param analysisCounters counters after the analyzing phase
 * @param defaultReadingStatus reading status given to books created for this job
 */
public record ReadingHistoryPlan(String jobId,
                                 String owner,
                                 List<ReadingHistoryGroup> groups,
                                 Map<String, BookResolution> autoResolutions,
                                 ImportCounters analysisCounters,
                                 String defaultReadingStatus) {

    public ReadingHistoryPlan {
        groups = List.copyOf(groups);
        autoResolutions = Map.copyOf(autoResolutions);
    }

    public List<ReadingHistoryGroup> unresolvedGroups() {
        return groups.stream().filter(group -> !autoResolutions.containsKey(group.getKey())).toList();
    }
}
