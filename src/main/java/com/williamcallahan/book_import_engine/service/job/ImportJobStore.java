package com.williamcallahan.book_import_engine.service.job;

import com.williamcallahan.book_import_engine.model.ImportJob;
import com.williamcallahan.book_import_engine.model.ImportJobUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Per-owner registry of import job status documents.
 *
 * <p>Implementations must isolate owners: a lookup never returns a job created under another
 * owner. Returned jobs are snapshots; mutating them does not change the stored state.</p>
 */
public interface ImportJobStore {

    void create(String owner, String jobId, ImportJob job);

    Optional<ImportJob> get(String owner, String jobId);

    /**
     * Atomically applies a partial update.
     *
     * @return {@code false} if the job does not exist (or has expired)
     */
    boolean update(String owner, String jobId, ImportJobUpdate update);

    /**
     * Jobs of one owner, newest first.
     */
    List<ImportJob> listForOwner(String owner);
}
