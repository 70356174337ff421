package com.williamcallahan.book_import_engine.service.job;

import com.williamcallahan.book_import_engine.model.ImportJob;

/**
 * Reads the job's {@code cancelRequested} flag from the store on every check. A job that has
 * vanished from the store counts as cancelled.
 */
public class JobStoreCancellationToken implements CancellationToken {

    private final ImportJobStore store;
    private final String owner;
    private final String jobId;

    public JobStoreCancellationToken(ImportJobStore store, String owner, String jobId) {
        this.store = store;
        this.owner = owner;
        this.jobId = jobId;
    }

    @Override
    public boolean isCancellationRequested() {
        return store.get(owner, jobId).map(ImportJob::isCancelRequested).orElse(true);
    }
}
