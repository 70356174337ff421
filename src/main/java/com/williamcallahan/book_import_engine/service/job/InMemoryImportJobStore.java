/**
 * Caffeine-backed job store used by the single-process deployment
 *
 * Features:
 * - Entries expire a fixed time after their last write
 * - Keys combine owner and job id so owners never see each other's jobs
 * - Updates run inside the cache's atomic compute and enforce log caps
 * - Reads and writes exchange copies, never the stored instance
 */
package com.williamcallahan.book_import_engine.service.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.book_import_engine.config.ImportProperties;
import com.williamcallahan.book_import_engine.model.ImportJob;
import com.williamcallahan.book_import_engine.model.ImportJobUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Component
public class InMemoryImportJobStore implements ImportJobStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryImportJobStore.class);

    private record JobKey(String owner, String jobId) {
    }

    private final Cache<JobKey, ImportJob> jobs;
    private final ImportProperties properties;
    private final Clock clock;

    public InMemoryImportJobStore(ImportProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.jobs = Caffeine.newBuilder()
            .expireAfterWrite(properties.getJobRetention())
            .build();
    }

    @Override
    public void create(String owner, String jobId, ImportJob job) {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(jobId, "jobId");
        ImportJob stored = job.copy();
        stored.setId(jobId);
        stored.setOwner(owner);
        jobs.put(new JobKey(owner, jobId), stored);
        logger.debug("Registered import job {} for owner {}", jobId, owner);
    }

    @Override
    public Optional<ImportJob> get(String owner, String jobId) {
        if (owner == null || jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.getIfPresent(new JobKey(owner, jobId))).map(ImportJob::copy);
    }

    @Override
    public boolean update(String owner, String jobId, ImportJobUpdate update) {
        if (owner == null || jobId == null || update == null) {
            return false;
        }
        Instant now = clock.instant();
        ImportJob updated = jobs.asMap().computeIfPresent(new JobKey(owner, jobId), (key, current) -> {
            ImportJob next = current.copy();
            update.applyTo(next, properties.getActivityLogCap(), properties.getErrorLogCap(), now);
            return next;
        });
        if (updated == null) {
            logger.debug("Ignoring update for unknown import job {} (owner {})", jobId, owner);
            return false;
        }
        return true;
    }

    @Override
    public List<ImportJob> listForOwner(String owner) {
        return jobs.asMap().entrySet().stream()
            .filter(entry -> entry.getKey().owner().equals(owner))
            .map(entry -> entry.getValue().copy())
            .sorted(Comparator.comparing(ImportJob::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
            .toList();
    }
}
