package com.williamcallahan.book_import_engine.service.history;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.book_import_engine.config.ImportProperties;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Plans of jobs blocked in {@code needs_book_matching}. A plan can be taken only once.
 */
@Component
public class PendingReadingHistoryPlans {

    private record PlanKey(String owner, String jobId) {
    }

    private final Cache<PlanKey, ReadingHistoryPlan> plans;

    public PendingReadingHistoryPlans(ImportProperties properties) {
        this.plans = Caffeine.newBuilder()
            .expireAfterWrite(properties.getJobRetention())
            .build();
    }

    public void put(ReadingHistoryPlan plan) {
        plans.put(new PlanKey(plan.owner(), plan.jobId()), plan);
    }

    public boolean contains(String owner, String jobId) {
        return plans.getIfPresent(new PlanKey(owner, jobId)) != null;
    }

    /**
     * Removes and returns the plan; concurrent callers cannot both receive it.
     */
    public Optional<ReadingHistoryPlan> take(String owner, String jobId) {
        return Optional.ofNullable(plans.asMap().remove(new PlanKey(owner, jobId)));
    }

    public void discard(String owner, String jobId) {
        plans.invalidate(new PlanKey(owner, jobId));
    }
}
