/**
 * Publishes row outcomes to the job store for polling callers
 *
 * Features:
 * - One session per running job buffers activity lines and error entries
 * - Success and merge outcomes are emitted at most once per configured interval
 * - Skipped and error outcomes bypass the throttle together with anything pending
 * - Buffers are capped like the stored logs so a stalled emit cannot grow without bound
 */
package com.williamcallahan.book_import_engine.service.telemetry;

import com.williamcallahan.book_import_engine.config.ImportProperties;
import com.williamcallahan.book_import_engine.model.ImportCounters;
import com.williamcallahan.book_import_engine.model.ImportErrorEntry;
import com.williamcallahan.book_import_engine.model.ImportJobUpdate;
import com.williamcallahan.book_import_engine.model.RowOutcome;
import com.williamcallahan.book_import_engine.service.job.ImportJobStore;
import com.williamcallahan.book_import_engine.util.BoundedLogs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Component
public class ProgressTelemetryEmitter {

    private static final Logger logger = LoggerFactory.getLogger(ProgressTelemetryEmitter.class);

    private final ImportJobStore jobStore;
    private final ImportProperties properties;
    private final Clock clock;

    public ProgressTelemetryEmitter(ImportJobStore jobStore, ImportProperties properties, Clock clock) {
        this.jobStore = jobStore;
        this.properties = properties;
        this.clock = clock;
    }

    public ProgressSession open(String owner, String jobId) {
        return new ProgressSession(owner, jobId);
    }

    /**
     * Emit state for one job. Not thread-safe; a job's row loop is sequential.
     */
    public final class ProgressSession {

        private final String owner;
        private final String jobId;
        private final Duration interval;
        private List<String> pendingActivity = new ArrayList<>();
        private List<ImportErrorEntry> pendingErrors = new ArrayList<>();
        private ImportCounters latestCounters;
        private String currentItem;
        private Instant lastEmit;
        private int emitCount;

        private ProgressSession(String owner, String jobId) {
            this.owner = owner;
            this.jobId = jobId;
            this.interval = properties.getProgressEmitInterval();
            this.lastEmit = clock.instant();
        }

        /**
         * Records one row outcome and emits if the outcome or the elapsed time calls for it.
         *
         * @return {@code true} if this call produced a store update
         */
        public boolean record(RowOutcome outcome, ImportCounters counters, String item,
                              String activity, ImportErrorEntry error) {
            latestCounters = counters;
            if (item != null) {
                currentItem = item;
            }
            if (activity != null) {
                pendingActivity.add(activity);
                pendingActivity = BoundedLogs.keepNewest(pendingActivity, properties.getActivityLogCap());
            }
            if (error != null) {
                pendingErrors.add(error);
                pendingErrors = BoundedLogs.keepNewest(pendingErrors, properties.getErrorLogCap());
            }
            Instant now = clock.instant();
            if (outcome.bypassesThrottle() || !now.isBefore(lastEmit.plus(interval))) {
                emit(now);
                return true;
            }
            return false;
        }

        /**
         * Job-level message, emitted immediately.
         */
        public void note(String activity, ImportCounters counters) {
            latestCounters = counters;
            pendingActivity.add(activity);
            pendingActivity = BoundedLogs.keepNewest(pendingActivity, properties.getActivityLogCap());
            emit(clock.instant());
        }

        public void flush(ImportCounters counters) {
            latestCounters = counters;
            emit(clock.instant());
        }

        public int getEmitCount() {
            return emitCount;
        }

        private void emit(Instant now) {
            ImportJobUpdate update = ImportJobUpdate.builder()
                .counters(latestCounters)
                .currentItem(currentItem)
                .activityLines(pendingActivity)
                .errors(pendingErrors)
                .build();
            if (!jobStore.update(owner, jobId, update)) {
                logger.warn("Progress update for import job {} was dropped; job no longer in store", jobId);
            }
            pendingActivity = new ArrayList<>();
            pendingErrors = new ArrayList<>();
            lastEmit = now;
            emitCount++;
        }
    }
}
