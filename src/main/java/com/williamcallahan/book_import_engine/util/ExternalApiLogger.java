package com.williamcallahan.book_import_engine.util;

import org.slf4j.Logger;

/**
 * Centralized logging for metadata provider calls made while enriching an import.
 *
 * Lines share one prefix so a single grep shows the whole enrichment traffic of a job:
 * - Google Books (primary)
 * - OpenLibrary (gap filler)
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String query, boolean authenticated) {
        String authType = authenticated ? "AUTHENTICATED" : "UNAUTHENTICATED";
        log.debug("{} [{}] {} ATTEMPT: {} for query='{}'", PREFIX, apiName, authType, operation, query);
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String query, int resultCount) {
        log.debug("{} [{}] SUCCESS: {} returned {} result(s) for query='{}'", PREFIX, apiName, operation, resultCount, query);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String query, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for query='{}' - {}", PREFIX, apiName, operation, query, reason);
    }

    /**
     * Log a resilience fallback (open circuit, rate limit, timeout) that turned a call into "no data"
     */
    public static void logFallback(Logger log, String apiName, String operation, String query, Throwable cause) {
        log.warn("{} [{}] FALLBACK: {} for query='{}' degraded to empty result ({})",
            PREFIX, apiName, operation, query, cause == null ? "unknown" : cause.getClass().getSimpleName());
    }

    /**
     * Log the start of a batch enrichment pass
     */
    public static void logBatchStart(Logger log, String jobId, int distinctIdentifiers, int concurrency) {
        log.info("{} [ENRICHMENT] START: job={}, distinctIsbns={}, concurrency={}", PREFIX, jobId, distinctIdentifiers, concurrency);
    }

    /**
     * Log the completion of a batch enrichment pass
     */
    public static void logBatchComplete(Logger log, String jobId, int distinctIdentifiers, int hits, long elapsedMillis) {
        log.info("{} [ENRICHMENT] COMPLETE: job={}, distinctIsbns={}, hits={}, elapsedMs={}",
            PREFIX, jobId, distinctIdentifiers, hits, elapsedMillis);
    }
}
