/**
 * Import pipeline configuration properties
 *
 * Features:
 * - Bounded log capacities and progress throttle interval
 * - Enrichment fan-out limits and jitter bounds
 * - Format detection thresholds
 * - Reading-history defaults and candidate limits
 */

package com.williamcallahan.book_import_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app.import")
public class ImportProperties {
    private int activityLogCap = 25;
    private int errorLogCap = 200;
    private Duration progressEmitInterval = Duration.ofMillis(350);
    private Duration jobRetention = Duration.ofHours(24);
    private String defaultReadingStatus = "plan_to_read";

    @NestedConfigurationProperty
    private Enrichment enrichment = new Enrichment();
    @NestedConfigurationProperty
    private Detection detection = new Detection();
    @NestedConfigurationProperty
    private ReadingHistory readingHistory = new ReadingHistory();

    public int getActivityLogCap() { return activityLogCap; }
    public void setActivityLogCap(int activityLogCap) { this.activityLogCap = activityLogCap; }

    public int getErrorLogCap() { return errorLogCap; }
    public void setErrorLogCap(int errorLogCap) { this.errorLogCap = errorLogCap; }

    public Duration getProgressEmitInterval() { return progressEmitInterval; }
    public void setProgressEmitInterval(Duration progressEmitInterval) { this.progressEmitInterval = progressEmitInterval; }

    public Duration getJobRetention() { return jobRetention; }
    public void setJobRetention(Duration jobRetention) { this.jobRetention = jobRetention; }

    public String getDefaultReadingStatus() { return defaultReadingStatus; }
    public void setDefaultReadingStatus(String defaultReadingStatus) { this.defaultReadingStatus = defaultReadingStatus; }

    public Enrichment getEnrichment() { return enrichment; }
    public void setEnrichment(Enrichment enrichment) { this.enrichment = enrichment; }

    public Detection getDetection() { return detection; }
    public void setDetection(Detection detection) { this.detection = detection; }

    public ReadingHistory getReadingHistory() { return readingHistory; }
    public void setReadingHistory(ReadingHistory readingHistory) { this.readingHistory = readingHistory; }

    public static class Enrichment {
        private boolean enabled = true;
        private int maxConcurrency = 5;
        private Duration jitterMin = Duration.ofMillis(50);
        private Duration jitterMax = Duration.ofMillis(250);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration requestTimeout = Duration.ofSeconds(5);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

        public Duration getJitterMin() { return jitterMin; }
        public void setJitterMin(Duration jitterMin) { this.jitterMin = jitterMin; }

        public Duration getJitterMax() { return jitterMax; }
        public void setJitterMax(Duration jitterMax) { this.jitterMax = jitterMax; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }

    public static class Detection {
        private double minConfidence = 0.3;
        private double isbnListThreshold = 0.8;
        private int sampleLines = 20;

        public double getMinConfidence() { return minConfidence; }
        public void setMinConfidence(double minConfidence) { this.minConfidence = minConfidence; }

        public double getIsbnListThreshold() { return isbnListThreshold; }
        public void setIsbnListThreshold(double isbnListThreshold) { this.isbnListThreshold = isbnListThreshold; }

        public int getSampleLines() { return sampleLines; }
        public void setSampleLines(int sampleLines) { this.sampleLines = sampleLines; }
    }

    public static class ReadingHistory {
        private int defaultPages = 0;
        private int defaultMinutes = 0;
        private int candidateLimit = 5;

        public int getDefaultPages() { return defaultPages; }
        public void setDefaultPages(int defaultPages) { this.defaultPages = defaultPages; }

        public int getDefaultMinutes() { return defaultMinutes; }
        public void setDefaultMinutes(int defaultMinutes) { this.defaultMinutes = defaultMinutes; }

        public int getCandidateLimit() { return candidateLimit; }
        public void setCandidateLimit(int candidateLimit) { this.candidateLimit = candidateLimit; }
    }
}
