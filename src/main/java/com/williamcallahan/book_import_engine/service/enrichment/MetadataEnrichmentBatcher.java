/**
 * Batched metadata enrichment for one import file
 *
 * Features:
 * - Normalizes and check-digit validates every identifier, discarding invalid ones
 * - De-duplicates editions by their ISBN-13 form before any network call
 * - Bounded fan-out sized to the distinct identifier count, capped by configuration
 * - Random jitter before each request to avoid bursts against provider rate limits
 * - Indexes each record under every ISBN form it carries
 * - Never throws; per-identifier failures are logged and left out of the result
 */
package com.williamcallahan.book_import_engine.service.enrichment;

import com.williamcallahan.book_import_engine.config.ImportProperties;
import com.williamcallahan.book_import_engine.model.MetadataRecord;
import com.williamcallahan.book_import_engine.service.provider.MetadataLookupService;
import com.williamcallahan.book_import_engine.util.ExternalApiLogger;
import com.williamcallahan.book_import_engine.util.IsbnUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class MetadataEnrichmentBatcher {

    private static final Logger logger = LoggerFactory.getLogger(MetadataEnrichmentBatcher.class);

    private final MetadataLookupService lookupService;
    private final ImportProperties properties;

    public MetadataEnrichmentBatcher(MetadataLookupService lookupService, ImportProperties properties) {
        this.lookupService = lookupService;
        this.properties = properties;
    }

    /**
     * Fetches metadata for every valid identifier and blocks until all lookups finish.
     *
     * @param jobId job the pass belongs to, for logging
     * @param rawIdentifiers identifiers exactly as read from the file
     * @return an attempted index, possibly empty
     */
    public EnrichmentIndex enrich(String jobId, Collection<String> rawIdentifiers) {
        long started = System.currentTimeMillis();
        Map<String, String> distinct = distinctIdentifiers(rawIdentifiers);
        if (distinct.isEmpty()) {
            return new EnrichmentIndex(Map.of(), true);
        }
        ImportProperties.Enrichment config = properties.getEnrichment();
        int concurrency = Math.max(1, Math.min(distinct.size(), config.getMaxConcurrency()));
        ExternalApiLogger.logBatchStart(logger, jobId, distinct.size(), concurrency);

        Map<String, MetadataRecord> index = new HashMap<>();
        try {
            List<Map.Entry<String, MetadataRecord>> found = Flux.fromIterable(distinct.values())
                .flatMap(isbn -> fetchOne(isbn, config), concurrency)
                .collectList()
                .block();
            if (found != null) {
                for (Map.Entry<String, MetadataRecord> entry : found) {
                    for (String key : EnrichmentIndex.indexKeys(entry.getKey(), entry.getValue())) {
                        index.putIfAbsent(key, entry.getValue());
                    }
                }
            }
        } catch (RuntimeException e) {
            logger.error("Enrichment pass for job {} aborted; continuing with {} indexed identifiers", jobId, index.size(), e);
        }

        EnrichmentIndex result = new EnrichmentIndex(index, true);
        ExternalApiLogger.logBatchComplete(logger, jobId, distinct.size(), result.distinctRecords(),
            System.currentTimeMillis() - started);
        return result;
    }

    /**
     * Valid identifiers keyed by their ISBN-13 form; the first spelling seen is the one queried.
     */
    static Map<String, String> distinctIdentifiers(Collection<String> rawIdentifiers) {
        Map<String, String> distinct = new LinkedHashMap<>();
        if (rawIdentifiers == null) {
            return distinct;
        }
        for (String raw : rawIdentifiers) {
            String normalized = IsbnUtils.normalize(raw);
            if (normalized == null) {
                continue;
            }
            distinct.putIfAbsent(IsbnUtils.canonicalKey(normalized), normalized);
        }
        return distinct;
    }

    private Mono<Map.Entry<String, MetadataRecord>> fetchOne(String isbn, ImportProperties.Enrichment config) {
        return Mono.delay(jitter(config))
            .then(Mono.defer(() -> lookupService.lookupByIsbn(isbn)))
            .map(record -> Map.entry(isbn, record))
            .onErrorResume(e -> {
                logger.warn("Enrichment lookup failed for ISBN {}: {}", isbn, e.getMessage());
                return Mono.empty();
            });
    }

    private static Duration jitter(ImportProperties.Enrichment config) {
        long min = Math.max(0, config.getJitterMin().toMillis());
        long max = Math.max(min, config.getJitterMax().toMillis());
        long millis = max == min ? min : ThreadLocalRandom.current().nextLong(min, max + 1);
        return Duration.ofMillis(millis);
    }
}
