/**
 * Google Books metadata provider
 *
 * Features:
 * - ISBN lookup through the volumes search endpoint ({@code q=isbn:})
 * - Title search ({@code q=intitle:}) for reading-history matching candidates
 * - Optional API key, unauthenticated calls otherwise
 * - Circuit breaker and rate limiter with fallbacks that degrade to empty results
 */
package com.williamcallahan.book_import_engine.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.book_import_engine.model.MetadataRecord;
import com.williamcallahan.book_import_engine.util.ExternalApiLogger;
import com.williamcallahan.book_import_engine.util.ValidationUtils;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Service
@Order(1)
@Slf4j
public class GoogleBooksMetadataProvider implements MetadataProvider {

    private static final String API_NAME = "GoogleBooks";

    private final WebClient webClient;
    private final String apiKey;

    public GoogleBooksMetadataProvider(WebClient.Builder webClientBuilder,
                                       @Value("${google.books.api.base-url:https://www.googleapis.com/books/v1}") String baseUrl,
                                       @Value("${google.books.api.key:#{null}}") String apiKey) {
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();
        this.apiKey = ValidationUtils.hasText(apiKey) ? apiKey : null;
    }

    @Override
    public String name() {
        return GoogleBooksVolumeParser.SOURCE;
    }

    /**
     * Looks up one edition by ISBN. When several volumes come back, the one listing the ISBN
     * among its identifiers wins.
     */
    @Override
    @CircuitBreaker(name = "googleBooksService", fallbackMethod = "lookupByIsbnFallback")
    @RateLimiter(name = "googleBooksServiceRateLimiter", fallbackMethod = "lookupByIsbnFallback")
    public Mono<MetadataRecord> lookupByIsbn(String isbn) {
        if (!ValidationUtils.hasText(isbn)) {
            return Mono.empty();
        }
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "lookupByIsbn", isbn, apiKey != null);
        return fetchVolumes("isbn:" + isbn, 5)
            .map(volumes -> {
                List<MetadataRecord> records = new ArrayList<>();
                for (JsonNode item : volumes.path("items")) {
                    MetadataRecord record = GoogleBooksVolumeParser.parseVolume(item);
                    if (record != null) {
                        records.add(record);
                    }
                }
                return records;
            })
            .flatMap(records -> {
                ExternalApiLogger.logApiCallSuccess(log, API_NAME, "lookupByIsbn", isbn, records.size());
                return Mono.justOrEmpty(records.stream()
                    .filter(record -> GoogleBooksVolumeParser.carriesIsbn(record, isbn))
                    .findFirst()
                    .or(() -> records.stream().findFirst()));
            })
            .onErrorResume(e -> {
                ExternalApiLogger.logApiCallFailure(log, API_NAME, "lookupByIsbn", isbn, e.getMessage());
                return Mono.empty();
            });
    }

    @Override
    @CircuitBreaker(name = "googleBooksService", fallbackMethod = "searchByTitleFallback")
    @RateLimiter(name = "googleBooksServiceRateLimiter", fallbackMethod = "searchByTitleFallback")
    public Flux<MetadataRecord> searchByTitle(String title, int maxResults) {
        if (!ValidationUtils.hasText(title) || maxResults <= 0) {
            return Flux.empty();
        }
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "searchByTitle", title, apiKey != null);
        return fetchVolumes("intitle:" + title.trim(), Math.min(maxResults, 40))
            .flatMapMany(volumes -> Flux.fromIterable(volumes.path("items")))
            .map(item -> Optional.ofNullable(GoogleBooksVolumeParser.parseVolume(item)))
            .filter(Optional::isPresent)
            .map(Optional::get)
            .take(maxResults)
            .onErrorResume(e -> {
                ExternalApiLogger.logApiCallFailure(log, API_NAME, "searchByTitle", title, e.getMessage());
                return Flux.empty();
            });
    }

    public Mono<MetadataRecord> lookupByIsbnFallback(String isbn, Throwable t) {
        ExternalApiLogger.logFallback(log, API_NAME, "lookupByIsbn", isbn, t);
        return Mono.empty();
    }

    public Flux<MetadataRecord> searchByTitleFallback(String title, int maxResults, Throwable t) {
        ExternalApiLogger.logFallback(log, API_NAME, "searchByTitle", title, t);
        return Flux.empty();
    }

    private Mono<JsonNode> fetchVolumes(String query, int maxResults) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/volumes")
                .queryParam("q", query)
                .queryParam("maxResults", maxResults)
                .queryParamIfPresent("key", Optional.ofNullable(apiKey))
                .build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .filter(Objects::nonNull);
    }
}
