/**
 * OpenLibrary metadata provider
 *
 * Features:
 * - ISBN lookup through the books API "data" view
 * - Title search through search.json
 * - Rate limiter, circuit breaker and time limiter with fallbacks that degrade to empty results
 */
package com.williamcallahan.book_import_engine.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.book_import_engine.model.MetadataRecord;
import com.williamcallahan.book_import_engine.util.ExternalApiLogger;
import com.williamcallahan.book_import_engine.util.ValidationUtils;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Objects;

@Service
@Order(2)
public class OpenLibraryMetadataProvider implements MetadataProvider {

    private static final Logger logger = LoggerFactory.getLogger(OpenLibraryMetadataProvider.class);
    private static final String API_NAME = "OpenLibrary";

    private final WebClient webClient;

    public OpenLibraryMetadataProvider(WebClient.Builder webClientBuilder,
                                       @Value("${openlibrary.data.api.url:https://openlibrary.org}") String openLibraryApiUrl) {
        this.webClient = webClientBuilder.baseUrl(openLibraryApiUrl).build();
    }

    @Override
    public String name() {
        return OpenLibraryRecordParser.SOURCE;
    }

    @Override
    @RateLimiter(name = "openLibraryRateLimiter")
    @CircuitBreaker(name = "openLibraryDataService", fallbackMethod = "lookupByIsbnFallback")
    @TimeLimiter(name = "openLibraryDataService")
    public Mono<MetadataRecord> lookupByIsbn(String isbn) {
        if (!ValidationUtils.hasText(isbn)) {
            return Mono.empty();
        }
        ExternalApiLogger.logApiCallAttempt(logger, API_NAME, "lookupByIsbn", isbn, false);
        String bibkey = "ISBN:" + isbn;
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/books")
                .queryParam("bibkeys", bibkey)
                .queryParam("format", "json")
                .queryParam("jscmd", "data")
                .build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .flatMap(responseNode -> {
                JsonNode bookDataNode = responseNode.path(bibkey);
                if (bookDataNode.isMissingNode() || bookDataNode.isEmpty()) {
                    ExternalApiLogger.logApiCallSuccess(logger, API_NAME, "lookupByIsbn", isbn, 0);
                    return Mono.empty();
                }
                ExternalApiLogger.logApiCallSuccess(logger, API_NAME, "lookupByIsbn", isbn, 1);
                return Mono.justOrEmpty(OpenLibraryRecordParser.parseBookData(bookDataNode, isbn));
            })
            .onErrorResume(e -> {
                ExternalApiLogger.logApiCallFailure(logger, API_NAME, "lookupByIsbn", isbn, e.getMessage());
                return Mono.empty();
            });
    }

    @Override
    @RateLimiter(name = "openLibraryRateLimiter")
    @CircuitBreaker(name = "openLibraryDataService", fallbackMethod = "searchByTitleFallback")
    public Flux<MetadataRecord> searchByTitle(String title, int maxResults) {
        if (!ValidationUtils.hasText(title) || maxResults <= 0) {
            return Flux.empty();
        }
        ExternalApiLogger.logApiCallAttempt(logger, API_NAME, "searchByTitle", title, false);
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/search.json")
                .queryParam("title", title.trim())
                .queryParam("limit", maxResults)
                .build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .flatMapMany(responseNode -> {
                if (!responseNode.path("docs").isArray()) {
                    return Flux.empty();
                }
                return Flux.fromIterable(responseNode.get("docs"))
                    .map(OpenLibraryRecordParser::parseSearchDoc)
                    .filter(Objects::nonNull);
            })
            .take(maxResults)
            .onErrorResume(e -> {
                ExternalApiLogger.logApiCallFailure(logger, API_NAME, "searchByTitle", title, e.getMessage());
                return Flux.empty();
            });
    }

    public Mono<MetadataRecord> lookupByIsbnFallback(String isbn, Throwable t) {
        ExternalApiLogger.logFallback(logger, API_NAME, "lookupByIsbn", isbn, t);
        return Mono.empty();
    }

    public Flux<MetadataRecord> searchByTitleFallback(String title, int maxResults, Throwable t) {
        ExternalApiLogger.logFallback(logger, API_NAME, "searchByTitle", title, t);
        return Flux.empty();
    }
}
