/**
 * Combined metadata lookup across providers
 *
 * Features:
 * - Providers consulted in order; later providers only fill fields earlier ones left empty
 * - Stops early once a record is complete
 * - Provider faults never escape; the result is simply empty
 * - Title search concatenates provider results, de-duplicated by title and first author
 */
package com.williamcallahan.book_import_engine.service.provider;

import com.williamcallahan.book_import_engine.model.MetadataRecord;
import com.williamcallahan.book_import_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Service
@Slf4j
public class MetadataLookupService {

    private final List<MetadataProvider> providers;

    public MetadataLookupService(List<MetadataProvider> providers) {
        this.providers = List.copyOf(providers);
    }

    public Mono<MetadataRecord> lookupByIsbn(String isbn) {
        Mono<Optional<MetadataRecord>> result = Mono.just(Optional.empty());
        for (MetadataProvider provider : providers) {
            result = result.flatMap(current -> {
                if (current.isPresent() && isComplete(current.get())) {
                    return Mono.just(current);
                }
                return safeLookup(provider, isbn)
                    .map(found -> Optional.of(current.map(existing -> combine(existing, found)).orElse(found)))
                    .defaultIfEmpty(current);
            });
        }
        return result.flatMap(Mono::justOrEmpty);
    }

    public Flux<MetadataRecord> searchByTitle(String title, int maxResults) {
        if (!ValidationUtils.hasText(title) || maxResults <= 0) {
            return Flux.empty();
        }
        Set<String> seen = new LinkedHashSet<>();
        return Flux.fromIterable(providers)
            .concatMap(provider -> safeSearch(provider, title, maxResults))
            .filter(record -> seen.add(dedupeKey(record)))
            .take(maxResults);
    }

    /**
     * Fills every field {@code primary} left empty from {@code secondary}; identifiers and
     * sources are unioned.
     */
    static MetadataRecord combine(MetadataRecord primary, MetadataRecord secondary) {
        MetadataRecord.MetadataRecordBuilder builder = primary.toBuilder();
        if (!ValidationUtils.hasText(primary.getSubtitle())) builder.subtitle(secondary.getSubtitle());
        if (primary.getAuthors().isEmpty()) builder.authors(secondary.getAuthors());
        if (!ValidationUtils.hasText(primary.getPublisher())) builder.publisher(secondary.getPublisher());
        if (!ValidationUtils.hasText(primary.getPublishedDate())) builder.publishedDate(secondary.getPublishedDate());
        if (primary.getPageCount() == null) builder.pageCount(secondary.getPageCount());
        if (!ValidationUtils.hasText(primary.getLanguage())) builder.language(secondary.getLanguage());
        if (!ValidationUtils.hasText(primary.getDescription())) builder.description(secondary.getDescription());
        if (!ValidationUtils.hasText(primary.getCoverUrl())) builder.coverUrl(secondary.getCoverUrl());
        if (primary.getCategories().isEmpty()) builder.categories(secondary.getCategories());
        if (primary.getAverageRating() == null) builder.averageRating(secondary.getAverageRating());
        if (primary.getRatingCount() == null) builder.ratingCount(secondary.getRatingCount());
        if (primary.getGoogleBooksId() == null) builder.googleBooksId(secondary.getGoogleBooksId());
        if (primary.getOpenLibraryId() == null) builder.openLibraryId(secondary.getOpenLibraryId());
        secondary.getIsbn13s().stream().filter(isbn -> !primary.getIsbn13s().contains(isbn)).forEach(builder::isbn13);
        secondary.getIsbn10s().stream().filter(isbn -> !primary.getIsbn10s().contains(isbn)).forEach(builder::isbn10);
        secondary.getSources().stream().filter(source -> !primary.getSources().contains(source)).forEach(builder::source);
        return builder.build();
    }

    static boolean isComplete(MetadataRecord record) {
        return !record.getAuthors().isEmpty()
            && ValidationUtils.hasText(record.getPublisher())
            && ValidationUtils.hasText(record.getPublishedDate())
            && record.getPageCount() != null
            && ValidationUtils.hasText(record.getDescription())
            && ValidationUtils.hasText(record.getCoverUrl());
    }

    private Mono<MetadataRecord> safeLookup(MetadataProvider provider, String isbn) {
        return Mono.defer(() -> {
                Mono<MetadataRecord> call = provider.lookupByIsbn(isbn);
                return call == null ? Mono.<MetadataRecord>empty() : call;
            })
            .filter(MetadataRecord::hasUsableData)
            .onErrorResume(e -> {
                log.warn("Provider {} failed for ISBN {}: {}", provider.name(), isbn, e.getMessage());
                return Mono.empty();
            });
    }

    private Flux<MetadataRecord> safeSearch(MetadataProvider provider, String title, int maxResults) {
        return Flux.defer(() -> {
                Flux<MetadataRecord> call = provider.searchByTitle(title, maxResults);
                return call == null ? Flux.<MetadataRecord>empty() : call;
            })
            .filter(MetadataRecord::hasUsableData)
            .onErrorResume(e -> {
                log.warn("Provider {} title search failed for '{}': {}", provider.name(), title, e.getMessage());
                return Flux.empty();
            });
    }

    private static String dedupeKey(MetadataRecord record) {
        String author = record.getAuthors().isEmpty() ? "" : record.getAuthors().get(0);
        return (record.getTitle() + "|" + author).toLowerCase(Locale.ROOT);
    }
}
