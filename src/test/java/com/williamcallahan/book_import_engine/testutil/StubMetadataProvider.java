package com.williamcallahan.book_import_engine.testutil;

import com.williamcallahan.book_import_engine.model.MetadataRecord;
import com.williamcallahan.book_import_engine.service.provider.MetadataProvider;
import com.williamcallahan.book_import_engine.util.IsbnUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process metadata provider keyed by ISBN-13, counting the lookups it serves.
 */
public class StubMetadataProvider implements MetadataProvider {

    private final Map<String, MetadataRecord> byIsbn = new LinkedHashMap<>();
    private final Set<String> failing = new HashSet<>();
    private final List<MetadataRecord> titleResults = new ArrayList<>();
    private final AtomicInteger lookups = new AtomicInteger();

    public StubMetadataProvider withRecord(String isbn, MetadataRecord record) {
        byIsbn.put(IsbnUtils.canonicalKey(isbn), record);
        return this;
    }

    public StubMetadataProvider failingFor(String isbn) {
        failing.add(IsbnUtils.canonicalKey(isbn));
        return this;
    }

    public StubMetadataProvider withTitleResult(MetadataRecord record) {
        titleResults.add(record);
        return this;
    }

    public int lookupCount() {
        return lookups.get();
    }

    @Override
    public Mono<MetadataRecord> lookupByIsbn(String isbn) {
        lookups.incrementAndGet();
        String key = IsbnUtils.canonicalKey(isbn);
        if (failing.contains(key)) {
            return Mono.error(new IllegalStateException("provider unavailable"));
        }
        return Mono.justOrEmpty(byIsbn.get(key));
    }

    @Override
    public Flux<MetadataRecord> searchByTitle(String title, int maxResults) {
        return Flux.fromIterable(titleResults).take(maxResults);
    }

    @Override
    public String name() {
        return "stub";
    }
}
