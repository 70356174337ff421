package com.williamcallahan.book_import_engine.service.provider;

import com.williamcallahan.book_import_engine.model.MetadataRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * External bibliographic metadata source. Implementations degrade every fault to an empty result.
 */
public interface MetadataProvider {

    /**
     * @return the edition for the ISBN, or empty when the provider has nothing usable
     */
    Mono<MetadataRecord> lookupByIsbn(String isbn);

    Flux<MetadataRecord> searchByTitle(String title, int maxResults);

    String name();
}
