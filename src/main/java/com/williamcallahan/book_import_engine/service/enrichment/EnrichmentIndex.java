package com.williamcallahan.book_import_engine.service.enrichment;

import com.williamcallahan.book_import_engine.model.MetadataRecord;
import com.williamcallahan.book_import_engine.util.IsbnUtils;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Result of one enrichment pass: ISBN to record, with every form of an edition pointing at the
 * same record instance.
 */
public final class EnrichmentIndex {

    private static final EnrichmentIndex EMPTY = new EnrichmentIndex(Map.of(), false);

    private final Map<String, MetadataRecord> byIsbn;
    private final boolean attempted;

    EnrichmentIndex(Map<String, MetadataRecord> byIsbn, boolean attempted) {
        this.byIsbn = Collections.unmodifiableMap(new HashMap<>(byIsbn));
        this.attempted = attempted;
    }

    /**
     * Index for a job that did not enrich at all.
     */
    public static EnrichmentIndex notAttempted() {
        return EMPTY;
    }

    /**
     * Whether enrichment ran for this job. Lookup failures are only reported when it did.
     */
    public boolean isAttempted() {
        return attempted;
    }

    public Optional<MetadataRecord> find(String isbn) {
        for (String form : IsbnUtils.allForms(isbn)) {
            MetadataRecord record = byIsbn.get(form);
            if (record != null) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return byIsbn.size();
    }

    /**
     * Number of distinct records held.
     */
    public int distinctRecords() {
        Set<MetadataRecord> records = Collections.newSetFromMap(new IdentityHashMap<>());
        records.addAll(byIsbn.values());
        return records.size();
    }

    static Set<String> indexKeys(String queriedIsbn, MetadataRecord record) {
        Set<String> keys = new LinkedHashSet<>(IsbnUtils.allForms(queriedIsbn));
        for (String form : record.isbnForms()) {
            keys.addAll(IsbnUtils.allForms(form));
        }
        return keys;
    }
}
