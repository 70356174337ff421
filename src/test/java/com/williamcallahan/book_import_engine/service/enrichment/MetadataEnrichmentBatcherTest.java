package com.williamcallahan.book_import_engine.service.enrichment;

import com.williamcallahan.book_import_engine.config.ImportProperties;
import com.williamcallahan.book_import_engine.model.MetadataRecord;
import com.williamcallahan.book_import_engine.service.provider.MetadataLookupService;
import com.williamcallahan.book_import_engine.testutil.StubMetadataProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataEnrichmentBatcherTest {

    private final ImportProperties properties = new ImportProperties();

    @BeforeEach
    void setUp() {
        properties.getEnrichment().setJitterMin(Duration.ZERO);
        properties.getEnrichment().setJitterMax(Duration.ZERO);
    }

    private static MetadataRecord dune() {
        return MetadataRecord.builder().title("Dune").isbn13("9780441172719").isbn10("0441172717").build();
    }

    @Test
    @DisplayName("ISBN-10 and ISBN-13 of one edition cost a single lookup and share one record")
    void deduplicatesEditionsAcrossForms() {
        StubMetadataProvider provider = new StubMetadataProvider().withRecord("9780441172719", dune());
        MetadataEnrichmentBatcher batcher = new MetadataEnrichmentBatcher(new MetadataLookupService(List.of(provider)), properties);

        EnrichmentIndex index = batcher.enrich("job-1", List.of("0441172717", "978-0-441-17271-9", "=\"9780441172719\""));

        assertThat(provider.lookupCount()).isEqualTo(1);
        assertThat(index.isAttempted()).isTrue();
        assertThat(index.distinctRecords()).isEqualTo(1);
        assertThat(index.find("9780441172719")).containsSame(index.find("0441172717").orElseThrow());
    }

    @Test
    void invalidIdentifiersAreNeverLookedUp() {
        StubMetadataProvider provider = new StubMetadataProvider();
        MetadataEnrichmentBatcher batcher = new MetadataEnrichmentBatcher(new MetadataLookupService(List.of(provider)), properties);

        EnrichmentIndex index = batcher.enrich("job-2", Arrays.asList("12345", null, "not-an-isbn", "9780441172710"));

        assertThat(provider.lookupCount()).isZero();
        assertThat(index.isAttempted()).isTrue();
        assertThat(index.size()).isZero();
    }

    @Test
    @DisplayName("a failing lookup is left out while the rest of the batch completes")
    void failuresAreAbsentFromIndex() {
        StubMetadataProvider provider = new StubMetadataProvider()
            .withRecord("9780441172719", dune())
            .failingFor("9780807083697");
        MetadataEnrichmentBatcher batcher = new MetadataEnrichmentBatcher(new MetadataLookupService(List.of(provider)), properties);

        EnrichmentIndex index = batcher.enrich("job-3", List.of("9780441172719", "9780807083697"));

        assertThat(provider.lookupCount()).isEqualTo(2);
        assertThat(index.find("0441172717")).isPresent();
        assertThat(index.find("9780807083697")).isEmpty();
    }

    @Test
    void notAttemptedIndexIsEmpty() {
        EnrichmentIndex index = EnrichmentIndex.notAttempted();

        assertThat(index.isAttempted()).isFalse();
        assertThat(index.find("9780441172719")).isEmpty();
    }

    @Test
    void distinctIdentifiersKeepsFirstSpelling() {
        assertThat(MetadataEnrichmentBatcher.distinctIdentifiers(List.of("0441172717", "9780441172719")))
            .containsExactly(Map.entry("9780441172719", "0441172717"));
    }
}
