package com.williamcallahan.book_import_engine.service.provider;

import com.williamcallahan.book_import_engine.model.MetadataRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MetadataLookupServiceTest {

    @Mock
    private MetadataProvider google;

    @Mock
    private MetadataProvider openLibrary;

    private MetadataLookupService lookupService;

    @BeforeEach
    void setUp() {
        when(google.name()).thenReturn("google_books");
        when(openLibrary.name()).thenReturn("openlibrary");
        lookupService = new MetadataLookupService(List.of(google, openLibrary));
    }

    private static MetadataRecord.MetadataRecordBuilder dune() {
        return MetadataRecord.builder().title("Dune").author("Frank Herbert").isbn13("9780441172719");
    }

    @Test
    @DisplayName("later providers only fill the gaps left by earlier ones")
    void combinesProvidersInOrder() {
        when(google.lookupByIsbn("9780441172719")).thenReturn(Mono.just(dune().publisher("Ace").source("google_books").build()));
        when(openLibrary.lookupByIsbn("9780441172719")).thenReturn(Mono.just(MetadataRecord.builder()
            .title("Dune (Ace edition)")
            .publisher("Chilton")
            .pageCount(535)
            .isbn10("0441172717")
            .source("openlibrary")
            .build()));

        StepVerifier.create(lookupService.lookupByIsbn("9780441172719"))
            .assertNext(record -> {
                assertThat(record.getTitle()).isEqualTo("Dune");
                assertThat(record.getPublisher()).isEqualTo("Ace");
                assertThat(record.getPageCount()).isEqualTo(535);
                assertThat(record.isbnForms()).containsExactly("9780441172719", "0441172717");
                assertThat(record.getSources()).containsExactly("google_books", "openlibrary");
            })
            .verifyComplete();
    }

    @Test
    void completeRecordSkipsRemainingProviders() {
        when(google.lookupByIsbn(anyString())).thenReturn(Mono.just(dune()
            .publisher("Ace").publishedDate("1990").pageCount(604)
            .description("Desert planet").coverUrl("https://covers.test/dune.jpg")
            .build()));

        StepVerifier.create(lookupService.lookupByIsbn("9780441172719")).expectNextCount(1).verifyComplete();

        verify(openLibrary, never()).lookupByIsbn(anyString());
    }

    @Test
    void providerFaultsDegradeToNextProvider() {
        when(google.lookupByIsbn(anyString())).thenReturn(Mono.error(new IllegalStateException("quota")));
        when(openLibrary.lookupByIsbn(anyString())).thenReturn(Mono.just(dune().build()));

        StepVerifier.create(lookupService.lookupByIsbn("9780441172719").map(MetadataRecord::getTitle))
            .expectNext("Dune")
            .verifyComplete();
    }

    @Test
    void untitledRecordsAreDiscarded() {
        when(google.lookupByIsbn(anyString())).thenReturn(Mono.just(MetadataRecord.builder().publisher("Ace").build()));
        when(openLibrary.lookupByIsbn(anyString())).thenReturn(Mono.empty());

        StepVerifier.create(lookupService.lookupByIsbn("9780441172719")).verifyComplete();
    }

    @Test
    void searchByTitleDeduplicatesAcrossProviders() {
        when(google.searchByTitle(anyString(), anyInt())).thenReturn(Flux.just(dune().build(),
            MetadataRecord.builder().title("Dune Messiah").author("Frank Herbert").build()));
        when(openLibrary.searchByTitle(anyString(), anyInt())).thenReturn(Flux.just(
            MetadataRecord.builder().title("DUNE").author("frank herbert").build(),
            MetadataRecord.builder().title("Children of Dune").author("Frank Herbert").build()));

        StepVerifier.create(lookupService.searchByTitle("Dune", 10).map(MetadataRecord::getTitle).collectList())
            .assertNext(titles -> assertThat(titles).containsExactly("Dune", "Dune Messiah", "Children of Dune"))
            .verifyComplete();
    }

    @Test
    void searchByTitleFailureOfOneProviderKeepsOthers() {
        when(google.searchByTitle(anyString(), anyInt())).thenReturn(Flux.error(new IllegalStateException("down")));
        when(openLibrary.searchByTitle(anyString(), anyInt())).thenReturn(Flux.just(dune().build()));

        StepVerifier.create(lookupService.searchByTitle("Dune", 3)).expectNextCount(1).verifyComplete();
    }
}
