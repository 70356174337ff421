/**
 * Tests for GoogleBooksMetadataProvider against a canned exchange function
 */
package com.williamcallahan.book_import_engine.service.provider;

import com.williamcallahan.book_import_engine.model.MetadataRecord;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GoogleBooksMetadataProviderTest {

    private static final String VOLUMES = """
        {"items": [
          {"id": "messiah", "volumeInfo": {"title": "Dune Messiah",
            "industryIdentifiers": [{"type": "ISBN_13", "identifier": "9780441172696"}]}},
          {"id": "dune", "volumeInfo": {"title": "Dune", "authors": ["Frank Herbert"], "publisher": "Ace",
            "publishedDate": "1990", "pageCount": 604, "categories": ["Fiction"],
            "imageLinks": {"thumbnail": "http://books.google.com/thumb", "smallThumbnail": "http://books.google.com/small"},
            "industryIdentifiers": [{"type": "ISBN_10", "identifier": "0441172717"},
                                    {"type": "ISBN_13", "identifier": "9780441172719"}]}},
          {"id": "untitled", "volumeInfo": {"authors": ["Nobody"]}}
        ]}
        """;

    private final List<URI> requests = new ArrayList<>();

    private GoogleBooksMetadataProvider providerReturning(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request.url());
            return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
        });
        return new GoogleBooksMetadataProvider(builder, "https://books.test/v1", null);
    }

    @Test
    void lookupByIsbnPrefersVolumeListingTheIsbn() {
        GoogleBooksMetadataProvider provider = providerReturning(HttpStatus.OK, VOLUMES);

        StepVerifier.create(provider.lookupByIsbn("0441172717"))
            .assertNext(record -> {
                assertThat(record.getTitle()).isEqualTo("Dune");
                assertThat(record.getGoogleBooksId()).isEqualTo("dune");
                assertThat(record.getIsbn13()).isEqualTo("9780441172719");
                assertThat(record.getCoverUrl()).isEqualTo("https://books.google.com/thumb");
                assertThat(record.getSources()).containsExactly("google_books");
            })
            .verifyComplete();

        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).getPath()).isEqualTo("/v1/volumes");
        assertThat(requests.get(0).getQuery()).contains("isbn:0441172717").doesNotContain("key=");
    }

    @Test
    void serverErrorDegradesToEmpty() {
        GoogleBooksMetadataProvider provider = providerReturning(HttpStatus.INTERNAL_SERVER_ERROR, "{}");

        StepVerifier.create(provider.lookupByIsbn("9780441172719")).verifyComplete();
        StepVerifier.create(provider.searchByTitle("Dune", 5)).verifyComplete();
    }

    @Test
    void searchByTitleSkipsUntitledVolumes() {
        GoogleBooksMetadataProvider provider = providerReturning(HttpStatus.OK, VOLUMES);

        StepVerifier.create(provider.searchByTitle("Dune", 10).map(MetadataRecord::getTitle).collectList())
            .assertNext(titles -> assertThat(titles).containsExactly("Dune Messiah", "Dune"))
            .verifyComplete();
        assertThat(requests.get(0).getQuery()).contains("intitle:Dune");
    }

    @Test
    void blankInputMakesNoRequest() {
        GoogleBooksMetadataProvider provider = providerReturning(HttpStatus.OK, VOLUMES);

        StepVerifier.create(provider.lookupByIsbn(" ")).verifyComplete();
        StepVerifier.create(provider.searchByTitle("Dune", 0)).verifyComplete();
        assertThat(requests).isEmpty();
    }
}
