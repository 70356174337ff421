package com.williamcallahan.book_import_engine.service.detect;

import com.williamcallahan.book_import_engine.exception.InvalidFieldMappingException;
import com.williamcallahan.book_import_engine.model.CanonicalField;
import com.williamcallahan.book_import_engine.model.FieldMapping;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldMapperTest {

    private final FieldMapper mapper = new FieldMapper();

    @Test
    void goodreadsHeadersMapCaseInsensitively() {
        FieldMapping mapping = mapper.propose(ImportFormat.GOODREADS, List.of("TITLE", "author", "My Rating", "Unrelated"));

        assertThat(mapping.toTokens()).containsExactly(
            Map.entry("TITLE", "title"),
            Map.entry("author", "author"),
            Map.entry("My Rating", "user_rating"));
    }

    @Test
    void keywordFallbackMapsEachFieldOnce() {
        FieldMapping mapping = mapper.propose(ImportFormat.UNKNOWN, List.of("Primary Title Field", "Alt Title Field"));

        assertThat(mapping.columnsFor(CanonicalField.TITLE)).containsExactly("Primary Title Field");
    }

    @Test
    void knownFormatsDoNotUseKeywordFallback() {
        FieldMapping mapping = mapper.propose(ImportFormat.STORYGRAPH, List.of("Title", "Book ISBN (13)"));

        assertThat(mapping.maps(CanonicalField.ISBN)).isFalse();
    }

    @Test
    void overrideMustReferenceExistingColumns() {
        assertThatThrownBy(() -> mapper.validateOverride(Map.of("Missing", "title"), List.of("Title")))
            .isInstanceOf(InvalidFieldMappingException.class)
            .hasMessageContaining("Missing");

        FieldMapping mapping = mapper.validateOverride(Map.of("Title", "title", "Shelf", "custom_personal_shelf"),
            List.of("Title", "Shelf"));
        assertThat(mapping.customTargets()).containsOnlyKeys("Shelf");
    }
}
