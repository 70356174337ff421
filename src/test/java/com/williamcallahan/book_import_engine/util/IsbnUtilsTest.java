package com.williamcallahan.book_import_engine.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class IsbnUtilsTest {

    @ParameterizedTest
    @CsvSource({
        "9780441172719, 9780441172719",
        "978-0-441-17271-9, 9780441172719",
        "'=\"9780441172719\"', 9780441172719",
        "0441172717, 0441172717",
        "0-8044-2957-x, 080442957X",
        "' 0 441 17271 7 ', 0441172717"
    })
    @DisplayName("normalize strips wrappers and separators from valid identifiers")
    void normalizeCleansValidIdentifiers(String raw, String expected) {
        assertThat(IsbnUtils.normalize(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"12345", "9780441172710", "0441172718", "not-an-isbn", "=\"\""})
    @DisplayName("normalize rejects malformed or bad check digit input")
    void normalizeRejectsInvalidInput(String raw) {
        assertThat(IsbnUtils.normalize(raw)).isNull();
    }

    @Test
    @DisplayName("ISBN-10 and ISBN-13 of the same edition share a canonical key")
    void canonicalKeyUnifiesForms() {
        assertThat(IsbnUtils.canonicalKey("0441172717")).isEqualTo("9780441172719");
        assertThat(IsbnUtils.canonicalKey("978-0441172719")).isEqualTo("9780441172719");
        assertThat(IsbnUtils.canonicalKey("12345")).isNull();
    }

    @Test
    @DisplayName("979 editions have no ISBN-10 form")
    void toIsbn10IgnoresNon978Prefix() {
        assertThat(IsbnUtils.toIsbn10("9791032305690")).isNull();
        assertThat(IsbnUtils.allForms("9791032305690")).containsExactly("9791032305690");
    }

    @Test
    @DisplayName("allForms returns the input first and its converted form second")
    void allFormsListsBothForms() {
        assertThat(IsbnUtils.allForms("0441172717")).containsExactly("0441172717", "9780441172719");
        assertThat(IsbnUtils.allForms("9780441172719")).containsExactly("9780441172719", "0441172717");
        assertThat(IsbnUtils.allForms("garbage")).isEmpty();
    }
}
