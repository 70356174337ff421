package com.williamcallahan.book_import_engine.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class ImportValueUtilsTest {

    @ParameterizedTest
    @CsvSource({
        "2024-01-05",
        "01/05/2024",
        "1/5/2024",
        "05.01.2024",
        "2024/01/05",
        "2024-01-05T22:15:00Z",
        "2024-01-05T08:00:00"
    })
    @DisplayName("parseDate accepts the date layouts found in tracker exports")
    void parseDateAcceptsKnownLayouts(String value) {
        assertThat(ImportValueUtils.parseDate(value)).contains(LocalDate.of(2024, 1, 5));
    }

    @Test
    void parseDateRejectsGarbage() {
        assertThat(ImportValueUtils.parseDate("yesterday")).isEmpty();
        assertThat(ImportValueUtils.parseDate("  ")).isEmpty();
        assertThat(ImportValueUtils.parseDate(null)).isEmpty();
    }

    @Test
    @DisplayName("parseInteger reads leading numbers and keeps the sign")
    void parseIntegerIsLenient() {
        assertThat(ImportValueUtils.parseInteger("12")).contains(12);
        assertThat(ImportValueUtils.parseInteger("12.0")).contains(12);
        assertThat(ImportValueUtils.parseInteger("350 pages")).contains(350);
        assertThat(ImportValueUtils.parseInteger("-4")).contains(-4);
        assertThat(ImportValueUtils.parseInteger("n/a")).isEmpty();
    }

    @Test
    void publicationDateFromYearExpandsBareYears() {
        assertThat(ImportValueUtils.publicationDateFromYear("1965")).isEqualTo("1965-01-01");
        assertThat(ImportValueUtils.publicationDateFromYear("1965.0")).isEqualTo("1965-01-01");
        assertThat(ImportValueUtils.publicationDateFromYear("August 1965")).isEqualTo("August 1965");
        assertThat(ImportValueUtils.publicationDateFromYear("")).isNull();
    }

    @Test
    void splitListTrimsAndDropsBlanks() {
        assertThat(ImportValueUtils.splitList(" to-read, favorites ,, sci-fi")).containsExactly("to-read", "favorites", "sci-fi");
        assertThat(ImportValueUtils.splitList(null)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
        "read, read",
        "Finished, read",
        "currently-reading, currently_reading",
        "to-read, plan_to_read",
        "plan_to_read, plan_to_read",
        "DNF, did_not_finish"
    })
    void normalizeReadingStatusMapsVocabularies(String value, String expected) {
        assertThat(ImportValueUtils.normalizeReadingStatus(value)).isEqualTo(expected);
    }

    @Test
    void normalizeReadingStatusReturnsNullForUnknownShelves() {
        assertThat(ImportValueUtils.normalizeReadingStatus("favorites")).isNull();
    }
}
