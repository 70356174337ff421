package com.williamcallahan.book_import_engine.service.resolution;

import com.williamcallahan.book_import_engine.model.CandidateBook;
import com.williamcallahan.book_import_engine.model.FieldMapping;
import com.williamcallahan.book_import_engine.service.csv.ImportRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateBookFactoryTest {

    private final CandidateBookFactory factory = new CandidateBookFactory();

    private static FieldMapping goodreadsMapping() {
        Map<String, String> tokens = new LinkedHashMap<>();
        tokens.put("Title", "title");
        tokens.put("Author", "author");
        tokens.put("Additional Authors", "additional_authors");
        tokens.put("ISBN", "isbn");
        tokens.put("ISBN13", "isbn");
        tokens.put("My Rating", "user_rating");
        tokens.put("Original Publication Year", "custom_global_original_publication_year");
        tokens.put("Year Published", "publication_year");
        tokens.put("Date Read", "date_read");
        tokens.put("Exclusive Shelf", "reading_status");
        tokens.put("Bookshelves", "custom_personal_goodreads_shelves");
        return FieldMapping.fromTokens(tokens);
    }

    private static ImportRow row(String... pairs) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            values.put(pairs[i], pairs[i + 1]);
        }
        return new ImportRow(1, values);
    }

    @Test
    @DisplayName("Goodreads row yields catalog fields, personal data and scoped custom values")
    void buildsFromGoodreadsRow() {
        CandidateBook candidate = factory.build(row(
            "Title", "Good Omens",
            "Author", "Terry Pratchett",
            "Additional Authors", "Neil Gaiman, Terry Pratchett",
            "ISBN", "=\"\"",
            "ISBN13", "=\"9780060853983\"",
            "My Rating", "0",
            "Original Publication Year", "1990",
            "Year Published", "2006",
            "Date Read", "2023/11/02",
            "Exclusive Shelf", "",
            "Bookshelves", "favorites, humor"), goodreadsMapping(), "plan_to_read");

        assertThat(candidate.getAuthors()).containsExactly("Terry Pratchett", "Neil Gaiman");
        assertThat(candidate.getIsbn13()).isEqualTo("9780060853983");
        assertThat(candidate.getIsbn10()).isEqualTo("0060853980");
        assertThat(candidate.getUserRating()).as("0 means not rated").isNull();
        assertThat(candidate.getPublishedDate()).isEqualTo("2006-01-01");
        assertThat(candidate.getDateRead()).isEqualTo(LocalDate.of(2023, 11, 2));
        assertThat(candidate.getReadingStatus()).isEqualTo("read");
        assertThat(candidate.getGlobalCustomMetadata()).containsEntry("original_publication_year", "1990");
        assertThat(candidate.getPersonalCustomMetadata()).containsEntry("goodreads_shelves", "favorites, humor");
        assertThat(candidate.getCategories()).isEmpty();
    }

    @Test
    void invalidIsbnIsKeptAsRawIdentifier() {
        CandidateBook candidate = factory.build(row("ISBN", "12345", "ISBN13", ""), goodreadsMapping(), "plan_to_read");

        assertThat(candidate.hasValidIsbn()).isFalse();
        assertThat(candidate.hasIdentifier()).isTrue();
        assertThat(candidate.getRawIdentifier()).isEqualTo("12345");
        assertThat(candidate.describe()).isEqualTo("12345");
        assertThat(candidate.getReadingStatus()).isEqualTo("plan_to_read");
    }

    @Test
    @DisplayName("a later valid ISBN column wins over an earlier invalid one")
    void firstValidIdentifierWins() {
        CandidateBook candidate = factory.build(row("ISBN", "12345", "ISBN13", "9780441172719"), goodreadsMapping(), null);

        assertThat(candidate.getIsbn13()).isEqualTo("9780441172719");
        assertThat(candidate.getIsbn10()).isEqualTo("0441172717");
        assertThat(candidate.getRawIdentifier()).isEqualTo("9780441172719");
    }

    @Test
    void explicitShelfBeatsDateRead() {
        CandidateBook candidate = factory.build(row("Title", "Dune", "Exclusive Shelf", "currently-reading",
            "Date Read", "2024-01-01"), goodreadsMapping(), "plan_to_read");

        assertThat(candidate.getReadingStatus()).isEqualTo("currently_reading");
    }

    @Test
    void categoriesAreSplitAndDeduplicated() {
        FieldMapping mapping = FieldMapping.fromTokens(Map.of("Title", "title", "Genres", "categories"));

        CandidateBook candidate = factory.build(row("Title", "Dune", "Genres", "Sci-Fi, Classics, Sci-Fi"), mapping, null);

        assertThat(candidate.getCategories()).containsExactly("Sci-Fi", "Classics");
    }
}
