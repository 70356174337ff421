package com.williamcallahan.book_import_engine.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.book_import_engine.model.MetadataRecord;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OpenLibraryRecordParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void parseBookDataReadsDataView() throws Exception {
        JsonNode node = objectMapper.readTree("""
            {"title": "Dune", "key": "/books/OL26242482M",
             "authors": [{"name": "Frank Herbert"}],
             "publishers": [{"name": "Ace Books"}],
             "publish_date": "September 1990",
             "number_of_pages": 535,
             "subjects": [{"name": "Science fiction"}, {"name": "Deserts"}],
             "cover": {"medium": "https://covers.openlibrary.org/b/id/1-M.jpg"},
             "identifiers": {"isbn_10": ["0441172717"], "isbn_13": ["9780441172719"]}}
            """);

        MetadataRecord record = OpenLibraryRecordParser.parseBookData(node, "0441172717");

        assertThat(record.getTitle()).isEqualTo("Dune");
        assertThat(record.getAuthors()).containsExactly("Frank Herbert");
        assertThat(record.getPublisher()).isEqualTo("Ace Books");
        assertThat(record.getPublishedDate()).isEqualTo("1990");
        assertThat(record.getPageCount()).isEqualTo(535);
        assertThat(record.getCategories()).containsExactly("Science fiction", "Deserts");
        assertThat(record.getCoverUrl()).endsWith("1-M.jpg");
        assertThat(record.getOpenLibraryId()).isEqualTo("OL26242482M");
        assertThat(record.isbnForms()).containsExactly("9780441172719", "0441172717");
    }

    @Test
    void parseBookDataKeepsQueriedIsbnWhenIdentifiersAreMissing() throws Exception {
        JsonNode node = objectMapper.readTree("{\"title\": \"Kindred\"}");

        MetadataRecord record = OpenLibraryRecordParser.parseBookData(node, "978-0-8070-8369-7");

        assertThat(record.getIsbn13()).isEqualTo("9780807083697");
    }

    @Test
    void untitledNodesAreIgnored() throws Exception {
        assertThat(OpenLibraryRecordParser.parseBookData(objectMapper.readTree("{\"key\": \"x\"}"), null)).isNull();
        assertThat(OpenLibraryRecordParser.parseSearchDoc(objectMapper.readTree("[]"))).isNull();
    }

    @Test
    void parseSearchDocKeepsOneIsbnOfEachForm() throws Exception {
        JsonNode doc = objectMapper.readTree("""
            {"title": "Dune", "author_name": ["Frank Herbert"], "first_publish_year": 1965,
             "cover_i": 42, "isbn": ["bogus", "9780441172719", "0441172717", "9780593099322"]}
            """);

        MetadataRecord record = OpenLibraryRecordParser.parseSearchDoc(doc);

        assertThat(record.getPublishedDate()).isEqualTo("1965");
        assertThat(record.getCoverUrl()).isEqualTo("https://covers.openlibrary.org/b/id/42-M.jpg");
        assertThat(record.getIsbn13s()).containsExactly("9780441172719");
        assertThat(record.getIsbn10s()).containsExactly("0441172717");
    }

    @Test
    void extractYearFindsFirstFourDigitRun() {
        assertThat(OpenLibraryRecordParser.extractYear("June 4, 2001")).isEqualTo("2001");
        assertThat(OpenLibraryRecordParser.extractYear("n.d.")).isNull();
    }
}
