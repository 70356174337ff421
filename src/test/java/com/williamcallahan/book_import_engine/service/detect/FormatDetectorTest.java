package com.williamcallahan.book_import_engine.service.detect;

import com.williamcallahan.book_import_engine.config.ImportProperties;
import com.williamcallahan.book_import_engine.exception.UnsupportedImportFileException;
import com.williamcallahan.book_import_engine.model.CanonicalField;
import com.williamcallahan.book_import_engine.model.FieldScope;
import com.williamcallahan.book_import_engine.model.MappingTarget;
import com.williamcallahan.book_import_engine.service.csv.DelimitedFileReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormatDetectorTest {

    private final FormatDetector detector =
        new FormatDetector(new DelimitedFileReader(), new FieldMapper(), new ImportProperties());

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("a full Goodreads export is recognized with shelves routed to a personal custom field")
    void detectsGoodreadsExport() throws IOException, URISyntaxException {
        Path fixture = Path.of(getClass().getResource("/fixtures/goodreads_sample.csv").toURI());

        FormatDetectionResult result = detector.detect(fixture);

        assertThat(result.format()).isEqualTo(ImportFormat.GOODREADS);
        assertThat(result.confidence()).isEqualTo(1.0);
        assertThat(result.hasHeader()).isTrue();
        assertThat(result.mapping().columnsFor(CanonicalField.ISBN)).containsExactly("ISBN", "ISBN13");
        assertThat(result.mapping().getTargets().get("Bookshelves"))
            .isEqualTo(MappingTarget.custom("goodreads_shelves", FieldScope.PERSONAL));
        assertThat(result.mapping().columnsFor(CanonicalField.READING_STATUS)).containsExactly("Exclusive Shelf");
    }

    @Test
    void detectsStorygraphExport() {
        List<String> headers = List.of("Title", "Authors", "ISBN/UID", "Format", "Read Status", "Star Rating",
            "Moods", "Pace", "Date Started", "Date Finished");

        FormatDetectionResult result = detector.detect(headers, List.of(String.join(",", headers)), ',');

        assertThat(result.format()).isEqualTo(ImportFormat.STORYGRAPH);
        assertThat(result.mapping().columnsFor(CanonicalField.AUTHOR)).containsExactly("Authors");
        assertThat(result.mapping().getTargets().get("Moods").scope()).isEqualTo(FieldScope.GLOBAL);
    }

    @Test
    void detectsReadingHistory() {
        List<String> headers = List.of("Date", "Book Name", "Pages Read", "Minutes Read");

        FormatDetectionResult result = detector.detect(headers, List.of("Date,Book Name,Pages Read,Minutes Read"), ',');

        assertThat(result.format()).isEqualTo(ImportFormat.READING_HISTORY);
        assertThat(result.format().jobKind().name()).isEqualTo("READING_HISTORY_IMPORT");
        assertThat(result.mapping().columnsFor(CanonicalField.BOOK_NAME)).containsExactly("Book Name");
    }

    @Test
    @DisplayName("a header-less ISBN list maps the synthetic column")
    void detectsBareIsbnList() throws IOException {
        Path file = tempDir.resolve("isbns.txt");
        Files.writeString(file, "9780441172719\n0-441-17271-7\n=\"9780553293357\"\n");

        FormatDetectionResult result = detector.detect(file);

        assertThat(result.format()).isEqualTo(ImportFormat.ISBN_LIST);
        assertThat(result.hasHeader()).isFalse();
        assertThat(result.mapping().columnsFor(CanonicalField.ISBN))
            .containsExactly(DelimitedFileReader.SYNTHETIC_ISBN_COLUMN);
    }

    @Test
    void isbnListWithHeaderKeepsHeaderColumn() throws IOException {
        Path file = tempDir.resolve("isbns.csv");
        Files.writeString(file, "Identifier\n9780441172719\n0441172717\n");

        FormatDetectionResult result = detector.detect(file);

        assertThat(result.format()).isEqualTo(ImportFormat.ISBN_LIST);
        assertThat(result.hasHeader()).isTrue();
        assertThat(result.mapping().columnsFor(CanonicalField.ISBN)).containsExactly("Identifier");
    }

    @Test
    @DisplayName("unknown files get a keyword mapping when a title or ISBN column exists")
    void unknownFormatFallsBackToKeywords() {
        List<String> headers = List.of("Book Title", "Writer", "Book ISBN (13)", "Shelf Code");

        FormatDetectionResult result = detector.detect(headers, List.of(String.join(",", headers)), ',');

        assertThat(result.format()).isEqualTo(ImportFormat.UNKNOWN);
        assertThat(result.mapping().columnsFor(CanonicalField.TITLE)).containsExactly("Book Title");
        assertThat(result.mapping().columnsFor(CanonicalField.AUTHOR)).containsExactly("Writer");
        assertThat(result.mapping().columnsFor(CanonicalField.ISBN)).containsExactly("Book ISBN (13)");
        assertThat(result.mapping().getTargets()).doesNotContainKey("Shelf Code");
    }

    @Test
    void unusableFileIsRejected() {
        List<String> headers = List.of("Foo", "Bar");

        assertThatThrownBy(() -> detector.detect(headers, List.of("Foo,Bar", "x,y"), ','))
            .isInstanceOf(UnsupportedImportFileException.class);
    }

    @Test
    void emptyFileIsRejected() throws IOException {
        Path file = tempDir.resolve("empty.csv");
        Files.writeString(file, "\n\n");

        assertThatThrownBy(() -> detector.detect(file))
            .isInstanceOf(UnsupportedImportFileException.class)
            .hasMessageContaining("empty");
    }

    @Test
    void isIsbnLineIgnoresSeparatorsButNotExtraTokens() {
        assertThat(FormatDetector.isIsbnLine("978-0-441-17271-9")).isTrue();
        assertThat(FormatDetector.isIsbnLine("\"044117271X\"")).isTrue();
        assertThat(FormatDetector.isIsbnLine("9780441172719,Dune")).isFalse();
        assertThat(FormatDetector.isIsbnLine("")).isFalse();
    }
}
