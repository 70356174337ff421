/**
 * Classifies an uploaded import file and proposes a column mapping
 *
 * Features:
 * - Weighted header signature match with a minimum confidence and strict winner
 * - Bare ISBN list fallback when no signature wins
 * - Delimiter sniffing from the header line
 * - Synchronous failure for files that cannot be imported at all
 */
package com.williamcallahan.book_import_engine.service.detect;

import com.williamcallahan.book_import_engine.config.ImportProperties;
import com.williamcallahan.book_import_engine.exception.UnsupportedImportFileException;
import com.williamcallahan.book_import_engine.model.CanonicalField;
import com.williamcallahan.book_import_engine.model.FieldMapping;
import com.williamcallahan.book_import_engine.model.MappingTarget;
import com.williamcallahan.book_import_engine.service.csv.DelimitedFileReader;
import com.williamcallahan.book_import_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

@Service
@Slf4j
public class FormatDetector {

    private static final Pattern ISBN_TOKEN = Pattern.compile("\\d{13}|\\d{9}[\\dXx]");
    private static final Pattern ISBN_NOISE = Pattern.compile("[\\s-]");

    private final DelimitedFileReader fileReader;
    private final FieldMapper fieldMapper;
    private final ImportProperties properties;

    public FormatDetector(DelimitedFileReader fileReader, FieldMapper fieldMapper, ImportProperties properties) {
        this.fileReader = fileReader;
        this.fieldMapper = fieldMapper;
        this.properties = properties;
    }

    /**
     * Reads the head of the file and classifies it.
     *
     * @throws UnsupportedImportFileException when the file is empty, or has no usable header and is
     *                                        not a bare ISBN list
     * @throws IOException when the file cannot be read
     */
    public FormatDetectionResult detect(Path path) throws IOException {
        List<String> sample = fileReader.readSampleLines(path, Math.max(2, properties.getDetection().getSampleLines() + 1));
        if (sample.isEmpty()) {
            throw new UnsupportedImportFileException("Import file is empty");
        }
        char delimiter = fileReader.sniffDelimiter(sample.get(0));
        List<String> headers = fileReader.readHeaders(path);
        return detect(headers, sample, delimiter);
    }

    /**
     * Classifies from an already-read header row and sample of raw lines (first line included).
     */
    public FormatDetectionResult detect(List<String> headers, List<String> sampleLines, char delimiter) {
        ImportProperties.Detection config = properties.getDetection();
        ImportFormat best = ImportFormat.UNKNOWN;
        double bestScore = 0.0;
        boolean tied = false;
        for (FormatSignature signature : FormatSignatures.all()) {
            double score = signature.score(headers);
            log.debug("Format signature {} scored {}", signature.format(), String.format("%.3f", score));
            if (score > bestScore) {
                best = signature.format();
                bestScore = score;
                tied = false;
            } else if (score == bestScore && score > 0) {
                tied = true;
            }
        }

        if (!tied && bestScore >= config.getMinConfidence()) {
            FieldMapping mapping = fieldMapper.propose(best, headers);
            log.info("Detected {} import (confidence {})", best.getWireValue(), String.format("%.3f", bestScore));
            return new FormatDetectionResult(best, bestScore, mapping, headers, delimiter, true);
        }

        FormatDetectionResult isbnList = detectIsbnList(headers, sampleLines, delimiter);
        if (isbnList != null) {
            log.info("Detected bare ISBN list (ratio {})", String.format("%.2f", isbnList.confidence()));
            return isbnList;
        }

        FieldMapping mapping = fieldMapper.propose(ImportFormat.UNKNOWN, headers);
        if (!mapping.maps(CanonicalField.TITLE) && !mapping.maps(CanonicalField.ISBN)) {
            throw new UnsupportedImportFileException(
                "Could not recognize the import file: no title or ISBN column and not an ISBN list");
        }
        log.info("Unknown import format; proposed keyword mapping {} (best signature score {})", mapping, String.format("%.3f", bestScore));
        return new FormatDetectionResult(ImportFormat.UNKNOWN, bestScore, mapping, headers, delimiter, true);
    }

    /**
     * True when the line holds exactly one ISBN-shaped token, ignoring hyphens, spaces and export
     * wrappers. Check digits are not verified here.
     */
    static boolean isIsbnLine(String line) {
        if (!ValidationUtils.hasText(line)) {
            return false;
        }
        String cleaned = ValidationUtils.stripWrappingQuotes(ValidationUtils.stripExportWrapper(line.trim()));
        cleaned = ISBN_NOISE.matcher(cleaned).replaceAll("");
        return ISBN_TOKEN.matcher(cleaned).matches();
    }

    private FormatDetectionResult detectIsbnList(List<String> headers, List<String> sampleLines, char delimiter) {
        if (sampleLines.isEmpty()) {
            return null;
        }
        boolean firstIsIsbn = isIsbnLine(sampleLines.get(0));
        List<String> dataLines = firstIsIsbn ? sampleLines : sampleLines.subList(1, sampleLines.size());
        int limit = Math.min(dataLines.size(), properties.getDetection().getSampleLines());
        if (limit == 0) {
            return null;
        }
        long isbnLines = dataLines.subList(0, limit).stream().filter(FormatDetector::isIsbnLine).count();
        double ratio = (double) isbnLines / limit;
        if (ratio < properties.getDetection().getIsbnListThreshold()) {
            return null;
        }
        Map<String, MappingTarget> mapping = new LinkedHashMap<>();
        if (firstIsIsbn) {
            mapping.put(DelimitedFileReader.SYNTHETIC_ISBN_COLUMN, MappingTarget.core(CanonicalField.ISBN));
            return new FormatDetectionResult(ImportFormat.ISBN_LIST, ratio, FieldMapping.of(mapping),
                List.of(DelimitedFileReader.SYNTHETIC_ISBN_COLUMN), delimiter, false);
        }
        String column = headers.isEmpty() ? DelimitedFileReader.SYNTHETIC_ISBN_COLUMN : headers.get(0);
        mapping.put(column, MappingTarget.core(CanonicalField.ISBN));
        return new FormatDetectionResult(ImportFormat.ISBN_LIST, ratio, FieldMapping.of(mapping), List.of(column), delimiter, true);
    }
}
