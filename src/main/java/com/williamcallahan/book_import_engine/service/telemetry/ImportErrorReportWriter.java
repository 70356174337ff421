package com.williamcallahan.book_import_engine.service.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.book_import_engine.model.ImportErrorEntry;
import com.williamcallahan.book_import_engine.util.IsbnUtils;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Renders a job's error log as a downloadable CSV report.
 */
@Component
public class ImportErrorReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(ImportErrorReportWriter.class);

    static final String[] HEADERS = {
        "row", "error_type", "message", "isbn_raw", "isbn_normalized", "title", "author", "source_file", "raw_row"
    };

    private final ObjectMapper objectMapper;

    public ImportErrorReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] render(List<ImportErrorEntry> errors, String sourceFilename) {
        StringWriter writer = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder().setHeader(HEADERS).build())) {
            for (ImportErrorEntry error : errors) {
                printer.printRecord(
                    error.row(),
                    error.type().getWireValue(),
                    error.message(),
                    nullToEmpty(error.isbn()),
                    nullToEmpty(IsbnUtils.normalize(error.isbn())),
                    nullToEmpty(error.title()),
                    nullToEmpty(error.author()),
                    nullToEmpty(sourceFilename),
                    serializeRow(error));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render import error report", e);
        }
        return writer.toString().getBytes(StandardCharsets.UTF_8);
    }

    private String serializeRow(ImportErrorEntry error) {
        try {
            return objectMapper.writeValueAsString(error.rawRow());
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize raw row {} for error report: {}", error.row(), e.getMessage());
            return "";
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
