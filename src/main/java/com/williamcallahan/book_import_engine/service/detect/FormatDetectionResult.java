package com.williamcallahan.book_import_engine.service.detect;

import com.williamcallahan.book_import_engine.model.FieldMapping;

import java.util.List;

/**
 * Outcome of classifying an import file.
 *
 * @param format detected format
 * @param confidence normalized signature score, or the ISBN line ratio for ISBN lists
 * @param mapping proposed column mapping
 * @param headers header names as read from the file (or the synthetic column for bare lists)
 * @param delimiter sniffed delimiter
 * @param hasHeader whether the first line is a header
 */
public record FormatDetectionResult(ImportFormat format,
                                    double confidence,
                                    FieldMapping mapping,
                                    List<String> headers,
                                    char delimiter,
                                    boolean hasHeader) {

    public FormatDetectionResult {
        headers = headers == null ? List.of() : List.copyOf(headers);
    }

    public FormatDetectionResult withMapping(FieldMapping replacement) {
        return new FormatDetectionResult(format, confidence, replacement, headers, delimiter, hasHeader);
    }
}
