package com.williamcallahan.book_import_engine.service.csv;

import com.williamcallahan.book_import_engine.util.ValidationUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One data row of an import file.
 *
 * @param rowNumber 1-based data row index, header excluded
 * @param values column name to raw cell value, in source column order
 */
public record ImportRow(int rowNumber, Map<String, String> values) {

    public ImportRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Cleaned cell value, or {@code null} when the column is absent or blank.
     */
    public String value(String column) {
        return ValidationUtils.cleanCell(values.get(column));
    }

    public boolean isBlank() {
        return values.values().stream().noneMatch(cell -> ValidationUtils.cleanCell(cell) != null);
    }
}
