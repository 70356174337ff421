/**
 * Validates reading-history rows and groups them by book name
 *
 * Features:
 * - A parseable date is mandatory
 * - Pages come from the pages column or from the start and end page
 * - Sessions with no duration get owner defaults, then system defaults, then one minute
 * - Invalid rows become validation errors without stopping the analysis
 */
package com.williamcallahan.book_import_engine.service.history;

import com.williamcallahan.book_import_engine.config.ImportProperties;
import com.williamcallahan.book_import_engine.model.CanonicalField;
import com.williamcallahan.book_import_engine.model.FieldMapping;
import com.williamcallahan.book_import_engine.model.ImportErrorEntry;
import com.williamcallahan.book_import_engine.model.ImportErrorType;
import com.williamcallahan.book_import_engine.service.csv.ImportRow;
import com.williamcallahan.book_import_engine.util.ImportValueUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class ReadingHistoryAnalyzer {

    private final ImportProperties properties;

    public ReadingHistoryAnalyzer(ImportProperties properties) {
        this.properties = properties;
    }

    public ReadingHistoryAnalysis analyze(Iterator<ImportRow> rows, FieldMapping mapping, ReadingDefaults ownerDefaults) {
        Map<String, ReadingHistoryGroup> groups = new LinkedHashMap<>();
        List<ImportErrorEntry> errors = new ArrayList<>();
        int blankRows = 0;
        ReadingDefaults defaults = effectiveDefaults(ownerDefaults);

        while (rows.hasNext()) {
            ImportRow row = rows.next();
            if (row.isBlank()) {
                blankRows++;
                continue;
            }
            try {
                ReadingHistoryEntryDraft draft = parse(row, mapping, defaults);
                String key = ReadingHistoryGroup.keyFor(draft.bookName());
                groups.computeIfAbsent(key, k -> new ReadingHistoryGroup(k,
                        draft.bookName() == null ? "(no book)" : draft.bookName().trim()))
                    .add(draft);
            } catch (IllegalArgumentException e) {
                errors.add(ImportErrorEntry.of(row.rowNumber(), ImportErrorType.VALIDATION_ERROR, e.getMessage(),
                    null, first(row, mapping, CanonicalField.BOOK_NAME), null, row.values()));
            }
        }
        log.info("Reading history analysis: {} groups, {} entries, {} invalid rows, {} blank rows",
            groups.size(), groups.values().stream().mapToInt(ReadingHistoryGroup::size).sum(), errors.size(), blankRows);
        return new ReadingHistoryAnalysis(new ArrayList<>(groups.values()), errors, blankRows);
    }

    /**
     * Owner defaults win when either value is set; otherwise the configured system defaults apply.
     */
    ReadingDefaults effectiveDefaults(ReadingDefaults ownerDefaults) {
        if (ownerDefaults != null && ownerDefaults.isConfigured()) {
            return ownerDefaults;
        }
        ImportProperties.ReadingHistory system = properties.getReadingHistory();
        return new ReadingDefaults(system.getDefaultPages(), system.getDefaultMinutes());
    }

    ReadingHistoryEntryDraft parse(ImportRow row, FieldMapping mapping, ReadingDefaults defaults) {
        String rawDate = first(row, mapping, CanonicalField.DATE);
        if (rawDate == null) {
            throw new IllegalArgumentException("Missing date");
        }
        LocalDate date = ImportValueUtils.parseDate(rawDate)
            .orElseThrow(() -> new IllegalArgumentException("Unrecognized date '" + rawDate + "'"));

        int pages = pagesRead(row, mapping);
        int minutes = nonNegative(first(row, mapping, CanonicalField.MINUTES_READ), "minutes read").orElse(0);

        if (pages == 0 && minutes == 0) {
            pages = defaults.pagesOrZero();
            minutes = defaults.minutesOrZero();
        }
        if (pages == 0 && minutes == 0) {
            minutes = 1;
        }
        return new ReadingHistoryEntryDraft(row.rowNumber(), first(row, mapping, CanonicalField.BOOK_NAME),
            date, pages, minutes, first(row, mapping, CanonicalField.NOTES), row.values());
    }

    private int pagesRead(ImportRow row, FieldMapping mapping) {
        Optional<Integer> pages = nonNegative(first(row, mapping, CanonicalField.PAGES_READ), "pages read");
        if (pages.isPresent()) {
            return pages.get();
        }
        Optional<Integer> start = nonNegative(first(row, mapping, CanonicalField.START_PAGE), "start page");
        Optional<Integer> end = nonNegative(first(row, mapping, CanonicalField.END_PAGE), "end page");
        if (start.isPresent() && end.isPresent()) {
            if (end.get() < start.get()) {
                throw new IllegalArgumentException("End page " + end.get() + " is before start page " + start.get());
            }
            return end.get() - start.get() + 1;
        }
        return 0;
    }

    private static Optional<Integer> nonNegative(String value, String label) {
        if (value == null) {
            return Optional.empty();
        }
        Integer parsed = ImportValueUtils.parseInteger(value)
            .orElseThrow(() -> new IllegalArgumentException("Unparseable " + label + " '" + value + "'"));
        if (parsed < 0) {
            throw new IllegalArgumentException("Negative " + label + " '" + value + "'");
        }
        return Optional.of(parsed);
    }

    private static String first(ImportRow row, FieldMapping mapping, CanonicalField field) {
        for (String column : mapping.columnsFor(field)) {
            String value = row.value(column);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
