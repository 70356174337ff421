package com.williamcallahan.book_import_engine.service.resolution;

import com.williamcallahan.book_import_engine.model.CustomFieldType;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Picks a field type for an unknown custom column from a handful of its values.
 *
 * Checks run in order and the first one every sample passes wins: integer, decimal, boolean.
 * Dates only need 80% of the samples. Anything else is TEXT.
 */
public final class CustomFieldTypeInferrer {

    /** Values sampled per column. */
    public static final int SAMPLE_SIZE = 10;

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Set<String> BOOLEAN_VALUES = Set.of("true", "false", "yes", "no", "1", "0", "y", "n");
    private static final double DATE_RATIO = 0.8;
    private static final int MIN_DATE_LENGTH = 8;

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ofPattern("uuuu-M-d").withResolverStyle(ResolverStyle.STRICT),
        DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT),
        DateTimeFormatter.ofPattern("d/M/uuuu").withResolverStyle(ResolverStyle.STRICT),
        DateTimeFormatter.ofPattern("uuuu/M/d").withResolverStyle(ResolverStyle.STRICT)
    );

    private CustomFieldTypeInferrer() {
    }

    public static CustomFieldType infer(List<String> samples) {
        if (samples == null) {
            return CustomFieldType.TEXT;
        }
        List<String> values = samples.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .toList();
        if (values.isEmpty()) {
            return CustomFieldType.TEXT;
        }
        if (values.stream().allMatch(value -> INTEGER.matcher(value).matches())
            || values.stream().allMatch(value -> DECIMAL.matcher(value).matches())) {
            return CustomFieldType.NUMBER;
        }
        if (values.stream().allMatch(value -> BOOLEAN_VALUES.contains(value.toLowerCase(Locale.ROOT)))) {
            return CustomFieldType.BOOLEAN;
        }
        long dates = values.stream().filter(CustomFieldTypeInferrer::looksLikeDate).count();
        if (dates >= values.size() * DATE_RATIO) {
            return CustomFieldType.DATE;
        }
        return CustomFieldType.TEXT;
    }

    static boolean looksLikeDate(String value) {
        if (value.length() < MIN_DATE_LENGTH || (value.indexOf('-') < 0 && value.indexOf('/') < 0)) {
            return false;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                LocalDate.parse(value, format);
                return true;
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return false;
    }
}
