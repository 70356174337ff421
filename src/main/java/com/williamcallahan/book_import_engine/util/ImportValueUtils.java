package com.williamcallahan.book_import_engine.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient parsing of the cell values found in reading-tracker exports.
 */
public final class ImportValueUtils {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ofPattern("yyyy-MM-dd"),
        DateTimeFormatter.ofPattern("MM/dd/yyyy"),
        DateTimeFormatter.ofPattern("M/d/yyyy"),
        DateTimeFormatter.ofPattern("dd.MM.yyyy"),
        DateTimeFormatter.ofPattern("yyyy/MM/dd"),
        DateTimeFormatter.ofPattern("yyyy/M/d")
    );

    private static final Pattern YEAR = Pattern.compile("^(\\d{4})(?:\\.0+)?$");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^-?\\d+(?:[.,]\\d+)?");

    public static final String STATUS_READ = "read";
    public static final String STATUS_CURRENTLY_READING = "currently_reading";
    public static final String STATUS_PLAN_TO_READ = "plan_to_read";
    public static final String STATUS_DID_NOT_FINISH = "did_not_finish";

    private ImportValueUtils() {
    }

    /**
     * Parses {@code yyyy-MM-dd}, {@code MM/dd/yyyy}, {@code dd.MM.yyyy}, {@code yyyy/MM/dd} and
     * ISO date-times (date part kept).
     */
    public static Optional<LocalDate> parseDate(String value) {
        if (!ValidationUtils.hasText(value)) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(trimmed, format));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        try {
            return Optional.of(OffsetDateTime.parse(trimmed).toLocalDate());
        } catch (DateTimeParseException ignored) {
            // not an offset date-time
        }
        try {
            return Optional.of(LocalDateTime.parse(trimmed).toLocalDate());
        } catch (DateTimeParseException ignored) {
            return Optional.empty();
        }
    }

    /**
     * Parses a whole number, accepting values such as {@code "12"}, {@code "12.0"} or {@code "350 pages"}.
     */
    public static Optional<Integer> parseInteger(String value) {
        return parseDouble(value).map(number -> (int) Math.round(number));
    }

    public static Optional<Double> parseDouble(String value) {
        if (!ValidationUtils.hasText(value)) {
            return Optional.empty();
        }
        Matcher matcher = LEADING_NUMBER.matcher(value.trim());
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(matcher.group().replace(',', '.')));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Turns a bare four-digit year into {@code yyyy-01-01}; other values are returned trimmed.
     */
    public static String publicationDateFromYear(String value) {
        if (!ValidationUtils.hasText(value)) {
            return null;
        }
        Matcher matcher = YEAR.matcher(value.trim());
        return matcher.matches() ? matcher.group(1) + "-01-01" : value.trim();
    }

    /**
     * Splits a comma separated cell into trimmed, non-blank parts.
     */
    public static List<String> splitList(String value) {
        List<String> parts = new ArrayList<>();
        if (!ValidationUtils.hasText(value)) {
            return parts;
        }
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }

    /**
     * Maps the shelf and status vocabularies of the supported services onto the catalog's statuses.
     *
     * @return the normalized status, or {@code null} when the value is not recognized
     */
    public static String normalizeReadingStatus(String value) {
        if (!ValidationUtils.hasText(value)) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', ' ').replace('_', ' ');
        return switch (normalized) {
            case "read", "finished", "completed", "done" -> STATUS_READ;
            case "currently reading", "reading", "in progress" -> STATUS_CURRENTLY_READING;
            case "to read", "want to read", "plan to read", "tbr" -> STATUS_PLAN_TO_READ;
            case "did not finish", "dnf", "abandoned" -> STATUS_DID_NOT_FINISH;
            default -> null;
        };
    }
}
