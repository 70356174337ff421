package com.williamcallahan.book_import_engine.util;

import java.util.Collection;
import java.util.Map;

/**
 * Utility helpers for null/blank checks and for cleaning cells coming out of third-party exports.
 */
public final class ValidationUtils {
    private ValidationUtils() {
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public static boolean isNullOrEmpty(Collection<?> collection) {
        return collection == null || collection.isEmpty();
    }

    public static boolean isNullOrEmpty(Map<?, ?> map) {
        return map == null || map.isEmpty();
    }

    /**
     * Remove a single pair of wrapping quotes from the provided value.
     * Embedded apostrophes and internal quotes are preserved.
     *
     * @param value raw string from an export file
     * @return value without outer quotes, or the original value when no wrapping quotes are present
     */
    public static String stripWrappingQuotes(String value) {
        if (value == null) {
            return null;
        }
        int length = value.length();
        if (length < 2) {
            return value;
        }
        if (isQuoteCharacter(value.charAt(0)) && isQuoteCharacter(value.charAt(length - 1))) {
            return value.substring(1, length - 1);
        }
        return value;
    }

    /**
     * Strips the spreadsheet text wrapper some services put around identifiers, e.g.
     * {@code ="9780441172719"} or {@code =""}.
     */
    public static String stripExportWrapper(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.startsWith("=")) {
            trimmed = stripWrappingQuotes(trimmed.substring(1).trim());
        }
        return trimmed;
    }

    /**
     * Trimmed cell value with export wrappers and wrapping quotes removed; blank becomes {@code null}.
     */
    public static String cleanCell(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = stripWrappingQuotes(stripExportWrapper(value));
        cleaned = cleaned == null ? null : cleaned.trim();
        return hasText(cleaned) ? cleaned : null;
    }

    private static boolean isQuoteCharacter(char c) {
        return c == '"' || c == '\u201C' || c == '\u201D';
    }
}
