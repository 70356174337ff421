package com.williamcallahan.book_import_engine.util;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shared helpers for normalizing, validating and converting ISBN input before lookups or
 * persistence.
 */
public final class IsbnUtils {

    private static final Pattern NON_ISBN_CHARACTERS = Pattern.compile("[^0-9Xx]");
    private static final Pattern ISBN13_SHAPE = Pattern.compile("\\d{13}");
    private static final Pattern ISBN10_SHAPE = Pattern.compile("\\d{9}[\\dX]");

    private IsbnUtils() {
    }

    /**
     * Normalizes an ISBN by removing export wrappers and non-numeric characters (except the X
     * check digit) and uppercasing the result.
     *
     * @param raw user-provided ISBN input
     * @return cleaned ISBN string, or {@code null} if nothing usable remains
     */
    public static String sanitize(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = NON_ISBN_CHARACTERS.matcher(ValidationUtils.stripExportWrapper(raw)).replaceAll("");
        if (cleaned.isBlank()) {
            return null;
        }
        return cleaned.toUpperCase(Locale.ROOT);
    }

    /**
     * Validate if a string is an ISBN-13 with a correct check digit.
     */
    public static boolean isValidIsbn13(String isbn) {
        String cleaned = sanitize(isbn);
        if (cleaned == null || !ISBN13_SHAPE.matcher(cleaned).matches()) {
            return false;
        }
        return isbn13CheckDigit(cleaned.substring(0, 12)) == cleaned.charAt(12);
    }

    /**
     * Validate if a string is an ISBN-10 with a correct check digit.
     */
    public static boolean isValidIsbn10(String isbn) {
        String cleaned = sanitize(isbn);
        if (cleaned == null || !ISBN10_SHAPE.matcher(cleaned).matches()) {
            return false;
        }
        return isbn10CheckDigit(cleaned.substring(0, 9)) == cleaned.charAt(9);
    }

    public static boolean isValidIsbn(String isbn) {
        return isValidIsbn13(isbn) || isValidIsbn10(isbn);
    }

    /**
     * Sanitizes and validates the input.
     *
     * @return the cleaned ISBN when it passes check-digit validation, otherwise {@code null}
     */
    public static String normalize(String raw) {
        String cleaned = sanitize(raw);
        return isValidIsbn(cleaned) ? cleaned : null;
    }

    /**
     * Converts a valid ISBN-10 into its 978-prefixed ISBN-13 form.
     */
    public static String toIsbn13(String isbn10) {
        if (!isValidIsbn10(isbn10)) {
            return null;
        }
        String body = "978" + sanitize(isbn10).substring(0, 9);
        return body + isbn13CheckDigit(body);
    }

    /**
     * Converts a 978-prefixed ISBN-13 into its ISBN-10 form. 979 editions have no ISBN-10.
     */
    public static String toIsbn10(String isbn13) {
        if (!isValidIsbn13(isbn13)) {
            return null;
        }
        String cleaned = sanitize(isbn13);
        if (!cleaned.startsWith("978")) {
            return null;
        }
        String body = cleaned.substring(3, 12);
        return body + isbn10CheckDigit(body);
    }

    /**
     * The ISBN-13 form used to deduplicate identifiers of the same edition.
     */
    public static String canonicalKey(String isbn) {
        String normalized = normalize(isbn);
        if (normalized == null) {
            return null;
        }
        return normalized.length() == 13 ? normalized : toIsbn13(normalized);
    }

    /**
     * The valid input plus every converted form of the same edition.
     */
    public static Set<String> allForms(String isbn) {
        Set<String> forms = new LinkedHashSet<>();
        String normalized = normalize(isbn);
        if (normalized == null) {
            return forms;
        }
        forms.add(normalized);
        String converted = normalized.length() == 13 ? toIsbn10(normalized) : toIsbn13(normalized);
        if (converted != null) {
            forms.add(converted);
        }
        return forms;
    }

    private static char isbn13CheckDigit(String first12) {
        int sum = 0;
        for (int i = 0; i < 12; i++) {
            int digit = first12.charAt(i) - '0';
            sum += (i % 2 == 0) ? digit : digit * 3;
        }
        int check = (10 - (sum % 10)) % 10;
        return (char) ('0' + check);
    }

    private static char isbn10CheckDigit(String first9) {
        int sum = 0;
        for (int i = 0; i < 9; i++) {
            sum += (first9.charAt(i) - '0') * (10 - i);
        }
        int check = (11 - (sum % 11)) % 11;
        return check == 10 ? 'X' : (char) ('0' + check);
    }
}
