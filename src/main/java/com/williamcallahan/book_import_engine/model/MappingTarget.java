package com.williamcallahan.book_import_engine.model;

import com.williamcallahan.book_import_engine.exception.InvalidFieldMappingException;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Destination of one source column: either a {@link CanonicalField} or a scoped custom field.
 *
 * <p>Custom tokens look like {@code custom_global_<name>} or {@code custom_personal_<name>}. A bare
 * {@code custom_<name>} token is read as global.</p>
 */
public record MappingTarget(CanonicalField field, String customName, FieldScope scope) {

    private static final Pattern CUSTOM_NAME = Pattern.compile("[a-z0-9][a-z0-9_]*");
    private static final String CUSTOM_PREFIX = "custom_";

    public MappingTarget {
        if (field == null && (customName == null || scope == null)) {
            throw new InvalidFieldMappingException("A mapping target needs either a canonical field or a scoped custom field");
        }
    }

    public static MappingTarget core(CanonicalField field) {
        return new MappingTarget(Objects.requireNonNull(field, "field"), null, null);
    }

    public static MappingTarget custom(String name, FieldScope scope) {
        return new MappingTarget(null, name, scope);
    }

    /**
     * Parses a mapping token.
     *
     * @throws InvalidFieldMappingException if the token is unknown or malformed
     */
    public static MappingTarget parse(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidFieldMappingException("Mapping token must not be blank");
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(CUSTOM_PREFIX)) {
            FieldScope scope = FieldScope.GLOBAL;
            String name = normalized.substring(CUSTOM_PREFIX.length());
            for (FieldScope candidate : FieldScope.values()) {
                if (normalized.startsWith(candidate.tokenPrefix())) {
                    scope = candidate;
                    name = normalized.substring(candidate.tokenPrefix().length());
                    break;
                }
            }
            if (!CUSTOM_NAME.matcher(name).matches()) {
                throw new InvalidFieldMappingException("Custom field token '" + token + "' has no usable field name");
            }
            return custom(name, scope);
        }
        return CanonicalField.fromToken(normalized)
            .map(MappingTarget::core)
            .orElseThrow(() -> new InvalidFieldMappingException("Unknown mapping token '" + token + "'"));
    }

    public boolean isCustom() {
        return field == null;
    }

    public boolean isIgnored() {
        return field == CanonicalField.IGNORE;
    }

    public String token() {
        return isCustom() ? scope.tokenPrefix() + customName : field.getToken();
    }

    @Override
    public String toString() {
        return token();
    }
}
