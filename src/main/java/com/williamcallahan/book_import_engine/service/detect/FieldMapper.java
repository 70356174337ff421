package com.williamcallahan.book_import_engine.service.detect;

import com.williamcallahan.book_import_engine.exception.InvalidFieldMappingException;
import com.williamcallahan.book_import_engine.model.CanonicalField;
import com.williamcallahan.book_import_engine.model.FieldMapping;
import com.williamcallahan.book_import_engine.model.MappingTarget;
import com.williamcallahan.book_import_engine.util.ValidationUtils;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Proposes column mappings from alias tables and validates caller overrides.
 */
@Component
public class FieldMapper {

    /**
     * Proposes a mapping for the given headers. Known formats use their own table; unknown files use
     * the keyword table and then the substring fallback for title, author and ISBN.
     */
    public FieldMapping propose(ImportFormat format, List<String> headers) {
        Map<String, MappingTarget> mapping = new LinkedHashMap<>();
        Set<CanonicalField> fallbackUsed = EnumSet.noneOf(CanonicalField.class);
        for (String header : headers) {
            if (!ValidationUtils.hasText(header)) {
                continue;
            }
            Optional<MappingTarget> target = FieldAliasTable.lookup(format, header);
            if (target.isEmpty() && (format == ImportFormat.UNKNOWN || format == ImportFormat.ISBN_LIST)) {
                target = FieldAliasTable.lookup(ImportFormat.UNKNOWN, header);
            }
            if (target.isPresent()) {
                mapping.put(header, target.get());
            }
        }
        if (format == ImportFormat.UNKNOWN) {
            for (String header : headers) {
                if (!ValidationUtils.hasText(header) || mapping.containsKey(header)) {
                    continue;
                }
                FieldAliasTable.keywordFallback(header)
                    .filter(target -> !alreadyMapped(mapping, target.field()) && fallbackUsed.add(target.field()))
                    .ifPresent(target -> mapping.put(header, target));
            }
        }
        return FieldMapping.of(mapping);
    }

    /**
     * Validates a caller-supplied mapping against the file's headers.
     *
     * @throws InvalidFieldMappingException for unknown tokens or columns the file does not have
     */
    public FieldMapping validateOverride(Map<String, String> override, List<String> headers) {
        FieldMapping mapping = FieldMapping.fromTokens(override);
        for (String column : mapping.getTargets().keySet()) {
            if (!headers.contains(column)) {
                throw new InvalidFieldMappingException("Mapped column '" + column + "' is not present in the file");
            }
        }
        return mapping;
    }

    private static boolean alreadyMapped(Map<String, MappingTarget> mapping, CanonicalField field) {
        return mapping.values().stream().anyMatch(target -> !target.isCustom() && target.field() == field);
    }
}
