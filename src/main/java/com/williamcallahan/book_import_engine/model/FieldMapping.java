package com.williamcallahan.book_import_engine.model;

import com.williamcallahan.book_import_engine.exception.InvalidFieldMappingException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered source-column to canonical-field mapping, validated once when it is built.
 */
public final class FieldMapping {

    private final Map<String, MappingTarget> targets;

    private FieldMapping(Map<String, MappingTarget> targets) {
        this.targets = Collections.unmodifiableMap(targets);
    }

    public static FieldMapping empty() {
        return new FieldMapping(new LinkedHashMap<>());
    }

    /**
     * Builds a mapping from raw column-to-token pairs, preserving their order.
     *
     * @throws InvalidFieldMappingException if any token fails to parse
     */
    public static FieldMapping fromTokens(Map<String, String> columnTokens) {
        Map<String, MappingTarget> parsed = new LinkedHashMap<>();
        if (columnTokens == null) {
            return new FieldMapping(parsed);
        }
        columnTokens.forEach((column, token) -> {
            if (column == null || column.isBlank()) {
                throw new InvalidFieldMappingException("Mapping contains a blank source column");
            }
            parsed.put(column, MappingTarget.parse(token));
        });
        return new FieldMapping(parsed);
    }

    public static FieldMapping of(Map<String, MappingTarget> targets) {
        return new FieldMapping(new LinkedHashMap<>(Objects.requireNonNull(targets, "targets")));
    }

    public Map<String, MappingTarget> getTargets() {
        return targets;
    }

    public boolean isEmpty() {
        return targets.isEmpty();
    }

    /**
     * Source columns mapped onto a canonical field, in source order.
     */
    public List<String> columnsFor(CanonicalField field) {
        List<String> columns = new ArrayList<>();
        targets.forEach((column, target) -> {
            if (!target.isCustom() && target.field() == field) {
                columns.add(column);
            }
        });
        return columns;
    }

    public boolean maps(CanonicalField field) {
        return !columnsFor(field).isEmpty();
    }

    /**
     * Custom-field targets keyed by source column, in source order.
     */
    public Map<String, MappingTarget> customTargets() {
        Map<String, MappingTarget> custom = new LinkedHashMap<>();
        targets.forEach((column, target) -> {
            if (target.isCustom()) {
                custom.put(column, target);
            }
        });
        return custom;
    }

    /**
     * Returns a copy without the given custom target, used when a field definition could not
     * be provisioned.
     */
    public FieldMapping without(MappingTarget target) {
        Map<String, MappingTarget> remaining = new LinkedHashMap<>(targets);
        remaining.values().removeIf(target::equals);
        return new FieldMapping(remaining);
    }

    public Map<String, String> toTokens() {
        Map<String, String> tokens = new LinkedHashMap<>();
        targets.forEach((column, target) -> tokens.put(column, target.token()));
        return tokens;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldMapping other)) {
            return false;
        }
        return targets.equals(other.targets);
    }

    @Override
    public int hashCode() {
        return targets.hashCode();
    }

    @Override
    public String toString() {
        return toTokens().toString();
    }
}
