package com.williamcallahan.book_import_engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether a custom metadata value is shared catalog-wide or private to one owner.
 */
public enum FieldScope {
    GLOBAL("global"),
    PERSONAL("personal");

    private final String wireValue;

    FieldScope(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public String tokenPrefix() {
        return "custom_" + wireValue + "_";
    }
}
