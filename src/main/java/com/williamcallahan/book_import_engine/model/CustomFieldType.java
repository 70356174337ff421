package com.williamcallahan.book_import_engine.model;

public enum CustomFieldType {
    TEXT,
    TEXTAREA,
    NUMBER,
    BOOLEAN,
    DATE,
    TAGS
}
