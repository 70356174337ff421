package com.williamcallahan.book_import_engine.exception;

/**
 * Thrown when a column mapping references a token that is neither a canonical field nor a
 * well-formed scoped custom field.
 */
public class InvalidFieldMappingException extends RuntimeException {

    public InvalidFieldMappingException(String message) {
        super(message);
    }
}
