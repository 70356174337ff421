package com.williamcallahan.book_import_engine.exception;

public class MappingTemplateNotFoundException extends RuntimeException {

    public MappingTemplateNotFoundException(String owner, String templateId) {
        super("Mapping template " + templateId + " not found for owner " + owner);
    }
}
