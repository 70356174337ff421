package com.williamcallahan.book_import_engine.catalog;

import com.williamcallahan.book_import_engine.model.MappingTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Storage for saved mapping templates. Ownership rules live in the template service.
 */
public interface MappingTemplateCatalog {

    /** Inserts or replaces the template with the same id. */
    MappingTemplate saveTemplate(MappingTemplate template);

    Optional<MappingTemplate> findTemplate(String templateId);

    /** The owner's templates plus system templates, newest first. */
    List<MappingTemplate> listTemplates(String owner);

    boolean deleteTemplate(String templateId);
}
