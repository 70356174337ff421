package com.williamcallahan.book_import_engine.catalog;

import com.williamcallahan.book_import_engine.model.CustomFieldDefinition;
import com.williamcallahan.book_import_engine.model.FieldScope;

import java.util.List;
import java.util.Optional;

/**
 * Scoped custom-field definitions. Global definitions are shared by every owner; personal ones
 * belong to the owner that created them.
 */
public interface CustomFieldCatalog {

    Optional<CustomFieldDefinition> findDefinition(String name, FieldScope scope, String owner);

    CustomFieldDefinition createDefinition(CustomFieldDefinition definition);

    List<CustomFieldDefinition> listDefinitions(String owner);
}
