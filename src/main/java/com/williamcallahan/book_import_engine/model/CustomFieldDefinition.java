package com.williamcallahan.book_import_engine.model;

/**
 * Definition of a custom metadata field as held by the catalog.
 *
 * @param name machine name, the part after the scope prefix of a mapping token
 * @param displayName label shown to users
 * @param type value type
 * @param scope global (catalog-wide) or personal (per owner)
 * @param ownerId owner that created the definition
 * @param description free text, e.g. which import column caused it to be created
 */
public record CustomFieldDefinition(String name,
                                    String displayName,
                                    CustomFieldType type,
                                    FieldScope scope,
                                    String ownerId,
                                    String description) {
}
