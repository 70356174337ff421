package com.williamcallahan.book_import_engine.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Saved column mapping that can be reused for files with the same layout.
 *
 * @param id template id
 * @param ownerId owner, or {@link #SYSTEM_OWNER} for templates every owner can use
 * @param name label, e.g. "Goodreads Export"
 * @param description free text
 * @param sourceType where files of this layout come from, e.g. {@code goodreads} or {@code custom}
 * @param sampleHeaders headers of the file the template was built from, used for detection
 * @param fieldMappings column to mapping-token pairs
 * @param timesUsed how many imports used the template
 * @param lastUsed last time an import used the template
 */
public record MappingTemplate(String id,
                              String ownerId,
                              String name,
                              String description,
                              String sourceType,
                              List<String> sampleHeaders,
                              Map<String, String> fieldMappings,
                              int timesUsed,
                              Instant lastUsed,
                              Instant createdAt,
                              Instant updatedAt) {

    public static final String SYSTEM_OWNER = "__system__";

    public MappingTemplate {
        sampleHeaders = sampleHeaders == null ? List.of() : List.copyOf(sampleHeaders);
        fieldMappings = fieldMappings == null ? Map.of() : new LinkedHashMap<>(fieldMappings);
    }

    public boolean isSystem() {
        return SYSTEM_OWNER.equals(ownerId);
    }

    public MappingTemplate withUse(Instant usedAt) {
        return new MappingTemplate(id, ownerId, name, description, sourceType, sampleHeaders, fieldMappings,
            timesUsed + 1, usedAt, createdAt, usedAt);
    }
}
