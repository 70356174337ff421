/**
 * Ensures every custom field referenced by a mapping exists before rows are processed
 *
 * Features:
 * - Reuses existing definitions looked up by name, scope and owner
 * - Known export fields get a curated display name and type
 * - Unknown fields are named after the token and typed from sampled column values
 * - A field that cannot be provisioned is dropped from the job's mapping
 */
package com.williamcallahan.book_import_engine.service.resolution;

import com.williamcallahan.book_import_engine.catalog.CustomFieldCatalog;
import com.williamcallahan.book_import_engine.model.CustomFieldDefinition;
import com.williamcallahan.book_import_engine.model.CustomFieldType;
import com.williamcallahan.book_import_engine.model.FieldMapping;
import com.williamcallahan.book_import_engine.model.MappingTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class CustomFieldProvisioner {

    private static final Logger logger = LoggerFactory.getLogger(CustomFieldProvisioner.class);

    private record KnownField(String displayName, CustomFieldType type) {
    }

    private static final Map<String, KnownField> KNOWN_FIELDS = Map.ofEntries(
        Map.entry("goodreads_book_id", new KnownField("Goodreads Book ID", CustomFieldType.TEXT)),
        Map.entry("average_rating", new KnownField("Average Rating", CustomFieldType.NUMBER)),
        Map.entry("binding_type", new KnownField("Binding Type", CustomFieldType.TEXT)),
        Map.entry("original_publication_year", new KnownField("Original Publication Year", CustomFieldType.NUMBER)),
        Map.entry("goodreads_shelves", new KnownField("Goodreads Shelves", CustomFieldType.TAGS)),
        Map.entry("shelf_positions", new KnownField("Bookshelves with Positions", CustomFieldType.TEXTAREA)),
        Map.entry("spoiler_flag", new KnownField("Spoiler Review", CustomFieldType.BOOLEAN)),
        Map.entry("private_notes", new KnownField("Private Notes", CustomFieldType.TEXTAREA)),
        Map.entry("read_count", new KnownField("Number of Times Read", CustomFieldType.NUMBER)),
        Map.entry("owned_copies", new KnownField("Number of Owned Copies", CustomFieldType.NUMBER)),
        Map.entry("format", new KnownField("Book Format", CustomFieldType.TEXT)),
        Map.entry("moods", new KnownField("Moods", CustomFieldType.TAGS)),
        Map.entry("pace", new KnownField("Reading Pace", CustomFieldType.TEXT)),
        Map.entry("character_plot_driven", new KnownField("Character vs Plot Driven", CustomFieldType.TEXT)),
        Map.entry("content_warnings", new KnownField("Content Warnings", CustomFieldType.TAGS)),
        Map.entry("content_warning_description", new KnownField("Content Warning Description", CustomFieldType.TEXTAREA)),
        Map.entry("character_development", new KnownField("Strong Character Development", CustomFieldType.BOOLEAN)),
        Map.entry("loveable_characters", new KnownField("Loveable Characters", CustomFieldType.BOOLEAN)),
        Map.entry("diverse_characters", new KnownField("Diverse Characters", CustomFieldType.BOOLEAN)),
        Map.entry("flawed_characters", new KnownField("Flawed Characters", CustomFieldType.BOOLEAN)),
        Map.entry("storygraph_tags", new KnownField("StoryGraph Tags", CustomFieldType.TAGS)),
        Map.entry("owned", new KnownField("Owned", CustomFieldType.BOOLEAN)),
        Map.entry("series", new KnownField("Series", CustomFieldType.TEXT))
    );

    private final CustomFieldCatalog customFields;

    public CustomFieldProvisioner(CustomFieldCatalog customFields) {
        this.customFields = customFields;
    }

    /**
     * Result of provisioning.
     *
     * @param mapping mapping with unprovisionable custom columns removed
     * @param created definitions created for this job
     * @param messages activity lines describing what happened
     */
    public record Result(FieldMapping mapping, List<CustomFieldDefinition> created, List<String> messages) {
    }

    /**
     * @param samplesByColumn up to {@link CustomFieldTypeInferrer#SAMPLE_SIZE} non-empty values per
     *                        source column, used to type fields without a curated definition
     */
    public Result provision(String owner, FieldMapping mapping, Map<String, List<String>> samplesByColumn) {
        FieldMapping effective = mapping;
        List<CustomFieldDefinition> created = new ArrayList<>();
        List<String> messages = new ArrayList<>();
        for (Map.Entry<String, MappingTarget> entry : mapping.customTargets().entrySet()) {
            String column = entry.getKey();
            MappingTarget target = entry.getValue();
            try {
                if (customFields.findDefinition(target.customName(), target.scope(), owner).isPresent()) {
                    continue;
                }
                CustomFieldDefinition definition = customFields.createDefinition(
                    definitionFor(owner, column, target, samplesByColumn.getOrDefault(column, List.of())));
                created.add(definition);
                messages.add("Created custom field: " + definition.displayName() + " (" + target.token() + ")");
                logger.info("Created {} {} custom field '{}' for owner {} from column '{}'",
                    target.scope().getWireValue(), definition.type(), target.customName(), owner, column);
            } catch (RuntimeException e) {
                logger.warn("Could not provision custom field {} for column '{}': {}", target.token(), column, e.getMessage());
                messages.add("Custom field " + target.token() + " unavailable; column '" + column + "' will not be imported");
                effective = effective.without(target);
            }
        }
        return new Result(effective, created, messages);
    }

    static CustomFieldDefinition definitionFor(String owner, String column, MappingTarget target, List<String> samples) {
        KnownField known = KNOWN_FIELDS.get(target.customName());
        String displayName = known != null ? known.displayName() : displayName(target.customName());
        CustomFieldType type = known != null ? known.type() : CustomFieldTypeInferrer.infer(samples);
        return new CustomFieldDefinition(target.customName(), displayName, type, target.scope(), owner,
            "Auto-created during import for column \"" + column + "\"");
    }

    /**
     * {@code shelf_positions} becomes "Shelf Positions".
     */
    static String displayName(String name) {
        return Arrays.stream(name.split("_"))
            .filter(part -> !part.isEmpty())
            .map(part -> part.substring(0, 1).toUpperCase(Locale.ROOT) + part.substring(1))
            .collect(Collectors.joining(" "));
    }
}
