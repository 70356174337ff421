/**
 * Saved mapping templates and header-based template detection
 *
 * Features:
 * - Templates are validated as mappings when saved
 * - Owners see their own templates plus system templates, newest first
 * - Detection picks the template whose sample headers best match the file's headers
 * - Only the owning user can delete a template
 */
package com.williamcallahan.book_import_engine.service.template;

import com.williamcallahan.book_import_engine.catalog.MappingTemplateCatalog;
import com.williamcallahan.book_import_engine.exception.MappingTemplateNotFoundException;
import com.williamcallahan.book_import_engine.model.FieldMapping;
import com.williamcallahan.book_import_engine.model.MappingTemplate;
import com.williamcallahan.book_import_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class MappingTemplateService {

    private static final Logger logger = LoggerFactory.getLogger(MappingTemplateService.class);

    /** A template is only detected when its score is strictly above this. */
    static final double DETECTION_THRESHOLD = 0.5;

    private static final String DEFAULT_SOURCE_TYPE = "custom";

    private final MappingTemplateCatalog templates;
    private final Clock clock;

    public MappingTemplateService(MappingTemplateCatalog templates, Clock clock) {
        this.templates = templates;
        this.clock = clock;
    }

    /**
     * Saves a new template. Sample headers default to the mapped columns.
     *
     * @throws IllegalArgumentException if the name or the mapping is missing
     * @throws com.williamcallahan.book_import_engine.exception.InvalidFieldMappingException for bad tokens
     */
    public MappingTemplate createTemplate(String owner, String name, String description, String sourceType,
                                          List<String> sampleHeaders, Map<String, String> fieldMappings) {
        if (!ValidationUtils.hasText(owner) || !ValidationUtils.hasText(name)) {
            throw new IllegalArgumentException("Mapping templates need an owner and a name");
        }
        if (fieldMappings == null || fieldMappings.isEmpty()) {
            throw new IllegalArgumentException("Mapping template '" + name + "' has no field mappings");
        }
        FieldMapping.fromTokens(fieldMappings);
        List<String> headers = sampleHeaders == null || sampleHeaders.isEmpty()
            ? new ArrayList<>(fieldMappings.keySet()) : sampleHeaders;
        Instant now = clock.instant();
        MappingTemplate template = new MappingTemplate(UUID.randomUUID().toString(), owner, name.trim(), description,
            ValidationUtils.hasText(sourceType) ? sourceType.trim() : DEFAULT_SOURCE_TYPE,
            headers, fieldMappings, 0, null, now, now);
        templates.saveTemplate(template);
        logger.info("Saved mapping template '{}' ({}) for owner {} with {} columns",
            template.name(), template.id(), owner, fieldMappings.size());
        return template;
    }

    public List<MappingTemplate> listTemplates(String owner) {
        return templates.listTemplates(owner);
    }

    /**
     * @throws MappingTemplateNotFoundException if the template does not exist or belongs to another owner
     */
    public MappingTemplate getTemplate(String owner, String templateId) {
        return templates.findTemplate(templateId)
            .filter(template -> template.isSystem() || template.ownerId().equals(owner))
            .orElseThrow(() -> new MappingTemplateNotFoundException(owner, templateId));
    }

    /**
     * Best-matching template for a file's headers among those visible to the owner. Ties keep the
     * newer template.
     */
    public Optional<MappingTemplate> detectTemplate(String owner, List<String> headers) {
        MappingTemplate best = null;
        double bestScore = 0;
        for (MappingTemplate template : templates.listTemplates(owner)) {
            double score = headerMatchScore(headers, template.sampleHeaders());
            if (score > bestScore) {
                bestScore = score;
                best = template;
            }
        }
        if (best == null || bestScore <= DETECTION_THRESHOLD) {
            logger.debug("No mapping template detected for owner {} (best score {})", owner, String.format("%.2f", bestScore));
            return Optional.empty();
        }
        logger.info("Detected mapping template '{}' for owner {} (score {})", best.name(), owner, String.format("%.2f", bestScore));
        return Optional.of(best);
    }

    /**
     * The template's mappings keyed by the file's own header spelling. Template columns the file
     * does not have are left out.
     */
    public Map<String, String> mappingFor(MappingTemplate template, List<String> headers) {
        Map<String, String> byHeader = new LinkedHashMap<>();
        template.fieldMappings().forEach((column, token) -> {
            String wanted = normalize(column);
            headers.stream()
                .filter(header -> normalize(header).equals(wanted))
                .findFirst()
                .ifPresent(header -> byHeader.put(header, token));
        });
        return byHeader;
    }

    public MappingTemplate recordUse(MappingTemplate template) {
        return templates.saveTemplate(template.withUse(clock.instant()));
    }

    /**
     * @return {@code false} if the template does not exist or the owner does not own it
     */
    public boolean deleteTemplate(String owner, String templateId) {
        Optional<MappingTemplate> template = templates.findTemplate(templateId);
        if (template.isEmpty() || !template.get().ownerId().equals(owner)) {
            logger.warn("Owner {} may not delete mapping template {}", owner, templateId);
            return false;
        }
        return templates.deleteTemplate(templateId);
    }

    /**
     * Share of the first list's headers found in the second, over the longer list's length.
     * Comparison ignores case and surrounding whitespace.
     */
    public static double headerMatchScore(List<String> headers, List<String> sampleHeaders) {
        if (headers == null || sampleHeaders == null || headers.isEmpty() || sampleHeaders.isEmpty()) {
            return 0.0;
        }
        List<String> samples = sampleHeaders.stream().map(MappingTemplateService::normalize).toList();
        long matches = headers.stream().map(MappingTemplateService::normalize).filter(samples::contains).count();
        return (double) matches / Math.max(headers.size(), sampleHeaders.size());
    }

    private static String normalize(String header) {
        return header == null ? "" : header.trim().toLowerCase(Locale.ROOT);
    }
}
