/**
 * REST controller for saved mapping templates
 *
 * Features:
 * - Lists an owner's templates together with system templates
 * - Saves new templates and deletes owned ones
 * - Detects the best template for a list of file headers
 */
package com.williamcallahan.book_import_engine.controller;

import com.williamcallahan.book_import_engine.model.MappingTemplate;
import com.williamcallahan.book_import_engine.service.template.MappingTemplateService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/imports/{owner}/templates")
public class MappingTemplateController {

    private final MappingTemplateService templateService;

    public MappingTemplateController(MappingTemplateService templateService) {
        this.templateService = templateService;
    }

    /**
     * Body of a save request. Sample headers default to the mapped columns.
     */
    public record CreateTemplateRequest(String name,
                                        String description,
                                        String sourceType,
                                        List<String> sampleHeaders,
                                        Map<String, String> fieldMappings) {
    }

    @GetMapping
    public ResponseEntity<List<MappingTemplate>> listTemplates(@PathVariable String owner) {
        return ResponseEntity.ok(templateService.listTemplates(owner));
    }

    @GetMapping("/{templateId}")
    public ResponseEntity<MappingTemplate> getTemplate(@PathVariable String owner, @PathVariable String templateId) {
        return ResponseEntity.ok(templateService.getTemplate(owner, templateId));
    }

    @PostMapping
    public ResponseEntity<MappingTemplate> createTemplate(@PathVariable String owner,
                                                          @RequestBody CreateTemplateRequest request) {
        MappingTemplate template = templateService.createTemplate(owner, request.name(), request.description(),
            request.sourceType(), request.sampleHeaders(), request.fieldMappings());
        return ResponseEntity.status(HttpStatus.CREATED).body(template);
    }

    /**
     * Best template for the given headers, or 204 when none matches closely enough.
     */
    @PostMapping("/detect")
    public ResponseEntity<MappingTemplate> detectTemplate(@PathVariable String owner, @RequestBody List<String> headers) {
        return templateService.detectTemplate(owner, headers)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @DeleteMapping("/{templateId}")
    public ResponseEntity<Void> deleteTemplate(@PathVariable String owner, @PathVariable String templateId) {
        return templateService.deleteTemplate(owner, templateId)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }
}
