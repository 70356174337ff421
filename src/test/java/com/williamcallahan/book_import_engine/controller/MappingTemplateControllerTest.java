package com.williamcallahan.book_import_engine.controller;

import com.williamcallahan.book_import_engine.exception.InvalidFieldMappingException;
import com.williamcallahan.book_import_engine.exception.MappingTemplateNotFoundException;
import com.williamcallahan.book_import_engine.model.MappingTemplate;
import com.williamcallahan.book_import_engine.service.template.MappingTemplateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class MappingTemplateControllerTest {

    @Mock
    private MappingTemplateService templateService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new MappingTemplateController(templateService))
            .setControllerAdvice(new ImportApiExceptionHandler())
            .build();
    }

    private static MappingTemplate template(String id, String owner) {
        Instant created = Instant.parse("2024-05-01T10:00:00Z");
        return new MappingTemplate(id, owner, "My Sheet", null, "custom", List.of("Book", "Writer"),
            Map.of("Book", "title"), 3, null, created, created);
    }

    @Test
    void listTemplates_includesSystemTemplates() throws Exception {
        when(templateService.listTemplates("alice"))
            .thenReturn(List.of(template("t-2", "alice"), template("t-1", MappingTemplate.SYSTEM_OWNER)));

        mockMvc.perform(get("/api/imports/alice/templates"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)))
            .andExpect(jsonPath("$[0].id").value("t-2"))
            .andExpect(jsonPath("$[1].ownerId").value("__system__"))
            .andExpect(jsonPath("$[1].timesUsed").value(3));
    }

    @Test
    void createTemplate_returnsCreated() throws Exception {
        when(templateService.createTemplate(eq("alice"), eq("My Sheet"), isNull(), isNull(), isNull(),
            eq(Map.of("Book", "title")))).thenReturn(template("t-1", "alice"));

        mockMvc.perform(post("/api/imports/alice/templates")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"My Sheet\", \"fieldMappings\": {\"Book\": \"title\"}}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value("t-1"))
            .andExpect(jsonPath("$.fieldMappings.Book").value("title"));
    }

    @Test
    void invalidTemplate_mapsTo400() throws Exception {
        when(templateService.createTemplate(eq("alice"), eq("Broken"), isNull(), isNull(), isNull(), any()))
            .thenThrow(new InvalidFieldMappingException("Unknown mapping token 'titel'"));

        mockMvc.perform(post("/api/imports/alice/templates")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Broken\", \"fieldMappings\": {\"Book\": \"titel\"}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void unknownTemplate_mapsTo404() throws Exception {
        when(templateService.getTemplate("bob", "t-1")).thenThrow(new MappingTemplateNotFoundException("bob", "t-1"));

        mockMvc.perform(get("/api/imports/bob/templates/t-1"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("template_not_found"));
    }

    @Test
    void detect_returnsMatchOrNoContent() throws Exception {
        when(templateService.detectTemplate(eq("alice"), anyList()))
            .thenReturn(Optional.of(template("t-1", "alice")), Optional.empty());

        mockMvc.perform(post("/api/imports/alice/templates/detect")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[\"Book\", \"Writer\"]"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value("My Sheet"));
        mockMvc.perform(post("/api/imports/alice/templates/detect")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[\"Foo\"]"))
            .andExpect(status().isNoContent());
    }

    @Test
    void delete_isRefusedForTemplatesTheOwnerDoesNotOwn() throws Exception {
        when(templateService.deleteTemplate("alice", "t-1")).thenReturn(true);
        when(templateService.deleteTemplate("alice", "t-sys")).thenReturn(false);

        mockMvc.perform(delete("/api/imports/alice/templates/t-1")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/imports/alice/templates/t-sys")).andExpect(status().isNotFound());
    }
}
