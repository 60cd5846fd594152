package com.document.intelligence.controller;

import com.document.intelligence.model.ErrorResponse;
import com.document.intelligence.model.Template;
import com.document.intelligence.model.TemplateDefinition;
import com.document.intelligence.model.VariantProposal;
import com.document.intelligence.service.TemplateLibrary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/templates")
@Slf4j
public class TemplateController {

    private final TemplateLibrary library;

    public TemplateController(TemplateLibrary library) {
        this.library = library;
    }

    /**
     * Push from the business system when it creates or changes a template.
     */
    @PostMapping
    public ResponseEntity<?> upsert(@RequestParam("applicationId") String applicationId,
                                    @RequestBody TemplateDefinition definition) {
        if (definition.getTemplateId() == null || definition.getTemplateId().isBlank()) {
            return ResponseEntity.badRequest().body(ErrorResponse.of("template_id is required"));
        }
        try {
            return ResponseEntity.ok(library.upsert(applicationId, definition));
        } catch (Exception e) {
            log.error("Template upsert failed for {}", definition.getTemplateId(), e);
            return ResponseEntity.internalServerError().body(ErrorResponse.of(e.getMessage()));
        }
    }

    @PostMapping("/sync")
    public List<Template> sync(@RequestParam("applicationId") String applicationId) {
        return library.refresh(applicationId);
    }

    @GetMapping
    public List<Template> list(@RequestParam("applicationId") String applicationId) {
        return library.templates(applicationId);
    }

    @GetMapping("/proposals")
    public List<VariantProposal> proposals(@RequestParam("applicationId") String applicationId) {
        return library.proposals(applicationId);
    }
}
