package com.document.intelligence.controller;

import com.document.intelligence.exception.DocumentNotFoundException;
import com.document.intelligence.model.DocumentView;
import com.document.intelligence.model.EnqueueRequest;
import com.document.intelligence.model.ErrorResponse;
import com.document.intelligence.service.DocumentPipelineService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/documents")
@Slf4j
public class DocumentController {

    private final DocumentPipelineService pipelineService;

    public DocumentController(DocumentPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    /**
     * Hand-off from the file watcher. Processing happens in the background;
     * poll the returned id for the outcome.
     */
    @PostMapping
    public ResponseEntity<?> enqueue(@RequestBody EnqueueRequest request) {
        try {
            DocumentView view = DocumentView.from(pipelineService.enqueue(request));
            return ResponseEntity.accepted().body(view);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
        } catch (DocumentNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(e.getMessage()));
        } catch (Exception e) {
            log.error("Enqueue failed for {}", request.getPath(), e);
            return ResponseEntity.internalServerError().body(ErrorResponse.of(e.getMessage()));
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> status(@PathVariable("id") String id) {
        try {
            return ResponseEntity.ok(DocumentView.from(pipelineService.status(id)));
        } catch (DocumentNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(e.getMessage()));
        }
    }

    @GetMapping("/{id}/transitions")
    public ResponseEntity<?> transitions(@PathVariable("id") String id) {
        try {
            return ResponseEntity.ok(pipelineService.history(id));
        } catch (DocumentNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(e.getMessage()));
        }
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<?> cancel(@PathVariable("id") String id) {
        try {
            return ResponseEntity.accepted().body(DocumentView.from(pipelineService.cancel(id)));
        } catch (DocumentNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of(e.getMessage()));
        }
    }

    /** Documents waiting for a human, with suggestions and per-field confidence. */
    @GetMapping("/review")
    public List<DocumentView> reviewQueue(@RequestParam(value = "applicationId", required = false) String applicationId) {
        return pipelineService.reviewQueue(applicationId).stream().map(DocumentView::from).toList();
    }

    /** Failed documents with the stage and reason, for operators. */
    @GetMapping("/failed")
    public List<DocumentView> failed() {
        return pipelineService.failed().stream().map(DocumentView::from).toList();
    }
}
