package com.document.intelligence.service;

import com.document.intelligence.config.PipelineProperties;
import com.document.intelligence.entity.DocumentRecord;
import com.document.intelligence.entity.DocumentTransition;
import com.document.intelligence.exception.DocumentNotFoundException;
import com.document.intelligence.model.DocumentState;
import com.document.intelligence.model.EnqueueRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Entry point of the pipeline: takes documents in, hands each one to a
 * worker, and picks unfinished documents back up after a restart.
 */
@Service
@Slf4j
public class DocumentPipelineService {

    private final DocumentStateStore store;
    private final DocumentLifecycle lifecycle;
    private final ExecutorService workers;
    private final PipelineProperties.Lifecycle config;

    public DocumentPipelineService(DocumentStateStore store,
                                   DocumentLifecycle lifecycle,
                                   @Qualifier("documentWorkers") ExecutorService workers,
                                   PipelineProperties properties) {
        this.store = store;
        this.lifecycle = lifecycle;
        this.workers = workers;
        this.config = properties.getLifecycle();
    }

    /**
     * @throws IllegalArgumentException   if the path is missing or relative, or the application id is missing
     * @throws DocumentNotFoundException if no file exists at the path
     */
    public DocumentRecord enqueue(EnqueueRequest request) {
        if (request.getApplicationId() == null || request.getApplicationId().isBlank()) {
            throw new IllegalArgumentException("applicationId is required");
        }
        if (request.getPath() == null || request.getPath().isBlank()) {
            throw new IllegalArgumentException("path is required");
        }

        Path source;
        try {
            source = Path.of(request.getPath());
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid path: " + request.getPath());
        }
        if (!source.isAbsolute()) {
            throw new IllegalArgumentException("path must be absolute: " + request.getPath());
        }
        if (!Files.isRegularFile(source)) {
            throw new DocumentNotFoundException("No file at " + request.getPath());
        }

        DocumentRecord record = store.create(request);
        log.info("Enqueued document {} for application {} from {}",
                record.getId(), record.getApplicationId(), record.getSourcePath());
        submit(record.getId());
        return record;
    }

    public DocumentRecord status(String documentId) {
        return store.load(documentId);
    }

    public List<DocumentTransition> history(String documentId) {
        store.load(documentId);
        return store.history(documentId);
    }

    /**
     * Requests cancellation; the document moves to FAILED at its next
     * transition.
     *
     * @throws IllegalStateException if the document already finished
     */
    public DocumentRecord cancel(String documentId) {
        DocumentRecord record = store.load(documentId);
        if (record.getState().isTerminal()) {
            throw new IllegalStateException("Document " + documentId + " already finished as " + record.getState());
        }
        lifecycle.cancel(documentId);
        log.info("Cancellation requested for document {} in {}", documentId, record.getState());
        return record;
    }

    public List<DocumentRecord> reviewQueue(String applicationId) {
        return store.inState(DocumentState.REVIEW, applicationId);
    }

    public List<DocumentRecord> failed() {
        return store.inState(DocumentState.FAILED, null);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverInFlight() {
        if (!config.isRecoverOnStartup()) return;

        List<DocumentRecord> unfinished = store.inFlight();
        if (unfinished.isEmpty()) return;

        log.info("Resuming {} unfinished documents", unfinished.size());
        for (DocumentRecord record : unfinished) {
            log.info("Resuming document {} at {}", record.getId(), record.getState());
            submit(record.getId());
        }
    }

    void submit(String documentId) {
        workers.submit(() -> runSafely(documentId));
    }

    private void runSafely(String documentId) {
        try {
            DocumentState result = lifecycle.process(documentId);
            log.info("Document {} finished as {}", documentId, result);
        } catch (RuntimeException | Error e) {
            // the state store itself failed; the document stays in-flight for the next recovery
            log.error("Worker gave up on document {}", documentId, e);
        }
    }
}
