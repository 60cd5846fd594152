package com.document.intelligence.service;

import com.document.intelligence.entity.DocumentRecord;
import com.document.intelligence.entity.DocumentTransition;
import com.document.intelligence.exception.DocumentNotFoundException;
import com.document.intelligence.model.DocumentState;
import com.document.intelligence.model.EnqueueRequest;
import com.document.intelligence.repository.DocumentRecordRepository;
import com.document.intelligence.repository.DocumentTransitionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * The only writer of document rows. Every state change is saved together
 * with its transition event in one transaction.
 */
@Service
@Slf4j
public class DocumentStateStore {

    private final DocumentRecordRepository documentRepo;
    private final DocumentTransitionRepository transitionRepo;
    private final Clock clock;

    public DocumentStateStore(DocumentRecordRepository documentRepo,
                              DocumentTransitionRepository transitionRepo,
                              Clock clock) {
        this.documentRepo = documentRepo;
        this.transitionRepo = transitionRepo;
        this.clock = clock;
    }

    @Transactional
    public DocumentRecord create(EnqueueRequest request) {
        Instant now = clock.instant();
        DocumentRecord record = documentRepo.save(DocumentRecord.builder()
                .id(UUID.randomUUID().toString())
                .applicationId(request.getApplicationId())
                .sourcePath(request.getPath())
                .metadata(request.getMetadata())
                .state(DocumentState.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build());
        transitionRepo.save(DocumentTransition.builder()
                .documentId(record.getId())
                .toState(DocumentState.PENDING)
                .occurredAt(now)
                .detail("enqueued from " + request.getPath())
                .build());
        return record;
    }

    @Transactional(readOnly = true)
    public DocumentRecord load(String documentId) {
        return documentRepo.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException("Unknown document: " + documentId));
    }

    /**
     * Applies {@code changes} to the stored record and moves it to {@code next}.
     *
     * @throws IllegalStateException if the record's current state cannot move to {@code next}
     */
    @Transactional
    public DocumentRecord transition(String documentId, DocumentState next, String detail,
                                     Consumer<DocumentRecord> changes) {
        DocumentRecord record = load(documentId);
        DocumentState previous = record.getState();
        if (!previous.canMoveTo(next)) {
            throw new IllegalStateException("Document " + documentId + " cannot move from " + previous + " to " + next);
        }

        changes.accept(record);
        Instant now = clock.instant();
        record.setState(next);
        record.setUpdatedAt(now);
        DocumentRecord saved = documentRepo.save(record);

        transitionRepo.save(DocumentTransition.builder()
                .documentId(documentId)
                .fromState(previous)
                .toState(next)
                .occurredAt(now)
                .detail(truncate(detail))
                .build());
        log.info("Document {}: {} -> {}{}", documentId, previous, next, detail != null ? " (" + detail + ")" : "");
        return saved;
    }

    @Transactional
    public DocumentRecord transition(String documentId, DocumentState next, String detail) {
        return transition(documentId, next, detail, record -> { });
    }

    @Transactional
    public DocumentRecord fail(String documentId, DocumentState stage, String detail) {
        return transition(documentId, DocumentState.FAILED, detail, record -> {
            record.setErrorStage(stage);
            record.setErrorDetail(truncate(detail));
        });
    }

    @Transactional(readOnly = true)
    public List<DocumentRecord> inFlight() {
        return documentRepo.findByStateInOrderByCreatedAtAsc(DocumentState.IN_FLIGHT);
    }

    @Transactional(readOnly = true)
    public List<DocumentRecord> inState(DocumentState state, String applicationId) {
        return applicationId == null
                ? documentRepo.findByStateOrderByUpdatedAtDesc(state)
                : documentRepo.findByApplicationIdAndStateOrderByUpdatedAtDesc(applicationId, state);
    }

    @Transactional(readOnly = true)
    public List<DocumentTransition> history(String documentId) {
        return transitionRepo.findByDocumentIdOrderByIdAsc(documentId);
    }

    private static String truncate(String detail) {
        if (detail == null) return null;
        return detail.length() <= 2000 ? detail : detail.substring(0, 2000);
    }
}
