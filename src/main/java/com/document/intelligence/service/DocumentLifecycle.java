package com.document.intelligence.service;

import com.document.intelligence.client.BusinessSystemClient;
import com.document.intelligence.entity.DocumentRecord;
import com.document.intelligence.exception.DocumentProcessingException;
import com.document.intelligence.model.ConfidenceLevel;
import com.document.intelligence.model.DocumentState;
import com.document.intelligence.model.ExtractedField;
import com.document.intelligence.model.FinalizePayload;
import com.document.intelligence.model.MatchOutcome;
import com.document.intelligence.model.MatchResult;
import com.document.intelligence.model.NormalizedImage;
import com.document.intelligence.model.Routing;
import com.document.intelligence.model.StructuralSignature;
import com.document.intelligence.model.Template;
import com.document.intelligence.model.ValidationResult;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives one document through
 * PENDING → PREPROCESSING → MATCHING → EXTRACTING → COMPLETED | REVIEW,
 * with FAILED reachable from every non-terminal state.
 *
 * <p>The stored state always names the stage that runs next. Each stage's
 * output is committed together with the move to the following state, so a
 * document picked up again after a crash starts at the stage that never
 * committed. MATCHING and EXTRACTING read the stored normalized image rather
 * than re-running preprocessing.
 *
 * <p>Stage work handed to the {@link StageRunner} only computes. Anything
 * with an effect outside the document (artifact writes, library updates,
 * the business-system commit) runs on the calling thread once the stage has
 * returned in time.
 */
@Service
@Slf4j
public class DocumentLifecycle {

    private final DocumentStateStore store;
    private final RasterImageLoader loader;
    private final ImageNormalizer normalizer;
    private final ArtifactStore artifacts;
    private final StructuralSignatureExtractor signatureExtractor;
    private final TemplateLibrary library;
    private final TemplateMatcher matcher;
    private final FieldExtractor fieldExtractor;
    private final ConfidenceValidator validator;
    private final BusinessSystemClient businessSystem;
    private final StageRunner stages;

    private final Set<String> cancelRequests = ConcurrentHashMap.newKeySet();

    public DocumentLifecycle(DocumentStateStore store,
                             RasterImageLoader loader,
                             ImageNormalizer normalizer,
                             ArtifactStore artifacts,
                             StructuralSignatureExtractor signatureExtractor,
                             TemplateLibrary library,
                             TemplateMatcher matcher,
                             FieldExtractor fieldExtractor,
                             ConfidenceValidator validator,
                             BusinessSystemClient businessSystem,
                             StageRunner stages) {
        this.store = store;
        this.loader = loader;
        this.normalizer = normalizer;
        this.artifacts = artifacts;
        this.signatureExtractor = signatureExtractor;
        this.library = library;
        this.matcher = matcher;
        this.fieldExtractor = fieldExtractor;
        this.validator = validator;
        this.businessSystem = businessSystem;
        this.stages = stages;
    }

    /**
     * Asks the lifecycle to stop the document at its next transition.
     */
    public void cancel(String documentId) {
        cancelRequests.add(documentId);
    }

    /**
     * Runs the document from its stored state until it reaches a terminal one.
     * Never throws for stage problems, errors such as running out of memory
     * included: they end in FAILED with the stage and detail recorded.
     */
    public DocumentState process(String documentId) {
        DocumentRecord record = store.load(documentId);
        try {
            while (!record.getState().isTerminal()) {
                DocumentState stage = record.getState();
                if (cancelRequests.remove(documentId)) {
                    record = store.fail(documentId, stage, "cancelled");
                    break;
                }
                try {
                    record = advance(record);
                } catch (RuntimeException | Error e) {
                    String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                    if (e instanceof DocumentProcessingException) {
                        log.error("Document {} failed in {}: {}", documentId, stage, detail);
                    } else {
                        log.error("Document {} failed in {}", documentId, stage, e);
                    }
                    record = store.fail(documentId, stage, detail);
                }
            }
        } finally {
            cancelRequests.remove(documentId);
        }
        return record.getState();
    }

    private DocumentRecord advance(DocumentRecord record) {
        return switch (record.getState()) {
            case PENDING       -> store.transition(record.getId(), DocumentState.PREPROCESSING, null);
            case PREPROCESSING -> preprocess(record);
            case MATCHING      -> match(record);
            case EXTRACTING    -> extract(record);
            default            -> throw new IllegalStateException("Nothing to run for " + record.getState());
        };
    }

    // ─── PREPROCESSING ─────────────────────────────────────────────────

    private DocumentRecord preprocess(DocumentRecord record) {
        String id = record.getId();
        NormalizedImage normalized = stages.run(DocumentState.PREPROCESSING,
                () -> normalizer.normalize(loader.load(Path.of(record.getSourcePath()))));
        Path artifact = artifacts.saveNormalized(id, normalized.getImage());

        return store.transition(id, DocumentState.MATCHING, "normalized", r -> {
            r.setNormalizedImagePath(artifact.toString());
            r.setNormalization(normalized.getParameters());
        });
    }

    // ─── MATCHING ──────────────────────────────────────────────────────

    private DocumentRecord match(DocumentRecord record) {
        String id = record.getId();
        String applicationId = record.getApplicationId();

        Matched matched = stages.run(DocumentState.MATCHING, () -> {
            StructuralSignature signature = signatureExtractor.extract(
                    artifacts.loadNormalized(record.getNormalizedImagePath(), DocumentState.MATCHING));
            return new Matched(signature, matcher.match(signature, library.candidates(applicationId)));
        });

        // side effects run here, never on a stage thread that may have been abandoned
        MatchResult result = matched.getResult();
        if (result.getOutcome() == MatchOutcome.NO_TEMPLATES) {
            library.refresh(applicationId);
        } else if (result.getOutcome() == MatchOutcome.VARIANT_CANDIDATE) {
            library.proposeVariant(result.getBestTemplate(), matched.getSignature(), result.getScore(), id);
        }
        log.info("Document {} matched {} ({}, score {})", id,
                result.getBestTemplate() != null ? result.getBestTemplate().getTemplateId() : "-",
                result.getOutcome(), String.format(Locale.ROOT, "%.3f", result.getScore()));

        return switch (result.getOutcome()) {
            case AUTO_MATCH, VARIANT_CANDIDATE -> store.transition(id, DocumentState.EXTRACTING,
                    result.getOutcome().name().toLowerCase(Locale.ROOT), r -> {
                        r.setSignature(matched.getSignature());
                        r.setMatchOutcome(result.getOutcome());
                        r.setMatchScore(result.getScore());
                        r.setTemplateId(result.getBestTemplate().getTemplateId());
                        r.setCandidates(result.getRanked());
                    });
            case NO_MATCH -> toReviewWithoutExtraction(id, matched,
                    String.format(Locale.ROOT, "no template matched (best score %.3f)", result.getScore()));
            case NO_TEMPLATES -> toReviewWithoutExtraction(id, matched, "no templates available");
        };
    }

    private DocumentRecord toReviewWithoutExtraction(String id, Matched matched, String reason) {
        MatchResult result = matched.getResult();
        ValidationResult validation = ValidationResult.builder()
                .valid(false)
                .routing(Routing.REVIEW)
                .reviewReason(reason)
                .build();
        return store.transition(id, DocumentState.REVIEW, reason, r -> {
            r.setSignature(matched.getSignature());
            r.setMatchOutcome(result.getOutcome());
            r.setMatchScore(result.getScore());
            r.setCandidates(result.getSuggestions());
            r.setValidation(validation);
            r.setReviewRequired(true);
        });
    }

    // ─── EXTRACTING ────────────────────────────────────────────────────

    private DocumentRecord extract(DocumentRecord record) {
        String id = record.getId();

        Extracted extracted = stages.run(DocumentState.EXTRACTING, () -> {
            Template template = library.find(record.getApplicationId(), record.getTemplateId())
                    .orElseThrow(() -> new DocumentProcessingException(DocumentState.EXTRACTING,
                            "Template " + record.getTemplateId() + " is no longer available"));
            NormalizedImage image = new NormalizedImage(
                    artifacts.loadNormalized(record.getNormalizedImagePath(), DocumentState.EXTRACTING),
                    record.getNormalization());

            List<ExtractedField> fields = fieldExtractor.extract(image, template, record.getSignature());
            ValidationResult validation = validator.validate(fields, template);
            if (record.getMatchOutcome() == MatchOutcome.VARIANT_CANDIDATE) {
                validation = validation.requireReview("layout differs from template " + template.getTemplateId());
            }
            double matchScore = record.getMatchScore() != null ? record.getMatchScore() : 0.0;
            double overall = validator.overallConfidence(fields, template, matchScore, validation);
            return new Extracted(template, fields, validation, overall, validator.level(overall));
        });

        boolean commit = extracted.getValidation().getRouting() == Routing.AUTO_COMMIT;
        if (commit) {
            businessSystem.finalizeDocument(FinalizePayload.builder()
                    .documentId(id)
                    .applicationId(record.getApplicationId())
                    .templateId(extracted.getTemplate().getTemplateId())
                    .overallConfidence(extracted.getOverall())
                    .fields(extracted.getFields())
                    .build());
        }
        DocumentState next = commit ? DocumentState.COMPLETED : DocumentState.REVIEW;
        String detail = commit ? "auto-committed" : String.join("; ", extracted.getValidation().getReviewReasons());
        return store.transition(id, next, detail, r -> {
            r.setFields(extracted.getFields());
            r.setValidation(extracted.getValidation());
            r.setOverallConfidence(extracted.getOverall());
            r.setConfidenceLevel(extracted.getLevel());
            r.setReviewRequired(!commit);
        });
    }

    @Value
    private static class Matched {
        StructuralSignature signature;
        MatchResult result;
    }

    @Value
    private static class Extracted {
        Template template;
        List<ExtractedField> fields;
        ValidationResult validation;
        double overall;
        ConfidenceLevel level;
    }
}
