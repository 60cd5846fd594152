package com.document.intelligence.model;

import com.document.intelligence.entity.DocumentRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * What operators and reviewers see of a document. Error details are the
 * recorded message only, never a stack trace.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentView {

    String documentId;
    String applicationId;
    String sourcePath;
    String originalFilename;
    DocumentState state;

    MatchOutcome matchOutcome;
    Double matchScore;
    String templateId;
    List<ScoredCandidate> suggestions;

    List<ExtractedField> fields;
    Double overallConfidence;
    ConfidenceLevel confidenceLevel;
    boolean reviewRequired;
    List<String> reviewReasons;
    List<String> missingFields;
    List<String> lowConfidenceFields;
    List<String> warnings;

    DocumentState errorStage;
    String errorDetail;

    Instant createdAt;
    Instant updatedAt;

    public static DocumentView from(DocumentRecord record) {
        ValidationResult validation = record.getValidation();
        return DocumentView.builder()
                .documentId(record.getId())
                .applicationId(record.getApplicationId())
                .sourcePath(record.getSourcePath())
                .originalFilename(record.getMetadata() != null ? record.getMetadata().getOriginalFilename() : null)
                .state(record.getState())
                .matchOutcome(record.getMatchOutcome())
                .matchScore(record.getMatchScore())
                .templateId(record.getTemplateId())
                .suggestions(record.getCandidates())
                .fields(record.getFields())
                .overallConfidence(record.getOverallConfidence())
                .confidenceLevel(record.getConfidenceLevel())
                .reviewRequired(record.isReviewRequired())
                .reviewReasons(validation != null ? validation.getReviewReasons() : null)
                .missingFields(validation != null ? validation.getMissingFields() : null)
                .lowConfidenceFields(validation != null ? validation.getLowConfidenceFields() : null)
                .warnings(validation != null ? validation.getWarnings() : null)
                .errorStage(record.getErrorStage())
                .errorDetail(record.getErrorDetail())
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .build();
    }
}
