package com.document.intelligence.entity;

import com.document.intelligence.model.ConfidenceLevel;
import com.document.intelligence.model.DocumentState;
import com.document.intelligence.model.EnqueueRequest;
import com.document.intelligence.model.ExtractedField;
import com.document.intelligence.model.MatchOutcome;
import com.document.intelligence.model.NormalizationParameters;
import com.document.intelligence.model.ScoredCandidate;
import com.document.intelligence.model.StructuralSignature;
import com.document.intelligence.model.ValidationResult;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.List;

/**
 * One ingested document and everything the pipeline learned about it. The
 * state column names the stage that runs next, so a restarted worker can
 * resume from it.
 */
@Entity
@Table(name = "documents", indexes = {
        @Index(name = "idx_documents_state", columnList = "state"),
        @Index(name = "idx_documents_app_state", columnList = "application_id, state")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentRecord {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "application_id", nullable = false)
    private String applicationId;

    @Column(name = "source_path", nullable = false, length = 1024)
    private String sourcePath;

    @Convert(converter = MetadataConverter.class)
    @Column(columnDefinition = "CLOB")
    private EnqueueRequest.Metadata metadata;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DocumentState state;

    // set only when state = FAILED
    @Enumerated(EnumType.STRING)
    @Column(name = "error_stage", length = 20)
    private DocumentState errorStage;

    @Column(name = "error_detail", length = 2000)
    private String errorDetail;

    // ─── preprocessing ───

    @Column(name = "normalized_image_path", length = 1024)
    private String normalizedImagePath;

    @Convert(converter = NormalizationConverter.class)
    @Column(columnDefinition = "CLOB")
    private NormalizationParameters normalization;

    // ─── matching ───

    @Convert(converter = SignatureConverter.class)
    @Column(columnDefinition = "CLOB")
    private StructuralSignature signature;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_outcome", length = 20)
    private MatchOutcome matchOutcome;

    @Column(name = "match_score")
    private Double matchScore;

    @Column(name = "template_id")
    private String templateId;

    @Convert(converter = CandidatesConverter.class)
    @Column(columnDefinition = "CLOB")
    private List<ScoredCandidate> candidates;

    // ─── extraction ───

    @Convert(converter = ExtractedFieldsConverter.class)
    @Column(columnDefinition = "CLOB")
    private List<ExtractedField> fields;

    @Convert(converter = ValidationResultConverter.class)
    @Column(columnDefinition = "CLOB")
    private ValidationResult validation;

    @Column(name = "overall_confidence")
    private Double overallConfidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "confidence_level", length = 10)
    private ConfidenceLevel confidenceLevel;

    @Column(name = "review_required")
    private boolean reviewRequired;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;
}
