package com.document.intelligence.entity;

import com.document.intelligence.model.StructuralSignature;
import com.document.intelligence.model.VariantProposal;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "variant_proposals")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariantProposalRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "application_id", nullable = false)
    private String applicationId;

    @Column(name = "base_template_id", nullable = false)
    private String baseTemplateId;

    @Column(name = "proposed_label")
    private String proposedLabel;

    @Column(name = "document_id", length = 36)
    private String documentId;

    @Convert(converter = SignatureConverter.class)
    @Column(name = "observed_signature", columnDefinition = "CLOB")
    private StructuralSignature observedSignature;

    private double similarity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private VariantProposal.Status status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    public VariantProposal toModel() {
        return VariantProposal.builder()
                .id(id)
                .applicationId(applicationId)
                .baseTemplateId(baseTemplateId)
                .proposedLabel(proposedLabel)
                .documentId(documentId)
                .observedSignature(observedSignature)
                .similarity(similarity)
                .status(status)
                .createdAt(createdAt)
                .build();
    }
}
