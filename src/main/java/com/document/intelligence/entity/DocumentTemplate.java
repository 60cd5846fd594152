package com.document.intelligence.entity;

import com.document.intelligence.model.FieldDefinition;
import com.document.intelligence.model.StructuralSignature;
import com.document.intelligence.model.Template;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Local mirror of a template owned by the business system. Survives restarts
 * so the pipeline can keep matching while the business system is unreachable.
 */
@Entity
@Table(name = "document_templates",
        uniqueConstraints = @UniqueConstraint(columnNames = {"application_id", "template_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "application_id", nullable = false)
    private String applicationId;

    @Column(name = "template_id", nullable = false)
    private String templateId;

    @Column(name = "document_type")
    private String documentType;       // 'receipt', 'invoice'

    private String vendor;

    @Column(name = "format_name")
    private String formatName;

    private int version;

    @Convert(converter = SignatureConverter.class)
    @Column(name = "signature", columnDefinition = "CLOB")
    private StructuralSignature signature;

    @Convert(converter = FieldMapConverter.class)
    @Column(name = "field_map", columnDefinition = "CLOB")
    @Builder.Default
    private List<FieldDefinition> fieldMap = new ArrayList<>();

    @Column(name = "updated_at")
    private Instant updatedAt;         // as reported by the business system

    @Column(name = "synced_at")
    private Instant syncedAt;

    public Template toModel() {
        return Template.builder()
                .templateId(templateId)
                .applicationId(applicationId)
                .documentType(documentType)
                .vendor(vendor)
                .formatName(formatName)
                .version(version)
                .signature(signature)
                .fieldMap(fieldMap != null ? fieldMap : List.of())
                .build();
    }
}
