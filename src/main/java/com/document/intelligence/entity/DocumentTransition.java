package com.document.intelligence.entity;

import com.document.intelligence.model.DocumentState;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "document_transitions", indexes = @Index(name = "idx_transitions_document", columnList = "document_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentTransition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "document_id", nullable = false, length = 36)
    private String documentId;

    // null for the initial PENDING entry
    @Enumerated(EnumType.STRING)
    @Column(name = "from_state", length = 20)
    private DocumentState fromState;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_state", nullable = false, length = 20)
    private DocumentState toState;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(length = 2000)
    private String detail;
}
