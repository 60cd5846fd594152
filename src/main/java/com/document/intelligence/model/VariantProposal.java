package com.document.intelligence.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A suspected drifted version of an existing template, waiting on a human to
 * approve it upstream.
 */
@Value
@Builder
@Jacksonized
public class VariantProposal {

    public enum Status { PENDING, SUBMITTED }

    Long id;
    String applicationId;
    String baseTemplateId;
    String proposedLabel;
    String documentId;
    StructuralSignature observedSignature;
    double similarity;
    Status status;
    Instant createdAt;
}
