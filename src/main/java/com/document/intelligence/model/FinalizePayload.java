package com.document.intelligence.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class FinalizePayload {

    String documentId;
    String applicationId;
    String templateId;
    double overallConfidence;
    List<ExtractedField> fields;
}
