package com.document.intelligence.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ScoredCandidate {

    String templateId;
    String label;
    double score;
}
