package com.document.intelligence.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class MatchResult {

    MatchOutcome outcome;
    Template bestTemplate;             // null for NO_MATCH / NO_TEMPLATES
    double score;

    // every candidate, best first
    List<ScoredCandidate> ranked;

    // the first N of ranked, surfaced to reviewers
    List<ScoredCandidate> suggestions;

    public static MatchResult noTemplates() {
        return MatchResult.builder()
                .outcome(MatchOutcome.NO_TEMPLATES)
                .score(0.0)
                .ranked(List.of())
                .suggestions(List.of())
                .build();
    }
}
