package com.document.intelligence.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ValidationResult {

    boolean valid;

    @Singular
    List<String> missingFields;

    @Singular
    List<String> lowConfidenceFields;

    // high-stakes fields under the strict floor, each one forces review
    @Singular
    List<String> highStakesIssues;

    @Singular
    List<String> warnings;

    @Singular
    List<String> reviewReasons;

    Routing routing;

    /**
     * Same result, routed to review regardless of field quality.
     */
    public ValidationResult requireReview(String reason) {
        List<String> reasons = new ArrayList<>(reviewReasons);
        reasons.add(reason);
        return toBuilder()
                .clearReviewReasons()
                .reviewReasons(reasons)
                .routing(Routing.REVIEW)
                .build();
    }
}
