package com.document.intelligence.model;

/**
 * How a document's signature related to the template library.
 */
public enum MatchOutcome {
    AUTO_MATCH,          // at or above the auto-match threshold
    VARIANT_CANDIDATE,   // between partial and auto thresholds, probable format drift
    NO_MATCH,            // candidates existed but none scored well enough
    NO_TEMPLATES;        // nothing to match against at all

    public boolean proceedsToExtraction() {
        return this == AUTO_MATCH || this == VARIANT_CANDIDATE;
    }
}
