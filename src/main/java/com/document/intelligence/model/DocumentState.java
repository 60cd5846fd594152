package com.document.intelligence.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one document. A persisted non-terminal state names the stage
 * that runs next.
 */
public enum DocumentState {
    PENDING,
    PREPROCESSING,
    MATCHING,
    EXTRACTING,
    REVIEW,
    COMPLETED,
    FAILED;

    public static final Set<DocumentState> IN_FLIGHT = EnumSet.of(PENDING, PREPROCESSING, MATCHING, EXTRACTING);

    public boolean isTerminal() {
        return !IN_FLIGHT.contains(this);
    }

    public boolean canMoveTo(DocumentState next) {
        if (isTerminal()) return false;
        if (next == FAILED) return true;
        return switch (this) {
            case PENDING       -> next == PREPROCESSING;
            case PREPROCESSING -> next == MATCHING;
            case MATCHING      -> next == EXTRACTING || next == REVIEW;
            case EXTRACTING    -> next == COMPLETED || next == REVIEW;
            default            -> false;
        };
    }
}
