package com.document.intelligence.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DocumentState Tests")
class DocumentStateTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "PENDING       | PREPROCESSING | true",
            "PENDING       | MATCHING      | false",
            "PREPROCESSING | MATCHING      | true",
            "PREPROCESSING | EXTRACTING    | false",
            "MATCHING      | EXTRACTING    | true",
            "MATCHING      | REVIEW        | true",
            "MATCHING      | COMPLETED     | false",
            "EXTRACTING    | COMPLETED     | true",
            "EXTRACTING    | REVIEW        | true",
            "EXTRACTING    | MATCHING      | false",
            "PENDING       | FAILED        | true",
            "EXTRACTING    | FAILED        | true"
    })
    @DisplayName("Should only allow forward moves along the pipeline")
    void shouldAllowForwardMoves(DocumentState from, DocumentState to, boolean allowed) {
        assertThat(from.canMoveTo(to)).isEqualTo(allowed);
    }

    @ParameterizedTest
    @EnumSource(value = DocumentState.class, names = {"REVIEW", "COMPLETED", "FAILED"})
    @DisplayName("Should never leave a terminal state")
    void shouldNeverLeaveTerminalState(DocumentState terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (DocumentState next : DocumentState.values()) {
            assertThat(terminal.canMoveTo(next)).isFalse();
        }
    }

    @Test
    @DisplayName("Should treat the four working states as in flight")
    void shouldListInFlightStates() {
        assertThat(DocumentState.IN_FLIGHT).containsExactlyInAnyOrder(
                DocumentState.PENDING, DocumentState.PREPROCESSING, DocumentState.MATCHING, DocumentState.EXTRACTING);
    }
}
