package com.document.intelligence.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One entry of a template's field map: where the value lives and how to read it.
 */
@Value
@Builder
@Jacksonized
public class FieldDefinition {

    String name;                        // 'total_amount', 'receipt_date', 'line_items'

    ZoneKind zone;

    @Builder.Default
    int zoneIndex = 0;                  // n-th zone of that kind, top to bottom

    RelativeBox region;                 // null = the whole zone

    @Builder.Default
    ValueType type = ValueType.TEXT;

    boolean required;

    boolean highStakes;

    Double minConfidence;               // null = pipeline default floor

    /**
     * Optional regexes tried in order against the recognized text; group 1 of
     * the first match becomes the raw value.
     */
    @Builder.Default
    List<String> patterns = List.of();
}
