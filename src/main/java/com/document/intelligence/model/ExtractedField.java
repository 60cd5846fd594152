package com.document.intelligence.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ExtractedField {

    String name;
    String rawValue;       // what the recognizer (and pattern) produced
    String value;          // normalized by the field's value type, null if unreadable
    double confidence;
    ZoneKind sourceZone;

    public static ExtractedField unreadable(FieldDefinition def) {
        return ExtractedField.builder()
                .name(def.getName())
                .confidence(0.0)
                .sourceZone(def.getZone())
                .build();
    }
}
