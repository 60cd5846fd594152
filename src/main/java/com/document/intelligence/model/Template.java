package com.document.intelligence.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A known layout: the reference signature a document is matched against and
 * the field map used to read it once matched.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Template {

    String templateId;
    String applicationId;
    String documentType;               // 'receipt', 'invoice'
    String vendor;
    String formatName;                 // 'thermal_3x12'
    int version;

    StructuralSignature signature;     // null until computed

    @Singular("field")
    List<FieldDefinition> fieldMap;

    @JsonIgnore
    public String getLabel() {
        if (formatName != null) return vendor != null ? vendor + " / " + formatName : formatName;
        return vendor != null ? vendor : templateId;
    }

    @JsonIgnore
    public boolean hasSignature() {
        return signature != null;
    }
}
