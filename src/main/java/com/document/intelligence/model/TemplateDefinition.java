package com.document.intelligence.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Wire shape of a template as the business system sends it, both on pull and
 * on push.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TemplateDefinition {

    @JsonProperty("template_id")
    private String templateId;

    @JsonProperty("document_type")
    private String documentType;

    private String vendor;

    @JsonProperty("format_name")
    private String formatName;

    private int version;

    @JsonProperty("structural_signature")
    private StructuralSignature signature;

    @JsonProperty("field_map")
    @Builder.Default
    private List<FieldDefinition> fieldMap = new ArrayList<>();

    @JsonProperty("updated_at")
    private Instant updatedAt;
}
