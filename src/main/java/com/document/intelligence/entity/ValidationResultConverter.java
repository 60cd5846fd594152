package com.document.intelligence.entity;

import com.document.intelligence.model.ValidationResult;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class ValidationResultConverter extends JsonColumnConverter<ValidationResult> {

    public ValidationResultConverter() {
        super(new TypeReference<ValidationResult>() {});
    }
}
