package com.document.intelligence.entity;

import com.document.intelligence.model.ExtractedField;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class ExtractedFieldsConverter extends JsonColumnConverter<List<ExtractedField>> {

    public ExtractedFieldsConverter() {
        super(new TypeReference<List<ExtractedField>>() {});
    }
}
