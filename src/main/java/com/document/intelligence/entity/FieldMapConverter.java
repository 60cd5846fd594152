package com.document.intelligence.entity;

import com.document.intelligence.model.FieldDefinition;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class FieldMapConverter extends JsonColumnConverter<List<FieldDefinition>> {

    public FieldMapConverter() {
        super(new TypeReference<List<FieldDefinition>>() {});
    }

    @Override
    public List<FieldDefinition> convertToEntityAttribute(String json) {
        List<FieldDefinition> fields = super.convertToEntityAttribute(json);
        return fields != null ? fields : List.of();
    }
}
