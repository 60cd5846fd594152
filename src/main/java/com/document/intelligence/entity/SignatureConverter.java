package com.document.intelligence.entity;

import com.document.intelligence.model.StructuralSignature;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class SignatureConverter extends JsonColumnConverter<StructuralSignature> {

    public SignatureConverter() {
        super(new TypeReference<StructuralSignature>() {});
    }
}
