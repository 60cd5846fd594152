package com.document.intelligence.entity;

import com.document.intelligence.model.NormalizationParameters;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class NormalizationConverter extends JsonColumnConverter<NormalizationParameters> {

    public NormalizationConverter() {
        super(new TypeReference<NormalizationParameters>() {});
    }
}
