package com.document.intelligence.entity;

import com.document.intelligence.model.EnqueueRequest;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class MetadataConverter extends JsonColumnConverter<EnqueueRequest.Metadata> {

    public MetadataConverter() {
        super(new TypeReference<EnqueueRequest.Metadata>() {});
    }
}
