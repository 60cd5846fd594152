package com.document.intelligence.entity;

import com.document.intelligence.model.ScoredCandidate;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class CandidatesConverter extends JsonColumnConverter<List<ScoredCandidate>> {

    public CandidatesConverter() {
        super(new TypeReference<List<ScoredCandidate>>() {});
    }
}
