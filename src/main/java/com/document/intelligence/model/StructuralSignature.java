package com.document.intelligence.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

/**
 * Resolution-independent description of a page layout: its zones, top to
 * bottom, and how much of the page they cover.
 */
@Value
@Builder
@Jacksonized
public class StructuralSignature {

    @Singular
    List<Zone> zones;

    double totalContentRatio;

    public static StructuralSignature empty() {
        return StructuralSignature.builder().totalContentRatio(0.0).build();
    }

    @JsonIgnore
    public int getZoneCount() {
        return zones.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return zones.isEmpty();
    }

    public List<Zone> zonesOf(ZoneKind kind) {
        return zones.stream().filter(z -> z.getKind() == kind).toList();
    }

    /** The index-th zone of the given kind, in top-to-bottom order. */
    public Optional<Zone> zone(ZoneKind kind, int index) {
        List<Zone> ofKind = zonesOf(kind);
        return index >= 0 && index < ofKind.size() ? Optional.of(ofKind.get(index)) : Optional.empty();
    }
}
