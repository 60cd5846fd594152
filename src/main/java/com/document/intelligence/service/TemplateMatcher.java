package com.document.intelligence.service;

import com.document.intelligence.config.PipelineProperties;
import com.document.intelligence.model.MatchOutcome;
import com.document.intelligence.model.MatchResult;
import com.document.intelligence.model.ScoredCandidate;
import com.document.intelligence.model.StructuralSignature;
import com.document.intelligence.model.Template;
import com.document.intelligence.model.Zone;
import com.document.intelligence.model.ZoneKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores a document's signature against every candidate template and bands
 * the best score into an outcome. A pure function of its inputs: same
 * signature and same candidates in the same order give the same result.
 */
@Service
@Slf4j
public class TemplateMatcher {

    private final PipelineProperties.Matching config;

    public TemplateMatcher(PipelineProperties properties) {
        this.config = properties.getMatching();
    }

    public MatchResult match(StructuralSignature observed, List<Template> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return MatchResult.noTemplates();
        }

        List<Scored> scored = new ArrayList<>(candidates.size());
        for (Template candidate : candidates) {
            double score = score(observed, candidate.getSignature());
            log.debug("Candidate {} ({}) scored {}", candidate.getTemplateId(), candidate.getLabel(), score);
            scored.add(new Scored(candidate, score));
        }
        // List.sort is stable: equal scores keep candidate order
        scored.sort(Comparator.comparingDouble((Scored s) -> s.score).reversed());

        List<ScoredCandidate> ranked = scored.stream()
                .map(s -> ScoredCandidate.builder()
                        .templateId(s.template.getTemplateId())
                        .label(s.template.getLabel())
                        .score(s.score)
                        .build())
                .toList();
        List<ScoredCandidate> suggestions = ranked.subList(0, Math.min(config.getSuggestionCount(), ranked.size()));

        Scored best = scored.get(0);
        MatchOutcome outcome = band(best.score);
        return MatchResult.builder()
                .outcome(outcome)
                .bestTemplate(outcome.proceedsToExtraction() ? best.template : null)
                .score(best.score)
                .ranked(ranked)
                .suggestions(List.copyOf(suggestions))
                .build();
    }

    MatchOutcome band(double score) {
        if (score >= config.getAutoMatchThreshold()) return MatchOutcome.AUTO_MATCH;
        if (score >= config.getPartialMatchThreshold()) return MatchOutcome.VARIANT_CANDIDATE;
        return MatchOutcome.NO_MATCH;
    }

    /**
     * Weighted similarity in [0, 1]: zone count, content coverage and the
     * per-zone layout. Two empty signatures are identical; an empty and a
     * non-empty one share nothing.
     */
    public double score(StructuralSignature observed, StructuralSignature reference) {
        if (observed == null || reference == null) return 0.0;
        if (observed.isEmpty() && reference.isEmpty()) return 1.0;
        if (observed.isEmpty() || reference.isEmpty()) return 0.0;

        int a = observed.getZoneCount();
        int b = reference.getZoneCount();
        double countSimilarity = 1.0 - Math.abs(a - b) / (double) Math.max(a, b);
        double contentSimilarity = 1.0 - Math.min(1.0,
                Math.abs(observed.getTotalContentRatio() - reference.getTotalContentRatio()));
        double layoutSimilarity = zoneSimilarity(observed, reference);

        double score = config.getZoneCountWeight() * countSimilarity
                + config.getContentRatioWeight() * contentSimilarity
                + config.getZoneLayoutWeight() * layoutSimilarity;
        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * Pairs zones of the same kind greedily, closest first, each pair scoring
     * exp(-2d). Unpaired zones score nothing; the sum is divided by the larger
     * zone count so extra or missing zones cost similarity.
     */
    static double zoneSimilarity(StructuralSignature observed, StructuralSignature reference) {
        double total = 0.0;
        for (ZoneKind kind : ZoneKind.values()) {
            List<Zone> left = observed.zonesOf(kind);
            List<Zone> right = reference.zonesOf(kind);
            if (left.isEmpty() || right.isEmpty()) continue;

            List<double[]> pairs = new ArrayList<>();
            for (int i = 0; i < left.size(); i++) {
                for (int j = 0; j < right.size(); j++) {
                    pairs.add(new double[]{left.get(i).distanceTo(right.get(j)), i, j});
                }
            }
            pairs.sort(Comparator.comparingDouble(p -> p[0]));

            boolean[] leftUsed = new boolean[left.size()];
            boolean[] rightUsed = new boolean[right.size()];
            for (double[] pair : pairs) {
                int i = (int) pair[1];
                int j = (int) pair[2];
                if (leftUsed[i] || rightUsed[j]) continue;
                leftUsed[i] = true;
                rightUsed[j] = true;
                total += Math.exp(-2.0 * pair[0]);
            }
        }
        return total / Math.max(observed.getZoneCount(), reference.getZoneCount());
    }

    private static final class Scored {
        final Template template;
        final double score;

        Scored(Template template, double score) {
            this.template = template;
            this.score = score;
        }
    }
}
