package com.document.intelligence.service;

import com.document.intelligence.client.TextRecognizer;
import com.document.intelligence.config.PipelineProperties;
import com.document.intelligence.model.ExtractedField;
import com.document.intelligence.model.FieldDefinition;
import com.document.intelligence.model.NormalizedImage;
import com.document.intelligence.model.Recognition;
import com.document.intelligence.model.RelativeBox;
import com.document.intelligence.model.StructuralSignature;
import com.document.intelligence.model.Template;
import com.document.intelligence.model.Zone;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads a matched document field by field. Each field definition points at a
 * zone of the template's reference layout; that area of the normalized page
 * is cropped, recognized and parsed by the field's value type.
 * No per-vendor code: everything comes from the template's field map.
 */
@Service
@Slf4j
public class FieldExtractor {

    private final TextRecognizer recognizer;
    private final FieldValueParser parser;
    private final PipelineProperties.Extraction config;

    private final Map<String, Optional<Pattern>> patternCache = new ConcurrentHashMap<>();

    public FieldExtractor(TextRecognizer recognizer, FieldValueParser parser, PipelineProperties properties) {
        this.recognizer = recognizer;
        this.parser = parser;
        this.config = properties.getExtraction();
    }

    public List<ExtractedField> extract(NormalizedImage image, Template template) {
        return extract(image, template, null);
    }

    /**
     * @param observed the document's own signature; when given, a field read
     *                 from a zone that drifted away from the template's
     *                 position has its confidence discounted
     */
    public List<ExtractedField> extract(NormalizedImage image, Template template, StructuralSignature observed) {
        List<ExtractedField> fields = new ArrayList<>();
        for (FieldDefinition def : template.getFieldMap()) {
            fields.add(extractField(image.getImage(), template, def, observed));
        }
        log.debug("Extracted {} fields with template {}", fields.size(), template.getTemplateId());
        return fields;
    }

    private ExtractedField extractField(BufferedImage page, Template template, FieldDefinition def,
                                        StructuralSignature observed) {
        Optional<Zone> zone = template.hasSignature()
                ? template.getSignature().zone(def.getZone(), def.getZoneIndex())
                : Optional.empty();
        if (zone.isEmpty()) {
            log.debug("Template {} has no {} zone #{} for field '{}'",
                    template.getTemplateId(), def.getZone(), def.getZoneIndex(), def.getName());
            return ExtractedField.unreadable(def);
        }

        BufferedImage region = cropRegion(page, zone.get(), def.getRegion() != null ? def.getRegion() : RelativeBox.whole());
        if (region == null) return ExtractedField.unreadable(def);

        Recognition recognition = recognizer.recognize(region);
        if (recognition.getText() == null || recognition.getText().isBlank()) {
            return ExtractedField.unreadable(def);
        }

        String raw = applyPatterns(recognition.getText(), def);
        Optional<String> value = parser.parse(raw, def.getType());

        double confidence = recognition.getConfidence()
                * driftFactor(zone.get(), observed)
                * (value.isPresent() ? 1.0 : config.getUnparseableFactor());

        return ExtractedField.builder()
                .name(def.getName())
                .rawValue(raw)
                .value(value.orElse(null))
                .confidence(Math.max(0.0, Math.min(1.0, confidence)))
                .sourceZone(def.getZone())
                .build();
    }

    /**
     * Crops the sub-box of a zone, both in ratio space, out of the page.
     * Null when the resulting rectangle is empty.
     */
    static BufferedImage cropRegion(BufferedImage page, Zone zone, RelativeBox box) {
        int w = page.getWidth();
        int h = page.getHeight();
        double rx = zone.getX() + box.getX() * zone.getWidth();
        double ry = zone.getY() + box.getY() * zone.getHeight();
        double rw = box.getWidth() * zone.getWidth();
        double rh = box.getHeight() * zone.getHeight();

        int x0 = clamp((int) Math.floor(rx * w), 0, w);
        int y0 = clamp((int) Math.floor(ry * h), 0, h);
        int x1 = clamp((int) Math.ceil((rx + rw) * w), 0, w);
        int y1 = clamp((int) Math.ceil((ry + rh) * h), 0, h);
        if (x1 <= x0 || y1 <= y0) return null;

        return page.getSubimage(x0, y0, x1 - x0, y1 - y0);
    }

    private double driftFactor(Zone expected, StructuralSignature observed) {
        if (observed == null) return 1.0;
        double best = 0.0;
        for (Zone candidate : observed.zonesOf(expected.getKind())) {
            best = Math.max(best, expected.overlap(candidate));
        }
        return Math.min(1.0, best / config.getGoodOverlap());
    }

    /**
     * First capture group of the first pattern that matches; the whole text
     * when the field has no patterns or none match.
     */
    private String applyPatterns(String text, FieldDefinition def) {
        for (String regex : def.getPatterns()) {
            Optional<Pattern> pattern = patternCache.computeIfAbsent(regex, r -> compile(r, def.getName()));
            if (pattern.isEmpty()) continue;

            Matcher m = pattern.get().matcher(text);
            if (m.find()) {
                String group = m.groupCount() > 0 ? m.group(1) : m.group();
                if (group != null && !group.isBlank()) return group.trim();
            }
        }
        return text.trim();
    }

    private static Optional<Pattern> compile(String regex, String fieldName) {
        try {
            return Optional.of(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.DOTALL));
        } catch (PatternSyntaxException e) {
            log.warn("Invalid regex for field '{}': {}", fieldName, regex);
            return Optional.empty();
        }
    }

    private static int clamp(int v, int lo, int hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
