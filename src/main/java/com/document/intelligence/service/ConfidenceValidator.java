package com.document.intelligence.service;

import com.document.intelligence.config.PipelineProperties;
import com.document.intelligence.model.ConfidenceLevel;
import com.document.intelligence.model.ExtractedField;
import com.document.intelligence.model.FieldDefinition;
import com.document.intelligence.model.Routing;
import com.document.intelligence.model.Template;
import com.document.intelligence.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether an extraction can be committed without a human.
 *
 * Missing required fields and unsure or unread high-stakes fields force review; other
 * low-confidence fields and business-rule warnings are reported but only
 * force review once warnings pile up. Nothing here ever fails a document.
 */
@Service
@Slf4j
public class ConfidenceValidator {

    private static final BigDecimal ONE_PERCENT = new BigDecimal("0.01");

    private static final double WEIGHT_RECOGNITION = 0.30;
    private static final double WEIGHT_EXTRACTION = 0.40;
    private static final double WEIGHT_MATCH = 0.20;
    private static final double WEIGHT_VALIDATION = 0.10;
    private static final double OPTIONAL_BONUS = 0.1;
    private static final double PENALTY_PER_WARNING = 0.1;

    private static final double HIGH_LEVEL = 0.85;
    private static final double MEDIUM_LEVEL = 0.70;

    private final PipelineProperties.Validation config;
    private final Clock clock;

    public ConfidenceValidator(PipelineProperties properties, Clock clock) {
        this.config = properties.getValidation();
        this.clock = clock;
    }

    public ValidationResult validate(List<ExtractedField> fields, Template template) {
        Map<String, ExtractedField> byName = new LinkedHashMap<>();
        for (ExtractedField field : fields) byName.put(field.getName(), field);

        ValidationResult.ValidationResultBuilder result = ValidationResult.builder();
        boolean valid = true;
        boolean highStakesIssue = false;
        boolean highStakesMissing = false;

        // 1. required fields
        for (FieldDefinition def : template.getFieldMap()) {
            if (def.isRequired() && !hasValue(byName.get(def.getName()))) {
                result.missingField(def.getName());
                valid = false;
            }
        }

        // 2. confidence floors
        for (FieldDefinition def : template.getFieldMap()) {
            ExtractedField field = byName.get(def.getName());
            if (!hasValue(field)) {
                // an unread high-stakes field is never safe to commit, required or not
                if (isHighStakes(def)) {
                    result.highStakesIssue(def.getName() + ": no value extracted");
                    result.lowConfidenceField(def.getName());
                    highStakesMissing = true;
                }
                continue;
            }

            if (isHighStakes(def)) {
                if (field.getConfidence() < config.getHighStakesFloor()) {
                    result.highStakesIssue(String.format(Locale.ROOT, "%s: confidence %.3f below %.2f",
                            def.getName(), field.getConfidence(), config.getHighStakesFloor()));
                    result.lowConfidenceField(def.getName());
                    highStakesIssue = true;
                }
            } else {
                double floor = def.getMinConfidence() != null ? def.getMinConfidence() : config.getDefaultFieldFloor();
                if (field.getConfidence() < floor) {
                    result.lowConfidenceField(def.getName());
                }
            }
        }

        // 3. business rules, warnings only
        List<String> warnings = businessRuleWarnings(byName);
        result.warnings(warnings);

        boolean autoCommit = valid && !highStakesIssue && !highStakesMissing && warnings.size() < config.getWarningReviewThreshold();
        if (!valid) result.reviewReason("missing required fields");
        if (highStakesMissing) result.reviewReason("high-stakes field not extracted");
        if (highStakesIssue) result.reviewReason("high-stakes field below confidence floor");
        if (warnings.size() >= config.getWarningReviewThreshold()) {
            result.reviewReason(warnings.size() + " business rule warnings");
        }

        ValidationResult validation = result
                .valid(valid)
                .routing(autoCommit ? Routing.AUTO_COMMIT : Routing.REVIEW)
                .build();
        log.debug("Validation for template {}: valid={}, routing={}, warnings={}",
                template.getTemplateId(), valid, validation.getRouting(), warnings.size());
        return validation;
    }

    /**
     * Single document score in [0, 1]: recognition quality, share of fields
     * found, match score and data validation, weighted 30/40/20/10.
     */
    public double overallConfidence(List<ExtractedField> fields, Template template, double matchScore,
                                    ValidationResult validation) {
        double recognition = fields.stream().mapToDouble(ExtractedField::getConfidence).average().orElse(0.0);

        Map<String, ExtractedField> byName = new LinkedHashMap<>();
        for (ExtractedField field : fields) byName.put(field.getName(), field);

        int required = 0, requiredFound = 0, optional = 0, optionalFound = 0;
        for (FieldDefinition def : template.getFieldMap()) {
            boolean found = hasValue(byName.get(def.getName()));
            if (def.isRequired()) {
                required++;
                if (found) requiredFound++;
            } else {
                optional++;
                if (found) optionalFound++;
            }
        }
        double extraction = required == 0 ? 1.0 : (double) requiredFound / required;
        if (optional > 0) extraction += OPTIONAL_BONUS * optionalFound / optional;
        extraction = Math.min(1.0, extraction);

        double dataValidation = Math.max(0.0, 1.0 - PENALTY_PER_WARNING * validation.getWarnings().size());

        double overall = WEIGHT_RECOGNITION * recognition
                + WEIGHT_EXTRACTION * extraction
                + WEIGHT_MATCH * matchScore
                + WEIGHT_VALIDATION * dataValidation;
        return Math.max(0.0, Math.min(1.0, overall));
    }

    public ConfidenceLevel level(double overallConfidence) {
        if (overallConfidence >= HIGH_LEVEL) return ConfidenceLevel.HIGH;
        if (overallConfidence >= MEDIUM_LEVEL) return ConfidenceLevel.MEDIUM;
        return ConfidenceLevel.LOW;
    }

    // ─── BUSINESS RULES ────────────────────────────────────────────────

    private List<String> businessRuleWarnings(Map<String, ExtractedField> fields) {
        PipelineProperties.Rules rules = config.getRules();
        List<String> warnings = new ArrayList<>();

        Optional<BigDecimal> total = amount(fields, rules.getTotalField());
        Optional<BigDecimal> subtotal = amount(fields, rules.getSubtotalField());
        Optional<BigDecimal> tax = amount(fields, rules.getTaxField());
        Optional<BigDecimal> taxable = amount(fields, rules.getTaxableField());
        Optional<BigDecimal> lineTotal = lineItemsTotal(fields.get(rules.getLineItemsField()));

        if (lineTotal.isPresent() && subtotal.isPresent()) {
            BigDecimal calculated = lineTotal.get();
            BigDecimal tolerance = calculated.abs().multiply(ONE_PERCENT)
                    .max(BigDecimal.valueOf(config.getSubtotalTolerance()));
            if (calculated.subtract(subtotal.get()).abs().compareTo(tolerance) > 0) {
                warnings.add("line items total " + calculated.toPlainString()
                        + " does not match subtotal " + subtotal.get().toPlainString());
            }
        }

        Optional<BigDecimal> base = taxable.isPresent() ? taxable : subtotal;
        if (tax.isPresent() && base.isPresent() && base.get().signum() > 0) {
            double rate = tax.get().divide(base.get(), 6, RoundingMode.HALF_UP).doubleValue();
            if (rate < config.getMinTaxRate() || rate > config.getMaxTaxRate()) {
                warnings.add(String.format(Locale.ROOT, "implied tax rate %.4f outside [%.2f, %.2f]",
                        rate, config.getMinTaxRate(), config.getMaxTaxRate()));
            }
        }

        if (total.isPresent() && total.get().signum() <= 0 && lineTotal.isPresent()) {
            warnings.add("total " + total.get().toPlainString() + " is not positive but line items are present");
        }

        ExtractedField date = fields.get(rules.getDateField());
        if (hasValue(date)) {
            try {
                LocalDate documentDate = LocalDate.parse(date.getValue());
                if (documentDate.isAfter(LocalDate.now(clock))) {
                    warnings.add("document date " + documentDate + " is in the future");
                }
            } catch (DateTimeParseException e) {
                log.debug("Date field '{}' is not ISO formatted: {}", rules.getDateField(), date.getValue());
            }
        }

        return warnings;
    }

    private Optional<BigDecimal> amount(Map<String, ExtractedField> fields, String name) {
        ExtractedField field = fields.get(name);
        if (!hasValue(field)) return Optional.empty();
        try {
            return Optional.of(new BigDecimal(field.getValue().trim()));
        } catch (NumberFormatException e) {
            log.debug("Field '{}' is not a decimal: {}", name, field.getValue());
            return Optional.empty();
        }
    }

    private Optional<BigDecimal> lineItemsTotal(ExtractedField field) {
        if (!hasValue(field)) return Optional.empty();
        BigDecimal sum = BigDecimal.ZERO;
        int count = 0;
        for (String part : field.getValue().split(";")) {
            if (part.isBlank()) continue;
            try {
                sum = sum.add(new BigDecimal(part.trim()));
                count++;
            } catch (NumberFormatException e) {
                log.debug("Skipping unparseable line item amount: {}", part);
            }
        }
        return count == 0 ? Optional.empty() : Optional.of(sum);
    }

    private boolean isHighStakes(FieldDefinition def) {
        return def.isHighStakes() || config.getHighStakesFields().contains(def.getName());
    }

    static boolean hasValue(ExtractedField field) {
        if (field == null || field.getValue() == null) return false;
        String value = field.getValue().trim();
        return !value.isEmpty() && !"NULL".equalsIgnoreCase(value);
    }
}
