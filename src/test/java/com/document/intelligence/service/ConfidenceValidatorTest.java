package com.document.intelligence.service;

import com.document.intelligence.config.PipelineProperties;
import com.document.intelligence.model.ConfidenceLevel;
import com.document.intelligence.model.ExtractedField;
import com.document.intelligence.model.FieldDefinition;
import com.document.intelligence.model.Routing;
import com.document.intelligence.model.Template;
import com.document.intelligence.model.ValidationResult;
import com.document.intelligence.model.ValueType;
import com.document.intelligence.model.ZoneKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ConfidenceValidator Tests")
class ConfidenceValidatorTest {

    private final ConfidenceValidator validator = new ConfidenceValidator(new PipelineProperties(),
            Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC));

    private final Template template = Template.builder()
            .templateId("acme-thermal")
            .signature(Layouts.receipt())
            .field(Layouts.totalAmount())
            .field(FieldDefinition.builder().name("receipt_date").zone(ZoneKind.HEADER).type(ValueType.DATE).build())
            .field(FieldDefinition.builder().name("vendor_name").zone(ZoneKind.HEADER).build())
            .build();

    private static ExtractedField field(String name, String value, double confidence) {
        return ExtractedField.builder().name(name).rawValue(value).value(value).confidence(confidence).build();
    }

    private static List<ExtractedField> fields(double totalConfidence) {
        List<ExtractedField> fields = new ArrayList<>();
        fields.add(field("total_amount", "162.00", totalConfidence));
        fields.add(field("receipt_date", "2024-03-01", 0.95));
        fields.add(field("vendor_name", "ACME", 0.95));
        return fields;
    }

    @Nested
    @DisplayName("Routing Tests")
    class RoutingTests {

        @Test
        @DisplayName("Should auto-commit a complete, confident extraction")
        void shouldAutoCommitConfidentExtraction() {
            // When
            ValidationResult result = validator.validate(fields(0.995), template);

            // Then
            assertThat(result.isValid()).isTrue();
            assertThat(result.getRouting()).isEqualTo(Routing.AUTO_COMMIT);
            assertThat(result.getHighStakesIssues()).isEmpty();
            assertThat(result.getReviewReasons()).isEmpty();
        }

        @Test
        @DisplayName("Should send an unsure total to review while keeping the result valid")
        void shouldReviewUnsureHighStakesField() {
            // When
            ValidationResult result = validator.validate(fields(0.80), template);

            // Then
            assertThat(result.isValid()).isTrue();
            assertThat(result.getRouting()).isEqualTo(Routing.REVIEW);
            assertThat(result.getHighStakesIssues()).containsExactly("total_amount: confidence 0.800 below 0.99");
            assertThat(result.getLowConfidenceFields()).containsExactly("total_amount");
            assertThat(result.getReviewReasons()).containsExactly("high-stakes field below confidence floor");
        }

        @Test
        @DisplayName("Should invalidate the result when a required field is missing")
        void shouldReviewMissingRequiredField() {
            // Given
            List<ExtractedField> fields = fields(0.995);
            fields.set(0, field("total_amount", null, 0.0));

            // When
            ValidationResult result = validator.validate(fields, template);

            // Then
            assertThat(result.isValid()).isFalse();
            assertThat(result.getMissingFields()).containsExactly("total_amount");
            assertThat(result.getRouting()).isEqualTo(Routing.REVIEW);
        }

        @Test
        @DisplayName("Should review an optional high-stakes field that has no value")
        void shouldReviewValuelessOptionalHighStakesField() {
            // Given
            Template optionalTotal = Template.builder()
                    .templateId("acme-thermal")
                    .signature(Layouts.receipt())
                    .field(FieldDefinition.builder().name("total_amount").zone(ZoneKind.FOOTER)
                            .type(ValueType.AMOUNT).required(false).build())
                    .field(FieldDefinition.builder().name("vendor_name").zone(ZoneKind.HEADER).build())
                    .build();
            List<ExtractedField> fields = List.of(
                    field("total_amount", null, 0.45),
                    field("vendor_name", "ACME", 0.95));

            // When
            ValidationResult result = validator.validate(fields, optionalTotal);

            // Then
            assertThat(result.isValid()).isTrue();
            assertThat(result.getRouting()).isEqualTo(Routing.REVIEW);
            assertThat(result.getHighStakesIssues()).containsExactly("total_amount: no value extracted");
            assertThat(result.getReviewReasons()).containsExactly("high-stakes field not extracted");
        }

        @Test
        @DisplayName("Should review a high-stakes field the extractor never returned")
        void shouldReviewAbsentHighStakesField() {
            // Given
            Template flagged = Template.builder()
                    .templateId("acme-thermal")
                    .signature(Layouts.receipt())
                    .field(FieldDefinition.builder().name("tax_id").zone(ZoneKind.HEADER).highStakes(true).build())
                    .build();

            // When
            ValidationResult result = validator.validate(List.of(), flagged);

            // Then
            assertThat(result.getRouting()).isEqualTo(Routing.REVIEW);
            assertThat(result.getHighStakesIssues()).containsExactly("tax_id: no value extracted");
        }

        @Test
        @DisplayName("Should treat a literal NULL as missing")
        void shouldTreatNullLiteralAsMissing() {
            // Given
            List<ExtractedField> fields = fields(0.995);
            fields.set(0, field("total_amount", "NULL", 0.99));

            // When
            ValidationResult result = validator.validate(fields, template);

            // Then
            assertThat(result.getMissingFields()).containsExactly("total_amount");
        }

        @Test
        @DisplayName("Should only report a low-confidence ordinary field")
        void shouldNotReviewForOrdinaryLowConfidence() {
            // Given
            List<ExtractedField> fields = fields(0.995);
            fields.set(2, field("vendor_name", "ACME", 0.5));

            // When
            ValidationResult result = validator.validate(fields, template);

            // Then
            assertThat(result.getLowConfidenceFields()).containsExactly("vendor_name");
            assertThat(result.getRouting()).isEqualTo(Routing.AUTO_COMMIT);
        }

        @Test
        @DisplayName("Should append a reason and force review")
        void shouldForceReview() {
            // Given
            ValidationResult committed = validator.validate(fields(0.995), template);

            // When
            ValidationResult result = committed.requireReview("layout differs from template acme-thermal");

            // Then
            assertThat(result.getRouting()).isEqualTo(Routing.REVIEW);
            assertThat(result.isValid()).isTrue();
            assertThat(result.getReviewReasons()).containsExactly("layout differs from template acme-thermal");
        }
    }

    @Nested
    @DisplayName("Business Rule Tests")
    class BusinessRuleTests {

        @Test
        @DisplayName("Should warn when line items do not add up to the subtotal")
        void shouldWarnOnSubtotalMismatch() {
            // Given
            List<ExtractedField> fields = fields(0.995);
            fields.add(field("line_items", "3.50;2.25", 0.9));
            fields.add(field("subtotal", "6.00", 0.9));

            // When
            ValidationResult result = validator.validate(fields, template);

            // Then
            assertThat(result.getWarnings()).containsExactly("line items total 5.75 does not match subtotal 6.00");
            assertThat(result.getRouting()).isEqualTo(Routing.AUTO_COMMIT);
        }

        @Test
        @DisplayName("Should accept line items within one cent of the subtotal")
        void shouldAcceptMatchingSubtotal() {
            // Given
            List<ExtractedField> fields = fields(0.995);
            fields.add(field("line_items", "3.50;2.25", 0.9));
            fields.add(field("subtotal", "5.75", 0.9));

            // When
            ValidationResult result = validator.validate(fields, template);

            // Then
            assertThat(result.getWarnings()).isEmpty();
        }

        @Test
        @DisplayName("Should warn on a date in the future")
        void shouldWarnOnFutureDate() {
            // Given
            List<ExtractedField> fields = fields(0.995);
            fields.set(1, field("receipt_date", "2024-07-01", 0.95));

            // When
            ValidationResult result = validator.validate(fields, template);

            // Then
            assertThat(result.getWarnings()).containsExactly("document date 2024-07-01 is in the future");
        }

        @Test
        @DisplayName("Should route to review once three rules are broken")
        void shouldReviewOnAccumulatedWarnings() {
            // Given
            List<ExtractedField> fields = new ArrayList<>();
            fields.add(field("total_amount", "0.00", 0.995));
            fields.add(field("receipt_date", "2024-07-01", 0.95));
            fields.add(field("vendor_name", "ACME", 0.95));
            fields.add(field("line_items", "3.50;2.25", 0.9));
            fields.add(field("subtotal", "6.00", 0.9));
            fields.add(field("tax_amount", "2.00", 0.9));

            // When
            ValidationResult result = validator.validate(fields, template);

            // Then
            assertThat(result.getWarnings()).hasSize(4);
            assertThat(result.isValid()).isTrue();
            assertThat(result.getRouting()).isEqualTo(Routing.REVIEW);
            assertThat(result.getReviewReasons()).containsExactly("4 business rule warnings");
        }
    }

    @Nested
    @DisplayName("Overall Confidence Tests")
    class OverallConfidenceTests {

        @Test
        @DisplayName("Should weight recognition, extraction, match and validation")
        void shouldCombineComponents() {
            // Given
            List<ExtractedField> fields = fields(0.995);
            ValidationResult validation = validator.validate(fields, template);

            // When
            double overall = validator.overallConfidence(fields, template, 0.9, validation);

            // Then
            double recognition = (0.995 + 0.95 + 0.95) / 3;
            assertThat(overall).isCloseTo(0.30 * recognition + 0.40 + 0.20 * 0.9 + 0.10, within(1e-9));
        }

        @Test
        @DisplayName("Should lose the extraction share when the required field is missing")
        void shouldPenalizeMissingRequiredField() {
            // Given
            List<ExtractedField> fields = fields(0.995);
            fields.set(0, field("total_amount", null, 0.0));
            ValidationResult validation = validator.validate(fields, template);

            // When
            double overall = validator.overallConfidence(fields, template, 1.0, validation);

            // Then
            double recognition = (0.0 + 0.95 + 0.95) / 3;
            assertThat(overall).isCloseTo(0.30 * recognition + 0.40 * 0.1 + 0.20 + 0.10, within(1e-9));
        }

        @Test
        @DisplayName("Should band overall confidence into levels")
        void shouldBandLevels() {
            assertThat(validator.level(0.85)).isEqualTo(ConfidenceLevel.HIGH);
            assertThat(validator.level(0.849)).isEqualTo(ConfidenceLevel.MEDIUM);
            assertThat(validator.level(0.70)).isEqualTo(ConfidenceLevel.MEDIUM);
            assertThat(validator.level(0.69)).isEqualTo(ConfidenceLevel.LOW);
        }
    }
}
