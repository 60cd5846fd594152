package com.document.intelligence.service;

import com.document.intelligence.client.BusinessSystemClient;
import com.document.intelligence.config.PipelineProperties;
import com.document.intelligence.entity.DocumentRecord;
import com.document.intelligence.entity.DocumentTransition;
import com.document.intelligence.model.ConfidenceLevel;
import com.document.intelligence.model.DocumentState;
import com.document.intelligence.model.EnqueueRequest;
import com.document.intelligence.model.ExtractedField;
import com.document.intelligence.model.FinalizePayload;
import com.document.intelligence.model.MatchOutcome;
import com.document.intelligence.model.MatchResult;
import com.document.intelligence.model.NormalizationParameters;
import com.document.intelligence.model.NormalizedImage;
import com.document.intelligence.model.RawImage;
import com.document.intelligence.model.Routing;
import com.document.intelligence.model.ScoredCandidate;
import com.document.intelligence.model.StructuralSignature;
import com.document.intelligence.model.Template;
import com.document.intelligence.model.ValidationResult;
import com.document.intelligence.model.ZoneKind;
import com.document.intelligence.repository.DocumentRecordRepository;
import com.document.intelligence.repository.DocumentTransitionRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.web.client.ResourceAccessException;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("DocumentLifecycle Tests")
class DocumentLifecycleTest {

    private static final String APP = "bookkeeping";
    private static final String ARTIFACT = "/work/doc/normalized.png";

    @Mock private DocumentRecordRepository documentRepo;
    @Mock private DocumentTransitionRepository transitionRepo;
    @Mock private RasterImageLoader loader;
    @Mock private ImageNormalizer normalizer;
    @Mock private ArtifactStore artifacts;
    @Mock private StructuralSignatureExtractor signatureExtractor;
    @Mock private TemplateLibrary library;
    @Mock private TemplateMatcher matcher;
    @Mock private FieldExtractor fieldExtractor;
    @Mock private ConfidenceValidator validator;
    @Mock private BusinessSystemClient businessSystem;

    private final Map<String, DocumentRecord> rows = new HashMap<>();
    private final List<DocumentTransition> transitions = new ArrayList<>();
    private final BufferedImage page = TestPages.blank(100, 100);
    private final Template template = Layouts.template("t-1", Layouts.receipt());
    private final List<ExtractedField> fields = List.of(ExtractedField.builder()
            .name("total_amount").rawValue("162.00").value("162.00").confidence(0.995)
            .sourceZone(ZoneKind.FOOTER).build());

    private PipelineProperties properties;
    private ExecutorService stageExecutor;
    private DocumentStateStore store;
    private DocumentLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        when(documentRepo.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(rows.get(inv.<String>getArgument(0))));
        when(documentRepo.save(any(DocumentRecord.class))).thenAnswer(inv -> {
            DocumentRecord record = inv.getArgument(0);
            rows.put(record.getId(), record);
            return record;
        });
        when(transitionRepo.save(any(DocumentTransition.class))).thenAnswer(inv -> {
            transitions.add(inv.getArgument(0));
            return inv.getArgument(0);
        });

        properties = new PipelineProperties();
        stageExecutor = Executors.newCachedThreadPool();
        store = new DocumentStateStore(documentRepo, transitionRepo,
                new MutableClock(Instant.parse("2024-06-01T08:00:00Z")));
        lifecycle = new DocumentLifecycle(store, loader, normalizer, artifacts, signatureExtractor, library,
                matcher, fieldExtractor, validator, businessSystem, new StageRunner(stageExecutor, properties));
    }

    @AfterEach
    void tearDown() {
        stageExecutor.shutdownNow();
    }

    private String enqueue() {
        return store.create(EnqueueRequest.builder().path("/scans/receipt-1.png").applicationId(APP).build()).getId();
    }

    private void stubPreprocessing() {
        when(loader.load(any(Path.class))).thenReturn(new RawImage(page, 300, "png"));
        when(normalizer.normalize(any(RawImage.class)))
                .thenReturn(new NormalizedImage(page, NormalizationParameters.builder().estimatedDpi(300).build()));
        when(artifacts.saveNormalized(anyString(), any(BufferedImage.class))).thenReturn(Path.of(ARTIFACT));
        when(artifacts.loadNormalized(eq(ARTIFACT), any(DocumentState.class))).thenReturn(page);
        when(signatureExtractor.extract(any(BufferedImage.class))).thenReturn(Layouts.receipt());
        when(library.candidates(APP)).thenReturn(List.of(template));
    }

    private void stubMatch(MatchOutcome outcome, double score) {
        ScoredCandidate candidate = ScoredCandidate.builder().templateId("t-1").label(template.getLabel()).score(score).build();
        when(matcher.match(any(StructuralSignature.class), anyList())).thenReturn(MatchResult.builder()
                .outcome(outcome)
                .bestTemplate(outcome.proceedsToExtraction() ? template : null)
                .score(score)
                .ranked(List.of(candidate))
                .suggestions(List.of(candidate))
                .build());
    }

    private void stubExtraction(Routing routing) {
        when(library.find(APP, "t-1")).thenReturn(Optional.of(template));
        when(fieldExtractor.extract(any(NormalizedImage.class), eq(template), any(StructuralSignature.class)))
                .thenReturn(fields);
        when(validator.validate(fields, template)).thenReturn(ValidationResult.builder()
                .valid(true)
                .routing(routing)
                .build());
        when(validator.overallConfidence(eq(fields), eq(template), anyDouble(), any(ValidationResult.class)))
                .thenReturn(0.95);
        when(validator.level(0.95)).thenReturn(ConfidenceLevel.HIGH);
    }

    private List<DocumentState> path() {
        return transitions.stream().map(DocumentTransition::getToState).toList();
    }

    @Nested
    @DisplayName("Happy Path Tests")
    class HappyPathTests {

        @Test
        @DisplayName("Should auto-commit a confident auto-matched document")
        void shouldCompleteAutoCommittedDocument() {
            // Given
            stubPreprocessing();
            stubMatch(MatchOutcome.AUTO_MATCH, 0.97);
            stubExtraction(Routing.AUTO_COMMIT);
            String id = enqueue();

            // When
            DocumentState result = lifecycle.process(id);

            // Then
            assertThat(result).isEqualTo(DocumentState.COMPLETED);
            assertThat(path()).containsExactly(DocumentState.PENDING, DocumentState.PREPROCESSING,
                    DocumentState.MATCHING, DocumentState.EXTRACTING, DocumentState.COMPLETED);

            DocumentRecord record = rows.get(id);
            assertThat(record.getNormalizedImagePath()).isEqualTo(ARTIFACT);
            assertThat(record.getTemplateId()).isEqualTo("t-1");
            assertThat(record.getMatchScore()).isEqualTo(0.97);
            assertThat(record.getFields()).isEqualTo(fields);
            assertThat(record.getConfidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
            assertThat(record.isReviewRequired()).isFalse();

            ArgumentCaptor<FinalizePayload> payload = ArgumentCaptor.forClass(FinalizePayload.class);
            verify(businessSystem).finalizeDocument(payload.capture());
            assertThat(payload.getValue().getDocumentId()).isEqualTo(id);
            assertThat(payload.getValue().getTemplateId()).isEqualTo("t-1");
        }

        @Test
        @DisplayName("Should route a low-confidence extraction to review without finalizing")
        void shouldRouteToReview() {
            // Given
            stubPreprocessing();
            stubMatch(MatchOutcome.AUTO_MATCH, 0.97);
            stubExtraction(Routing.REVIEW);
            String id = enqueue();

            // When
            DocumentState result = lifecycle.process(id);

            // Then
            assertThat(result).isEqualTo(DocumentState.REVIEW);
            assertThat(rows.get(id).isReviewRequired()).isTrue();
            assertThat(rows.get(id).getFields()).isEqualTo(fields);
            verify(businessSystem, never()).finalizeDocument(any());
        }

        @Test
        @DisplayName("Should force review and propose a variant for a partial match")
        void shouldReviewVariantCandidate() {
            // Given
            stubPreprocessing();
            stubMatch(MatchOutcome.VARIANT_CANDIDATE, 0.72);
            stubExtraction(Routing.AUTO_COMMIT);
            String id = enqueue();

            // When
            DocumentState result = lifecycle.process(id);

            // Then
            assertThat(result).isEqualTo(DocumentState.REVIEW);
            assertThat(rows.get(id).getValidation().getReviewReasons())
                    .containsExactly("layout differs from template t-1");
            verify(library).proposeVariant(template, Layouts.receipt(), 0.72, id);
            verify(businessSystem, never()).finalizeDocument(any());
        }
    }

    @Nested
    @DisplayName("Matching Outcome Tests")
    class MatchingOutcomeTests {

        @Test
        @DisplayName("Should refresh the library and send the document to review when no templates exist")
        void shouldReviewWhenNoTemplates() {
            // Given
            stubPreprocessing();
            when(matcher.match(any(StructuralSignature.class), anyList())).thenReturn(MatchResult.noTemplates());
            String id = enqueue();

            // When
            DocumentState result = lifecycle.process(id);

            // Then
            assertThat(result).isEqualTo(DocumentState.REVIEW);
            DocumentRecord record = rows.get(id);
            assertThat(record.getMatchOutcome()).isEqualTo(MatchOutcome.NO_TEMPLATES);
            assertThat(record.getValidation().getReviewReasons()).containsExactly("no templates available");
            assertThat(record.getSignature()).isEqualTo(Layouts.receipt());
            verify(library).refresh(APP);
            verifyNoInteractions(fieldExtractor);
        }

        @Test
        @DisplayName("Should keep suggestions and skip extraction when nothing matches")
        void shouldReviewWhenNoMatch() {
            // Given
            stubPreprocessing();
            stubMatch(MatchOutcome.NO_MATCH, 0.31);
            String id = enqueue();

            // When
            DocumentState result = lifecycle.process(id);

            // Then
            assertThat(result).isEqualTo(DocumentState.REVIEW);
            DocumentRecord record = rows.get(id);
            assertThat(record.getCandidates()).extracting(ScoredCandidate::getTemplateId).containsExactly("t-1");
            assertThat(record.getValidation().getReviewReasons())
                    .containsExactly("no template matched (best score 0.310)");
            verifyNoInteractions(fieldExtractor);
        }
    }

    @Nested
    @DisplayName("Failure Tests")
    class FailureTests {

        @Test
        @DisplayName("Should fail the document with the stage that broke")
        void shouldRecordFailingStage() {
            // Given
            when(loader.load(any(Path.class))).thenReturn(new RawImage(page, 300, "png"));
            when(normalizer.normalize(any(RawImage.class))).thenThrow(new IllegalStateException("corrupt image"));
            String id = enqueue();

            // When
            DocumentState result = lifecycle.process(id);

            // Then
            assertThat(result).isEqualTo(DocumentState.FAILED);
            assertThat(rows.get(id).getErrorStage()).isEqualTo(DocumentState.PREPROCESSING);
            assertThat(rows.get(id).getErrorDetail()).isEqualTo("corrupt image");
        }

        @Test
        @DisplayName("Should fail a stage that overruns its time limit")
        void shouldFailOnTimeout() {
            // Given
            properties.getLifecycle().getStageTimeouts().setPreprocessing(Duration.ofMillis(100));
            when(loader.load(any(Path.class))).thenReturn(new RawImage(page, 300, "png"));
            when(normalizer.normalize(any(RawImage.class))).thenAnswer(inv -> {
                Thread.sleep(5000);
                return null;
            });
            String id = enqueue();

            // When
            DocumentState result = lifecycle.process(id);

            // Then
            assertThat(result).isEqualTo(DocumentState.FAILED);
            assertThat(rows.get(id).getErrorStage()).isEqualTo(DocumentState.PREPROCESSING);
            assertThat(rows.get(id).getErrorDetail()).contains("did not finish within");
        }

        @Test
        @DisplayName("Should not commit an extraction that finishes after its time limit")
        void shouldNotFinalizeAbandonedExtraction() throws InterruptedException {
            // Given
            properties.getLifecycle().getStageTimeouts().setExtracting(Duration.ofMillis(100));
            stubPreprocessing();
            stubMatch(MatchOutcome.AUTO_MATCH, 0.97);
            stubExtraction(Routing.AUTO_COMMIT);
            CountDownLatch extractionDone = new CountDownLatch(1);
            when(fieldExtractor.extract(any(NormalizedImage.class), eq(template), any(StructuralSignature.class)))
                    .thenAnswer(inv -> {
                        // ignores interruption, like a native OCR call would
                        long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(400);
                        while (System.nanoTime() < until) {
                            Thread.onSpinWait();
                        }
                        extractionDone.countDown();
                        return fields;
                    });
            String id = enqueue();

            // When
            DocumentState result = lifecycle.process(id);

            // Then
            assertThat(result).isEqualTo(DocumentState.FAILED);
            assertThat(rows.get(id).getErrorStage()).isEqualTo(DocumentState.EXTRACTING);
            assertThat(extractionDone.await(5, TimeUnit.SECONDS)).isTrue();
            Thread.sleep(200);
            verify(businessSystem, never()).finalizeDocument(any());
        }

        @Test
        @DisplayName("Should fail the document when a stage runs out of memory")
        void shouldFailOnError() {
            // Given
            stubPreprocessing();
            stubMatch(MatchOutcome.AUTO_MATCH, 0.97);
            stubExtraction(Routing.AUTO_COMMIT);
            when(fieldExtractor.extract(any(NormalizedImage.class), eq(template), any(StructuralSignature.class)))
                    .thenThrow(new OutOfMemoryError("Java heap space"));
            String id = enqueue();

            // When
            DocumentState result = lifecycle.process(id);

            // Then
            assertThat(result).isEqualTo(DocumentState.FAILED);
            assertThat(rows.get(id).getErrorStage()).isEqualTo(DocumentState.EXTRACTING);
            assertThat(rows.get(id).getErrorDetail()).isEqualTo("Java heap space");
            verify(businessSystem, never()).finalizeDocument(any());
        }

        @Test
        @DisplayName("Should fail extraction when the business system rejects the commit")
        void shouldFailWhenFinalizeFails() {
            // Given
            stubPreprocessing();
            stubMatch(MatchOutcome.AUTO_MATCH, 0.97);
            stubExtraction(Routing.AUTO_COMMIT);
            doThrow(new ResourceAccessException("connection refused"))
                    .when(businessSystem).finalizeDocument(any(FinalizePayload.class));
            String id = enqueue();

            // When
            DocumentState result = lifecycle.process(id);

            // Then
            assertThat(result).isEqualTo(DocumentState.FAILED);
            assertThat(rows.get(id).getErrorStage()).isEqualTo(DocumentState.EXTRACTING);
        }

        @Test
        @DisplayName("Should fail a cancelled document before its next stage")
        void shouldHonourCancellation() {
            // Given
            String id = enqueue();
            lifecycle.cancel(id);

            // When
            DocumentState result = lifecycle.process(id);

            // Then
            assertThat(result).isEqualTo(DocumentState.FAILED);
            assertThat(rows.get(id).getErrorStage()).isEqualTo(DocumentState.PENDING);
            assertThat(rows.get(id).getErrorDetail()).isEqualTo("cancelled");
            verifyNoInteractions(loader);
        }
    }

    @Nested
    @DisplayName("Recovery Tests")
    class RecoveryTests {

        @Test
        @DisplayName("Should resume at matching from the stored normalized image")
        void shouldResumeFromStoredArtifact() {
            // Given
            stubPreprocessing();
            stubMatch(MatchOutcome.AUTO_MATCH, 0.97);
            stubExtraction(Routing.AUTO_COMMIT);
            String id = enqueue();
            DocumentRecord record = rows.get(id);
            record.setState(DocumentState.MATCHING);
            record.setNormalizedImagePath(ARTIFACT);
            record.setNormalization(NormalizationParameters.builder().estimatedDpi(300).build());

            // When
            DocumentState result = lifecycle.process(id);

            // Then
            assertThat(result).isEqualTo(DocumentState.COMPLETED);
            verifyNoInteractions(loader, normalizer);
            verify(artifacts).loadNormalized(ARTIFACT, DocumentState.MATCHING);
        }

        @Test
        @DisplayName("Should leave a finished document alone")
        void shouldNotReprocessTerminalDocument() {
            // Given
            String id = enqueue();
            rows.get(id).setState(DocumentState.COMPLETED);

            // When
            DocumentState result = lifecycle.process(id);

            // Then
            assertThat(result).isEqualTo(DocumentState.COMPLETED);
            verifyNoInteractions(loader, normalizer, matcher, fieldExtractor);
        }
    }
}
