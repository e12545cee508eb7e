package com.redactai.infrastructure.ai.retrospective;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.redactai.domain.redaction.model.DetectedEntity;
import com.redactai.domain.redaction.model.DetectionMethod;
import com.redactai.domain.redaction.model.PiiType;
import com.redactai.domain.redaction.model.Span;
import com.redactai.infrastructure.ai.AiCompletionService;
import com.redactai.infrastructure.ai.AiDetectionException;
import com.redactai.infrastructure.ai.DetectionPromptBuilder;
import com.redactai.infrastructure.ai.LlmCallResult;
import com.redactai.infrastructure.ai.detection.FindingEntityMapper;
import com.redactai.infrastructure.ai.detection.PassResult;
import com.redactai.infrastructure.ai.parsing.FindingResponseParser;
import com.redactai.infrastructure.ai.parsing.SpanLocator;
import com.redactai.infrastructure.ai.pattern.MaskingEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EntityVariationFinderTest {

    private static final String TEXT = "Robert J. Patterson signed. Later Mr. Patterson agreed.";

    @Mock
    private AiCompletionService aiCompletionService;

    private EntityVariationFinder finder;
    private DetectedEntity canonical;

    @BeforeEach
    void setUp() {
        MaskingEngine maskingEngine = new MaskingEngine();
        finder = new EntityVariationFinder(
                aiCompletionService,
                new DetectionPromptBuilder(),
                new FindingResponseParser(new ObjectMapper()),
                new FindingEntityMapper(new SpanLocator(), maskingEngine));

        canonical = DetectedEntity.builder()
                .type(PiiType.NAME)
                .value("Robert J. Patterson")
                .maskedValue("[NAME]")
                .span(new Span(0, 19))
                .confidence(0.9)
                .detectionMethod(DetectionMethod.UNSTRUCTURED)
                .build();
    }

    @Test
    @DisplayName("Variation is anchored and linked to its canonical entity")
    void links_variation() {
        when(aiCompletionService.call(contains("Robert J. Patterson"), anyString()))
                .thenReturn(new LlmCallResult("""
                        [{"type": "NAME", "value": "Mr. Patterson", "startIndex": 34, "endIndex": 47,
                          "relatedTo": "robert j. patterson", "confidence": 0.9}]
                        """, 120, 30));

        PassResult result = finder.find(TEXT, List.of(canonical));

        assertThat(result.degraded()).isFalse();
        assertThat(result.promptTokens()).isEqualTo(120);
        assertThat(result.entities()).hasSize(1);
        DetectedEntity variation = result.entities().get(0);
        assertThat(variation.getValue()).isEqualTo("Mr. Patterson");
        assertThat(variation.start()).isEqualTo(34);
        assertThat(variation.getMaskedValue()).isEqualTo("[NAME]");
        assertThat(variation.getDetectionMethod()).isEqualTo(DetectionMethod.RETROSPECTIVE);
        assertThat(variation.getCanonicalEntityId()).isEqualTo(canonical.getId());
        assertThat(variation.getContext()).isEqualTo("Variation of \"robert j. patterson\"");
    }

    @Test
    @DisplayName("Unknown relatedTo: kept without a canonical link")
    void unknown_related_to() {
        when(aiCompletionService.call(anyString(), anyString()))
                .thenReturn(new LlmCallResult(
                        "[{\"type\": \"NAME\", \"value\": \"Patterson\", \"relatedTo\": \"Someone Else\"}]", 0, 0));

        PassResult result = finder.find(TEXT, List.of(canonical));

        assertThat(result.entities()).hasSize(1);
        assertThat(result.entities().get(0).getCanonicalEntityId()).isNull();
        assertThat(result.entities().get(0).getConfidence()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("No names or addresses known: model is not called")
    void nothing_to_vary() {
        DetectedEntity ssn = canonical.toBuilder().type(PiiType.SSN).build();

        PassResult result = finder.find(TEXT, List.of(ssn));

        assertThat(result.entities()).isEmpty();
        assertThat(result.degraded()).isFalse();
        verifyNoInteractions(aiCompletionService);
    }

    @Test
    @DisplayName("Model failure degrades the pass")
    void model_failure() {
        when(aiCompletionService.call(anyString(), anyString()))
                .thenThrow(new AiDetectionException("down"));

        PassResult result = finder.find(TEXT, List.of(canonical));

        assertThat(result.entities()).isEmpty();
        assertThat(result.degraded()).isTrue();
    }
}
