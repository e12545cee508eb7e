package com.redactai.infrastructure.ai.pipeline;

import com.redactai.domain.redaction.model.DetectedEntity;
import com.redactai.domain.redaction.model.DetectionMethod;
import com.redactai.domain.redaction.model.DocumentContext;
import com.redactai.domain.redaction.model.PiiType;
import com.redactai.domain.redaction.model.Span;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PassGateTest {

    private final PassGate gate = new PassGate();

    @Test
    void contextual_needs_a_structured_type() {
        assertThat(gate.shouldFireContextual(Set.of(PiiType.SSN))).isTrue();
        assertThat(gate.shouldFireContextual(Set.of(PiiType.EMAIL, PiiType.NAME))).isFalse();
    }

    @Test
    void unstructured_needs_name_or_address() {
        assertThat(gate.shouldFireUnstructured(Set.of(PiiType.ADDRESS))).isTrue();
        assertThat(gate.shouldFireUnstructured(Set.of(PiiType.SSN))).isFalse();

        ReflectionTestUtils.setField(gate, "unstructuredEnabled", false);
        assertThat(gate.shouldFireUnstructured(Set.of(PiiType.NAME))).isFalse();
    }

    @Test
    void variations_need_a_known_name_or_address() {
        DetectedEntity name = DetectedEntity.builder()
                .type(PiiType.NAME).value("Jane").span(new Span(0, 4))
                .confidence(0.9).detectionMethod(DetectionMethod.UNSTRUCTURED).build();

        assertThat(gate.shouldFireVariations(List.of(name))).isTrue();
        assertThat(gate.shouldFireVariations(List.of())).isFalse();
    }

    @Test
    void semantic_search_needs_flag_and_complete_context() {
        DocumentContext context = new DocumentContext("vault-1", "doc-1");
        assertThat(gate.shouldFireSemanticSearch(context)).isFalse();

        ReflectionTestUtils.setField(gate, "semanticSearchEnabled", true);
        assertThat(gate.shouldFireSemanticSearch(context)).isTrue();
        assertThat(gate.shouldFireSemanticSearch(new DocumentContext("vault-1", " "))).isFalse();
        assertThat(gate.shouldFireSemanticSearch(null)).isFalse();
    }
}
