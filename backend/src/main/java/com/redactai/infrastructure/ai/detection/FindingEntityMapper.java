package com.redactai.infrastructure.ai.detection;

import com.redactai.domain.redaction.model.DetectedEntity;
import com.redactai.domain.redaction.model.DetectionMethod;
import com.redactai.domain.redaction.model.Span;
import com.redactai.infrastructure.ai.parsing.ModelFinding;
import com.redactai.infrastructure.ai.parsing.SpanLocator;
import com.redactai.infrastructure.ai.pattern.MaskingEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns a model finding into an entity anchored at a verified offset of the analysed text.
 */
@Component
@RequiredArgsConstructor
public class FindingEntityMapper {

    private final SpanLocator spanLocator;
    private final MaskingEngine maskingEngine;

    /**
     * @return empty when the finding's value does not occur in the text
     */
    public Optional<DetectedEntity.DetectedEntityBuilder> toEntity(String text, ModelFinding finding,
                                                                   DetectionMethod method, double confidence,
                                                                   String context) {
        Optional<Span> span = spanLocator.locate(text, finding.value(), finding.startIndex());
        if (span.isEmpty()) {
            return Optional.empty();
        }

        String value = text.substring(span.get().start(), span.get().end());
        // spelled-out numbers only carry their digits in the normalized form
        String maskSource = finding.normalizedValue() != null ? finding.normalizedValue() : value;

        return Optional.of(DetectedEntity.builder()
                .type(finding.type())
                .value(value)
                .normalizedValue(finding.normalizedValue())
                .maskedValue(maskingEngine.mask(finding.type(), maskSource))
                .span(span.get())
                .confidence(confidence)
                .detectionMethod(method)
                .context(context));
    }

    public static double clampConfidence(Double reported, double fallback) {
        if (reported == null || reported.isNaN()) {
            return fallback;
        }
        return Math.max(0.0, Math.min(1.0, reported));
    }
}
