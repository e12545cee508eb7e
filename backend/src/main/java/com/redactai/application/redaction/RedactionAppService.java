package com.redactai.application.redaction;

import com.redactai.application.redaction.exception.InvalidDetectionInputException;
import com.redactai.domain.redaction.model.DetectedEntity;
import com.redactai.domain.redaction.model.DetectionResult;
import com.redactai.domain.redaction.model.DocumentContext;
import com.redactai.domain.redaction.model.PiiType;
import com.redactai.domain.redaction.model.RedactionPreset;
import com.redactai.domain.redaction.service.PiiDetectionService;
import com.redactai.infrastructure.ai.pattern.MaskingEngine;
import com.redactai.infrastructure.ai.pipeline.RedactionService;
import com.redactai.infrastructure.ai.pipeline.RedactionService.RedactionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class RedactionAppService {

    private final PiiDetectionService detectionService;
    private final RedactionService redactionService;
    private final MaskingEngine maskingEngine;

    @Value("${redaction.max-text-length:1000000}")
    private int maxTextLength = 1_000_000;

    /**
     * Validates the input and runs every detection pass.
     *
     * @param types     explicit types (nullable); takes precedence over the preset
     * @param presetKey preset key such as "ssn-financial" (nullable)
     */
    public DetectionResult detect(String text, List<PiiType> types, String presetKey, DocumentContext documentContext) {
        validateText(text);
        Set<PiiType> resolved = resolveTypes(types, presetKey);

        log.info("[Detect] textLength={}, types={}, preset={}, semanticContext={}",
                text.length(), resolved.isEmpty() ? "ALL" : resolved, presetKey,
                documentContext != null && documentContext.isComplete());

        return detectionService.detect(text, resolved, documentContext);
    }

    public String mask(PiiType type, String value, String override) {
        if (type == null) {
            throw new InvalidDetectionInputException("PII type is required");
        }
        return maskingEngine.mask(type, value, override);
    }

    /**
     * Applies a reviewed plan. Entities without a masked value get the default masking for their type.
     */
    public RedactionResult redact(String text, List<DetectedEntity> entities) {
        validateText(text);
        List<DetectedEntity> plan = entities.stream()
                .map(e -> e.getMaskedValue() != null
                        ? e
                        : e.toBuilder().maskedValue(maskingEngine.mask(e.getType(), e.getValue())).build())
                .toList();
        return redactionService.apply(text, plan);
    }

    /**
     * Empty result means "all types".
     */
    public Set<PiiType> resolveTypes(List<PiiType> types, String presetKey) {
        if (types != null && !types.isEmpty()) {
            return EnumSet.copyOf(types);
        }
        if (presetKey != null && !presetKey.isBlank()) {
            return RedactionPreset.fromKey(presetKey)
                    .map(RedactionPreset::types)
                    .orElseThrow(() -> new InvalidDetectionInputException("Unknown redaction preset: " + presetKey));
        }
        return EnumSet.noneOf(PiiType.class);
    }

    private void validateText(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidDetectionInputException("Text is required");
        }
        if (text.length() > maxTextLength) {
            throw new InvalidDetectionInputException(
                    String.format("Text must not exceed %d characters", maxTextLength));
        }
    }
}
