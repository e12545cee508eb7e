package com.redactai.infrastructure.ai.parsing;

import com.redactai.domain.redaction.model.PiiType;

/**
 * One finding as reported by the model. Offsets are estimates and may be null.
 */
public record ModelFinding(
        PiiType type,
        String value,
        String normalizedValue,
        Integer startIndex,
        Integer endIndex,
        Double confidence,
        String context,
        String relatedTo
) {}
