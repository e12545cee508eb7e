package com.redactai.interfaces.api.dto;

import com.redactai.domain.redaction.model.PiiType;

import java.util.Map;

public record RedactResponse(
        String redactedText,
        int redactedCount,
        int skippedCount,
        Map<PiiType, Integer> byType
) {}
