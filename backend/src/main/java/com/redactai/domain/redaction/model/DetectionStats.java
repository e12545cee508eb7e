package com.redactai.domain.redaction.model;

import java.util.List;

/**
 * Per-pass candidate counts and cost figures for one detection run.
 */
public record DetectionStats(
        int patternCount,
        int contextualCount,
        int unstructuredCount,
        int occurrenceCount,
        int variationCount,
        int semanticCount,
        int finalCount,
        List<String> degradedPasses,
        long promptTokens,
        long completionTokens,
        long elapsedMs
) {}
