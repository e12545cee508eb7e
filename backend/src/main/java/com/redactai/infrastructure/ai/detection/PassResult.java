package com.redactai.infrastructure.ai.detection;

import com.redactai.domain.redaction.model.DetectedEntity;

import java.util.List;

/**
 * Output of one detection pass. A degraded pass contributed nothing because its external
 * call or response could not be used.
 */
public record PassResult(
        List<DetectedEntity> entities,
        boolean degraded,
        long promptTokens,
        long completionTokens
) {

    public static PassResult empty() {
        return new PassResult(List.of(), false, 0, 0);
    }

    public static PassResult degraded(long promptTokens, long completionTokens) {
        return new PassResult(List.of(), true, promptTokens, completionTokens);
    }

    public static PassResult of(List<DetectedEntity> entities, long promptTokens, long completionTokens) {
        return new PassResult(List.copyOf(entities), false, promptTokens, completionTokens);
    }
}
