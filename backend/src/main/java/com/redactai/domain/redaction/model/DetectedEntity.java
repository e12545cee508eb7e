package com.redactai.domain.redaction.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

/**
 * A single redaction candidate located in the analysed text.
 * Only {@code maskedValue} and {@code shouldRedact} change after detection (reviewer edits);
 * the span is never recomputed.
 */
@Getter
@Builder(toBuilder = true)
public class DetectedEntity {

    @Builder.Default
    private final String id = UUID.randomUUID().toString();

    private final PiiType type;

    /** Verbatim substring of the analysed text at {@link #span}. */
    private final String value;

    private final String normalizedValue;

    @Setter
    private String maskedValue;

    private final Span span;

    private final double confidence;

    private final DetectionMethod detectionMethod;

    private final String context;

    @Setter
    @Builder.Default
    private boolean shouldRedact = true;

    @Builder.Default
    private final int pageNumber = 1;

    /** Id of the entity this one was discovered as a variation of, if any. */
    private final String canonicalEntityId;

    public int start() {
        return span.start();
    }

    public int end() {
        return span.end();
    }

    public boolean overlaps(DetectedEntity other) {
        return span.overlaps(other.span);
    }
}
