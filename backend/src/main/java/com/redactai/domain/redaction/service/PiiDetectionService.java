package com.redactai.domain.redaction.service;

import com.redactai.domain.redaction.model.DetectedEntity;
import com.redactai.domain.redaction.model.DetectionResult;
import com.redactai.domain.redaction.model.DocumentContext;
import com.redactai.domain.redaction.model.PiiType;

import java.util.List;
import java.util.Set;

/**
 * Domain service interface for multi-pass PII detection.
 */
public interface PiiDetectionService {

    /**
     * Runs every detection pass over the text and returns the merged, non-overlapping entity set.
     *
     * @param text            plain extracted document text
     * @param typeFilter      types to detect (null or empty for all except CUSTOM)
     * @param documentContext index location of the document (nullable, enables semantic search)
     * @return entities sorted by start offset, pairwise non-overlapping
     */
    default List<DetectedEntity> detectAll(String text, Set<PiiType> typeFilter, DocumentContext documentContext) {
        return detect(text, typeFilter, documentContext).entities();
    }

    /**
     * Same as {@link #detectAll} but also reports per-pass statistics.
     */
    DetectionResult detect(String text, Set<PiiType> typeFilter, DocumentContext documentContext);

    /**
     * Deterministic masking of a single value.
     */
    String maskEntity(PiiType type, String value);
}
