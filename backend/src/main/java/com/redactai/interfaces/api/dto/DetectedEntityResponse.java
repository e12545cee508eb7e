package com.redactai.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.redactai.domain.redaction.model.DetectedEntity;
import com.redactai.domain.redaction.model.DetectionMethod;
import com.redactai.domain.redaction.model.PiiType;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetectedEntityResponse(
        String id,
        PiiType type,
        String typeLabel,
        String value,
        String normalizedValue,
        String maskedValue,
        int startIndex,
        int endIndex,
        double confidence,
        DetectionMethod detectionMethod,
        String context,
        boolean shouldRedact,
        int pageNumber,
        String canonicalEntityId
) {

    public static DetectedEntityResponse from(DetectedEntity entity) {
        return new DetectedEntityResponse(
                entity.getId(),
                entity.getType(),
                entity.getType().label(),
                entity.getValue(),
                entity.getNormalizedValue(),
                entity.getMaskedValue(),
                entity.start(),
                entity.end(),
                entity.getConfidence(),
                entity.getDetectionMethod(),
                entity.getContext(),
                entity.isShouldRedact(),
                entity.getPageNumber(),
                entity.getCanonicalEntityId());
    }
}
