package com.redactai.interfaces.api.dto;

import com.redactai.domain.redaction.model.DetectionResult;
import com.redactai.domain.redaction.model.DetectionStats;

import java.util.List;

public record DetectResponse(
        boolean success,
        int count,
        List<DetectedEntityResponse> matches,
        DetectionStats stats
) {

    public static DetectResponse from(DetectionResult result) {
        List<DetectedEntityResponse> matches = result.entities().stream()
                .map(DetectedEntityResponse::from)
                .toList();
        return new DetectResponse(true, matches.size(), matches, result.stats());
    }
}
