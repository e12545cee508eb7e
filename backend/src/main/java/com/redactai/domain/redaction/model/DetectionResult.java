package com.redactai.domain.redaction.model;

import java.util.List;

public record DetectionResult(List<DetectedEntity> entities, DetectionStats stats) {}
