package com.redactai.domain.redaction.model;

import java.util.Map;

public record CacheStats(int totalItems, long totalUsage, Map<PiiType, Integer> byType) {}
