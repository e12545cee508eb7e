package com.redactai.interfaces.api.dto;

import com.redactai.domain.redaction.model.CacheStats;

public record CacheImportResponse(int imported, CacheStats stats) {}
