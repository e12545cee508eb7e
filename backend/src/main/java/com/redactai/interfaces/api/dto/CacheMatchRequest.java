package com.redactai.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;

public record CacheMatchRequest(
        @NotNull(message = "Text is required")
        String text
) {}
