package com.redactai.interfaces.api.dto;

import com.redactai.domain.redaction.model.PiiType;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

public record CacheEntryRequest(
        @NotEmpty(message = "Value is required")
        String value,

        @NotNull(message = "Masked value is required")
        String maskedValue,

        @NotNull(message = "Type is required")
        PiiType type
) {}
