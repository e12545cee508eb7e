package com.redactai.interfaces.api.dto;

import com.redactai.domain.redaction.model.PiiType;
import jakarta.validation.constraints.NotNull;

public record MaskRequest(
        @NotNull(message = "Type is required")
        PiiType type,

        @NotNull(message = "Value is required")
        String value,

        String maskOverride
) {}
