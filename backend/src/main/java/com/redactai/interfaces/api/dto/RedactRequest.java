package com.redactai.interfaces.api.dto;

import com.redactai.domain.redaction.model.PiiType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record RedactRequest(
        @NotBlank(message = "Text is required")
        String text,

        @NotNull(message = "Entities are required")
        List<@Valid PlanEntry> entities
) {

    /**
     * One reviewed entity. A null {@code shouldRedact} counts as true; a null {@code maskedValue}
     * gets the default masking for the type.
     */
    public record PlanEntry(
            @NotNull(message = "Entity type is required")
            PiiType type,

            @Min(value = 0, message = "startIndex must not be negative")
            int startIndex,

            @Min(value = 1, message = "endIndex must be positive")
            int endIndex,

            String maskedValue,

            Boolean shouldRedact
    ) {}
}
