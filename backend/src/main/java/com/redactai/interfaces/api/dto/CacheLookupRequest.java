package com.redactai.interfaces.api.dto;

import jakarta.validation.constraints.NotEmpty;

public record CacheLookupRequest(
        @NotEmpty(message = "Value is required")
        String value
) {}
