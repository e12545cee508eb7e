package com.redactai.interfaces.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record CacheBatchRequest(
        @NotEmpty(message = "At least one entry is required")
        List<@Valid CacheEntryRequest> entries
) {}
