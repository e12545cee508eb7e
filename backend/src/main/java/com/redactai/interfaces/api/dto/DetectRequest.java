package com.redactai.interfaces.api.dto;

import com.redactai.domain.redaction.model.DocumentContext;
import com.redactai.domain.redaction.model.PiiType;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record DetectRequest(
        @NotBlank(message = "Text is required")
        String text,

        List<PiiType> types,

        String preset,

        DocumentContext documentContext
) {}
