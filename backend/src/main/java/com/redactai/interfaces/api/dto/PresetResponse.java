package com.redactai.interfaces.api.dto;

import com.redactai.domain.redaction.model.PiiType;
import com.redactai.domain.redaction.model.RedactionPreset;

import java.util.List;

public record PresetResponse(String key, String label, String description, List<PiiType> types) {

    public static PresetResponse from(RedactionPreset preset) {
        return new PresetResponse(preset.key(), preset.label(), preset.description(),
                preset.types().stream().sorted().toList());
    }
}
