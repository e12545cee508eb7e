package com.redactai.interfaces.api.dto;

import com.redactai.domain.redaction.model.CacheMatch;
import com.redactai.domain.redaction.model.PiiType;

public record CacheMatchResponse(
        String entryId,
        PiiType type,
        String value,
        String maskedValue,
        int startIndex,
        int endIndex,
        int usageCount
) {

    public static CacheMatchResponse from(CacheMatch match) {
        return new CacheMatchResponse(
                match.cached().id(),
                match.cached().type(),
                match.value(),
                match.cached().maskedValue(),
                match.span().start(),
                match.span().end(),
                match.cached().usageCount());
    }
}
