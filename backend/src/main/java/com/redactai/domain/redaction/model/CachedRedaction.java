package com.redactai.domain.redaction.model;

import java.time.Instant;

/**
 * Hash-only record of a previously produced masking. Never holds the raw value.
 *
 * @param id          entry id
 * @param valueHash   composite, non-reversible signature of the lower-cased value
 * @param maskedValue the masking produced for the value
 * @param type        the PII type
 * @param createdAt   first insertion time
 * @param usageCount  number of times the value has been added
 * @param valueLength length of the raw value, used as the scan window
 */
public record CachedRedaction(
        String id,
        String valueHash,
        String maskedValue,
        PiiType type,
        Instant createdAt,
        int usageCount,
        int valueLength
) {

    public CachedRedaction withRepeatSighting(String newMaskedValue) {
        return new CachedRedaction(id, valueHash, newMaskedValue, type, createdAt, usageCount + 1, valueLength);
    }
}
