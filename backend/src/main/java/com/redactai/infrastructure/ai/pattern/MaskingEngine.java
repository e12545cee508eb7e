package com.redactai.infrastructure.ai.pattern;

import com.redactai.domain.redaction.model.PiiType;
import org.springframework.stereotype.Component;

/**
 * Deterministic, type-specific masking of a single value.
 *
 * Numeric types keep the last four digits behind a fixed prefix, EMAIL keeps the first
 * character of the local part and the full domain, everything else becomes a literal token.
 */
@Component
public class MaskingEngine {

    static final String NAME_TOKEN = "[NAME]";
    static final String ADDRESS_TOKEN = "[ADDRESS]";
    static final String DOB_TOKEN = "**/**/****";
    static final String REDACTED_TOKEN = "[REDACTED]";

    public String mask(PiiType type, String value) {
        return mask(type, value, null);
    }

    /**
     * @param override reviewer-supplied replacement, honoured for CUSTOM only (nullable)
     */
    public String mask(PiiType type, String value, String override) {
        if (type == null) {
            throw new IllegalArgumentException("PII type is required for masking");
        }
        String v = value != null ? value : "";

        return switch (type) {
            case SSN -> "***-**-" + lastFourDigits(v);
            case CREDIT_CARD -> "****-****-****-" + lastFourDigits(v);
            case ACCOUNT_NUMBER -> "****" + lastFourDigits(v);
            case PHONE -> "(***) ***-" + lastFourDigits(v);
            case EMAIL -> maskEmail(v);
            case NAME -> NAME_TOKEN;
            case ADDRESS -> ADDRESS_TOKEN;
            case DOB -> DOB_TOKEN;
            case CUSTOM -> override != null && !override.isBlank() ? override : REDACTED_TOKEN;
        };
    }

    private String lastFourDigits(String value) {
        StringBuilder digits = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        return digits.length() <= 4 ? digits.toString() : digits.substring(digits.length() - 4);
    }

    private String maskEmail(String value) {
        String trimmed = value.trim();
        int at = trimmed.indexOf('@');
        if (at < 0 || at == trimmed.length() - 1) {
            return REDACTED_TOKEN;
        }
        String first = at > 0 ? trimmed.substring(0, 1) : "";
        return first + "***@" + trimmed.substring(at + 1);
    }
}
