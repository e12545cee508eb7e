package com.redactai.domain.redaction.model;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

public enum RedactionPreset {
    SSN_FINANCIAL("ssn-financial", "SSNs and Financial Account Numbers",
            "Redact Social Security Numbers, bank accounts, and credit cards",
            EnumSet.of(PiiType.SSN, PiiType.ACCOUNT_NUMBER, PiiType.CREDIT_CARD)),
    ALL_PII("all-pii", "All Personal Information",
            "Redact all detectable PII including names, addresses, and contact info",
            EnumSet.complementOf(EnumSet.of(PiiType.CUSTOM))),
    CONTACT_INFO("contact-info", "Contact Information Only",
            "Redact phone numbers and email addresses",
            EnumSet.of(PiiType.PHONE, PiiType.EMAIL)),
    FINANCIAL_ONLY("financial-only", "Financial Information Only",
            "Redact bank accounts and credit card numbers",
            EnumSet.of(PiiType.ACCOUNT_NUMBER, PiiType.CREDIT_CARD));

    private final String key;
    private final String label;
    private final String description;
    private final Set<PiiType> types;

    RedactionPreset(String key, String label, String description, Set<PiiType> types) {
        this.key = key;
        this.label = label;
        this.description = description;
        this.types = types;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }

    public Set<PiiType> types() {
        return EnumSet.copyOf(types);
    }

    public static Optional<RedactionPreset> fromKey(String key) {
        for (RedactionPreset preset : values()) {
            if (preset.key.equalsIgnoreCase(key) || preset.name().equalsIgnoreCase(key)) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }
}
