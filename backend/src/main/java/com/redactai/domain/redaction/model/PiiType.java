package com.redactai.domain.redaction.model;

import java.util.Locale;
import java.util.Optional;

public enum PiiType {
    SSN("Social Security Number"),
    ACCOUNT_NUMBER("Account Number"),
    CREDIT_CARD("Credit Card"),
    NAME("Name"),
    ADDRESS("Address"),
    PHONE("Phone Number"),
    EMAIL("Email Address"),
    DOB("Date of Birth"),
    CUSTOM("Custom");

    private final String label;

    PiiType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Lenient lookup used for model output: case-insensitive, tolerates spaces and dashes.
     * Unknown names yield empty.
     */
    public static Optional<PiiType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String key = name.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (PiiType type : values()) {
            if (type.name().equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
