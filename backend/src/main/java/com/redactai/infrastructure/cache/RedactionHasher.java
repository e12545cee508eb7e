package com.redactai.infrastructure.cache;

import org.springframework.stereotype.Component;

/**
 * Builds the non-reversible signature under which a redacted value is cached.
 *
 * Signature = hex(first char) + hex(|h|) + hex(last char, or "00" for single-char values) + length,
 * where h folds the lower-cased characters as {@code 31 * h + c} in 32-bit arithmetic.
 * This is a fast lookup key, not a cryptographic digest: distinct values may collide.
 */
@Component
public class RedactionHasher {

    public String hash(String value) {
        return hashLowerCased(lowerCase(value));
    }

    /**
     * Lower-cases per UTF-16 unit so the result has exactly the input length.
     */
    static String lowerCase(String value) {
        char[] chars = value.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            chars[i] = Character.toLowerCase(chars[i]);
        }
        return new String(chars);
    }

    String hashLowerCased(String lowered) {
        int hash = 0;
        for (int i = 0; i < lowered.length(); i++) {
            hash = 31 * hash + lowered.charAt(i);
        }

        int length = lowered.length();
        String prefix = length > 0 ? Integer.toHexString(lowered.charAt(0)) : "00";
        String suffix = length > 1 ? Integer.toHexString(lowered.charAt(length - 1)) : "00";
        return prefix + Long.toHexString(Math.abs((long) hash)) + suffix + length;
    }
}
