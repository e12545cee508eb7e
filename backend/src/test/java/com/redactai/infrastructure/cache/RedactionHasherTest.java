package com.redactai.infrastructure.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RedactionHasherTest {

    private final RedactionHasher hasher = new RedactionHasher();

    @Test
    @DisplayName("Signature layout: first char, folded hash, last char, length")
    void layout() {
        assertThat(hasher.hash("a")).isEqualTo("6161001");
        // 31 * 97 + 98 = 3105 = 0xc21
        assertThat(hasher.hash("ab")).isEqualTo("61c21622");
    }

    @Test
    void case_insensitive() {
        assertThat(hasher.hash("John Smith")).isEqualTo(hasher.hash("JOHN SMITH"));
        assertThat(hasher.hash("John Smith")).isNotEqualTo(hasher.hash("John Smyth"));
    }

    @Test
    @DisplayName("Overflowing hash is rendered without a sign")
    void no_negative_component() {
        String signature = hasher.hash("a considerably longer value that overflows the 32-bit fold");

        assertThat(signature).doesNotContain("-");
        assertThat(signature).endsWith("58");
    }

    @Test
    void never_contains_the_raw_value() {
        assertThat(hasher.hash("123-45-6789")).doesNotContain("123-45-6789");
    }

    @Test
    void lower_case_preserves_length() {
        assertThat(RedactionHasher.lowerCase("İstanbul")).hasSize(8);
    }
}
