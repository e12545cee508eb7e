package com.redactai.infrastructure.ai.parsing;

import com.redactai.domain.redaction.model.Span;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SpanLocatorTest {

    private static final String TEXT = "Jane Doe met jane doe and Jane Doe again";

    private final SpanLocator locator = new SpanLocator();

    @Test
    @DisplayName("Exact match at the hinted offset")
    void exact_hint() {
        assertThat(locator.locate(TEXT, "Jane Doe", 26)).contains(new Span(26, 34));
    }

    @Test
    @DisplayName("Wrong hint: nearest exact occurrence")
    void nearest_exact() {
        assertThat(locator.locate(TEXT, "Jane Doe", 20)).contains(new Span(26, 34));
        assertThat(locator.locate(TEXT, "Jane Doe", null)).contains(new Span(0, 8));
    }

    @Test
    @DisplayName("Case-insensitive fallback")
    void case_insensitive() {
        assertThat(locator.locate(TEXT, "JANE DOE", 14)).contains(new Span(13, 21));
    }

    @Test
    void value_is_trimmed() {
        assertThat(locator.locate(TEXT, " Jane Doe ", 0)).contains(new Span(0, 8));
    }

    @Test
    void absent_value() {
        assertThat(locator.locate(TEXT, "John Smith", 0)).isEmpty();
        assertThat(locator.locate(TEXT, "  ", 0)).isEmpty();
        assertThat(locator.locate(null, "Jane", 0)).isEmpty();
    }

    @Test
    void occurrences_include_overlaps() {
        assertThat(locator.occurrences("aaaa", "aaa", false)).containsExactly(0, 1);
        assertThat(locator.occurrences(TEXT, "jane doe", true)).containsExactly(0, 13, 26);
        assertThat(locator.occurrences(TEXT, "", true)).isEmpty();
    }
}
