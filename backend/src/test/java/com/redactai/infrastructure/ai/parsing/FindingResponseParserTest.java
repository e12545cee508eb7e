package com.redactai.infrastructure.ai.parsing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.redactai.domain.redaction.model.PiiType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FindingResponseParserTest {

    private static final Set<PiiType> ALL = EnumSet.allOf(PiiType.class);

    private final FindingResponseParser parser = new FindingResponseParser(new ObjectMapper());

    @Nested
    @DisplayName("Accepted shapes")
    class AcceptedShapes {

        @Test
        void plain_array() {
            FindingParseResult result = parser.parse("""
                    [{"type": "SSN", "value": "one two three", "normalizedValue": "123", "startIndex": 4, "endIndex": 17, "context": "spelled out"}]
                    """, ALL);

            assertThat(result.isMalformed()).isFalse();
            assertThat(result.findings()).hasSize(1);
            ModelFinding finding = result.findings().get(0);
            assertThat(finding.type()).isEqualTo(PiiType.SSN);
            assertThat(finding.value()).isEqualTo("one two three");
            assertThat(finding.normalizedValue()).isEqualTo("123");
            assertThat(finding.startIndex()).isEqualTo(4);
            assertThat(finding.endIndex()).isEqualTo(17);
            assertThat(finding.context()).isEqualTo("spelled out");
            assertThat(finding.confidence()).isNull();
        }

        @Test
        void fenced_block() {
            FindingParseResult result = parser.parse(
                    "```json\n[{\"type\": \"NAME\", \"value\": \"Jane Doe\"}]\n```", ALL);

            assertThat(result.findings()).extracting(ModelFinding::value).containsExactly("Jane Doe");
        }

        @Test
        void object_wrapping_array() {
            FindingParseResult result = parser.parse(
                    "{\"findings\": [{\"type\": \"NAME\", \"value\": \"Jane Doe\", \"confidence\": 0.9}]}", ALL);

            assertThat(result.findings()).hasSize(1);
            assertThat(result.findings().get(0).confidence()).isEqualTo(0.9);
        }

        @Test
        void surrounding_chatter() {
            FindingParseResult result = parser.parse(
                    "Here is what I found: [{\"type\": \"EMAIL\", \"value\": \"a@b.co\"}] Hope this helps.", ALL);

            assertThat(result.findings()).hasSize(1);
        }

        @Test
        @DisplayName("start/end spellings and numeric strings")
        void offset_aliases() {
            FindingParseResult result = parser.parse(
                    "[{\"type\": \"name\", \"value\": \"Jane\", \"start\": \"12\", \"end\": 16, \"relatedTo\": \"Jane Doe\"}]", ALL);

            ModelFinding finding = result.findings().get(0);
            assertThat(finding.type()).isEqualTo(PiiType.NAME);
            assertThat(finding.startIndex()).isEqualTo(12);
            assertThat(finding.endIndex()).isEqualTo(16);
            assertThat(finding.relatedTo()).isEqualTo("Jane Doe");
        }

        @Test
        void empty_payloads_are_ok() {
            assertThat(parser.parse("", ALL).isMalformed()).isFalse();
            assertThat(parser.parse(null, ALL).findings()).isEmpty();
            assertThat(parser.parse("[]", ALL).findings()).isEmpty();
            assertThat(parser.parse("```json\n```", ALL).isMalformed()).isFalse();
        }
    }

    @Nested
    @DisplayName("Skipped findings")
    class Skipped {

        @Test
        void unknown_disallowed_and_blank() {
            FindingParseResult result = parser.parse("""
                    [
                      {"type": "PASSPORT", "value": "X1234567"},
                      {"type": "EMAIL", "value": "a@b.co"},
                      {"type": "SSN", "value": "   "},
                      {"type": "SSN", "value": "123-45-6789"},
                      "not an object"
                    ]
                    """, EnumSet.of(PiiType.SSN));

            assertThat(result.findings()).extracting(ModelFinding::value).containsExactly("123-45-6789");
            assertThat(result.skipped()).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("Unusable offsets")
    class UnusableOffsets {

        @Test
        @DisplayName("Offsets beyond the int range are dropped, the finding is kept")
        void out_of_range_offsets() {
            FindingParseResult result = parser.parse("""
                    [
                      {"type": "SSN", "value": "123-45-6789", "startIndex": "99999999999", "endIndex": 99999999999},
                      {"type": "PHONE", "value": "555 123 4567", "startIndex": "999999999999999999999", "endIndex": 24}
                    ]
                    """, ALL);

            assertThat(result.isMalformed()).isFalse();
            assertThat(result.findings()).hasSize(2);
            assertThat(result.findings().get(0).startIndex()).isNull();
            assertThat(result.findings().get(0).endIndex()).isNull();
            assertThat(result.findings().get(1).startIndex()).isNull();
            assertThat(result.findings().get(1).endIndex()).isEqualTo(24);
        }

        @Test
        void fractional_and_non_numeric_offsets() {
            FindingParseResult result = parser.parse(
                    "[{\"type\": \"EMAIL\", \"value\": \"a@b.co\", \"startIndex\": 4.5, \"endIndex\": \"ten\"}]", ALL);

            ModelFinding finding = result.findings().get(0);
            assertThat(finding.startIndex()).isNull();
            assertThat(finding.endIndex()).isNull();
        }
    }

    @Nested
    @DisplayName("Malformed payloads")
    class Malformed {

        @Test
        void not_json() {
            FindingParseResult result = parser.parse("I could not find anything useful.", ALL);

            assertThat(result.isMalformed()).isTrue();
            assertThat(result.findings()).isEmpty();
        }

        @Test
        void object_without_array() {
            assertThat(parser.parse("{\"status\": \"none\"}", ALL).isMalformed()).isTrue();
        }

        @Test
        void truncated_array() {
            assertThat(parser.parse("[{\"type\": \"SSN\", \"value\": \"123", ALL).isMalformed()).isTrue();
        }
    }
}
