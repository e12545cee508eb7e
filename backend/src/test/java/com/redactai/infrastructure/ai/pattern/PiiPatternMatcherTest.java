package com.redactai.infrastructure.ai.pattern;

import com.redactai.domain.redaction.model.DetectedEntity;
import com.redactai.domain.redaction.model.DetectionMethod;
import com.redactai.domain.redaction.model.PiiType;
import com.redactai.infrastructure.ai.merge.EntityMerger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PiiPatternMatcherTest {

    private PiiPatternMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new PiiPatternMatcher(new MaskingEngine(), new EntityMerger());
    }

    @Nested
    @DisplayName("SSN")
    class Ssn {

        @Test
        void dashed() {
            List<DetectedEntity> result = matcher.detect("SSN: 123-45-6789", null);

            assertThat(result).hasSize(1);
            DetectedEntity ssn = result.get(0);
            assertThat(ssn.getType()).isEqualTo(PiiType.SSN);
            assertThat(ssn.getValue()).isEqualTo("123-45-6789");
            assertThat(ssn.start()).isEqualTo(5);
            assertThat(ssn.end()).isEqualTo(16);
            assertThat(ssn.getMaskedValue()).isEqualTo("***-**-6789");
            assertThat(ssn.getConfidence()).isEqualTo(0.95);
            assertThat(ssn.getDetectionMethod()).isEqualTo(DetectionMethod.PATTERN);
        }

        @Test
        @DisplayName("Invalid area numbers are not SSNs")
        void invalid_area() {
            assertThat(matcher.detect("000-12-3456 and 666-12-3456", Set.of(PiiType.SSN))).isEmpty();
            assertThat(matcher.detect("900-12-3456 and 987-65-4321", Set.of(PiiType.SSN))).isEmpty();
        }

        @Test
        @DisplayName("Group 00 and serial 0000 are not SSNs")
        void invalid_group_and_serial() {
            assertThat(matcher.detect("123-00-4567", Set.of(PiiType.SSN))).isEmpty();
            assertThat(matcher.detect("123-45-0000", Set.of(PiiType.SSN))).isEmpty();
        }

        @Test
        void space_and_no_separator() {
            assertThat(matcher.detect("SSN 123 45 6789", Set.of(PiiType.SSN)))
                    .extracting(DetectedEntity::getValue).containsExactly("123 45 6789");
            assertThat(matcher.detect("SSN 123456789", Set.of(PiiType.SSN)))
                    .extracting(DetectedEntity::getValue).containsExactly("123456789");
        }

        @Test
        @DisplayName("Mixed separators are rejected")
        void mixed_separators() {
            assertThat(matcher.detect("SSN 123-45 6789", Set.of(PiiType.SSN))).isEmpty();
            assertThat(matcher.detect("SSN 123 45-6789", Set.of(PiiType.SSN))).isEmpty();
        }

        @Test
        @DisplayName("Nine bare digits: SSN outranks the account number reading")
        void bare_digits_prefer_ssn() {
            List<DetectedEntity> result = matcher.detect("SSN 123456789", null);

            assertThat(result).extracting(DetectedEntity::getType).containsExactly(PiiType.SSN);
        }
    }

    @Nested
    @DisplayName("Credit card")
    class CreditCard {

        @Test
        @DisplayName("Luhn-valid card wins over the account number reading of the same digits")
        void contiguous_card() {
            List<DetectedEntity> result = matcher.detect("Card: 4111111111111111", null);

            assertThat(result).hasSize(1);
            assertThat(result.get(0).getType()).isEqualTo(PiiType.CREDIT_CARD);
            assertThat(result.get(0).getMaskedValue()).isEqualTo("****-****-****-1111");
        }

        @Test
        void grouped_card() {
            List<DetectedEntity> result = matcher.detect("Card 4111 1111 1111 1111 on file", Set.of(PiiType.CREDIT_CARD));

            assertThat(result).hasSize(1);
            assertThat(result.get(0).getValue()).isEqualTo("4111 1111 1111 1111");
        }

        @Test
        @DisplayName("Every card network prefix is recognised")
        void card_networks() {
            List<String> cards = List.of(
                    "4111111111111111",   // Visa
                    "5105105105105100",   // Mastercard 51
                    "5555555555554444",   // Mastercard 55
                    "2200123456789019",   // Mastercard 2-series, low end
                    "2704123456789010",   // Mastercard 2-series, high end
                    "378282246310005",    // Amex 37
                    "341111111111111",    // Amex 34
                    "6011111111111117",   // Discover 6011
                    "6500123456789017",   // Discover 65
                    "6445644564456445",   // Discover 644
                    "6490123456789019");  // Discover 649

            for (String card : cards) {
                assertThat(matcher.detect("Card " + card, null))
                        .as(card)
                        .singleElement()
                        .satisfies(e -> {
                            assertThat(e.getType()).isEqualTo(PiiType.CREDIT_CARD);
                            assertThat(e.getValue()).isEqualTo(card);
                        });
            }
        }

        @Test
        @DisplayName("Mastercard 2-series stops at 2704")
        void mastercard_two_series_bounds() {
            assertThat(matcher.detect("Card 2705123456789019", Set.of(PiiType.CREDIT_CARD))).isEmpty();
            assertThat(matcher.detect("Card 2710123456789012", Set.of(PiiType.CREDIT_CARD))).isEmpty();
            assertThat(matcher.detect("Card 2199123456789012", Set.of(PiiType.CREDIT_CARD))).isEmpty();
        }

        @Test
        void grouped_two_series_card() {
            assertThat(matcher.detect("Card 2200-1234-5678-9019", Set.of(PiiType.CREDIT_CARD)))
                    .extracting(DetectedEntity::getValue).containsExactly("2200-1234-5678-9019");
            assertThat(matcher.detect("Card 2710 1234 5678 9012", Set.of(PiiType.CREDIT_CARD))).isEmpty();
        }

        @Test
        @DisplayName("Luhn failure: not reported as a card")
        void luhn_failure() {
            List<DetectedEntity> result = matcher.detect("Card: 4111111111111112", null);

            assertThat(result).extracting(DetectedEntity::getType).doesNotContain(PiiType.CREDIT_CARD);
            assertThat(matcher.detect("Card: 4111111111111112", Set.of(PiiType.CREDIT_CARD))).isEmpty();
        }

        @Test
        @DisplayName("Luhn check disabled: any card-shaped number is reported")
        void luhn_disabled() {
            ReflectionTestUtils.setField(matcher, "luhnCheck", false);

            assertThat(matcher.detect("Card: 4111111111111112", Set.of(PiiType.CREDIT_CARD))).hasSize(1);
        }

        @Test
        void luhn() {
            assertThat(PiiPatternMatcher.isValidLuhn("4111111111111111")).isTrue();
            assertThat(PiiPatternMatcher.isValidLuhn("4111-1111-1111-1111")).isTrue();
            assertThat(PiiPatternMatcher.isValidLuhn("4111111111111112")).isFalse();
            assertThat(PiiPatternMatcher.isValidLuhn("1234")).isFalse();
        }
    }

    @Nested
    @DisplayName("Other types")
    class OtherTypes {

        @Test
        void account_number_after_label() {
            List<DetectedEntity> result = matcher.detect("Account #: 1234567890123", null);

            assertThat(result).hasSize(1);
            assertThat(result.get(0).getType()).isEqualTo(PiiType.ACCOUNT_NUMBER);
            assertThat(result.get(0).getValue()).isEqualTo("1234567890123");
            assertThat(result.get(0).getMaskedValue()).isEqualTo("****0123");
            assertThat(result.get(0).getConfidence()).isEqualTo(0.80);
        }

        @Test
        void phone() {
            List<DetectedEntity> result = matcher.detect("Call (555) 234-5678 now", null);

            assertThat(result).hasSize(1);
            assertThat(result.get(0).getType()).isEqualTo(PiiType.PHONE);
            assertThat(result.get(0).getValue()).isEqualTo("(555) 234-5678");
            assertThat(result.get(0).getMaskedValue()).isEqualTo("(***) ***-5678");
        }

        @Test
        @DisplayName("Phone separators and country code")
        void phone_formats() {
            assertThat(matcher.detect("Call 555.234.5678", Set.of(PiiType.PHONE)))
                    .extracting(DetectedEntity::getValue).containsExactly("555.234.5678");
            assertThat(matcher.detect("Call 5552345678", Set.of(PiiType.PHONE)))
                    .extracting(DetectedEntity::getValue).containsExactly("5552345678");
            assertThat(matcher.detect("Call 555-234-5678", Set.of(PiiType.PHONE)))
                    .extracting(DetectedEntity::getValue).containsExactly("555-234-5678");
            assertThat(matcher.detect("+1 555 234 5678", Set.of(PiiType.PHONE)))
                    .extracting(DetectedEntity::getValue).containsExactly("+1 555 234 5678");
            assertThat(matcher.detect("Call 1-555-234-5678", Set.of(PiiType.PHONE)))
                    .singleElement()
                    .satisfies(e -> {
                        assertThat(e.getValue()).isEqualTo("1-555-234-5678");
                        assertThat(e.getMaskedValue()).isEqualTo("(***) ***-5678");
                    });
        }

        @Test
        void email() {
            List<DetectedEntity> result = matcher.detect("Contact john.doe@example.com today", null);

            assertThat(result).hasSize(1);
            assertThat(result.get(0).getType()).isEqualTo(PiiType.EMAIL);
            assertThat(result.get(0).getValue()).isEqualTo("john.doe@example.com");
            assertThat(result.get(0).getMaskedValue()).isEqualTo("j***@example.com");
        }

        @Test
        void date_of_birth_formats() {
            List<DetectedEntity> result = matcher.detect(
                    "DOB: 01/15/1985, also 1985-01-15 and January 15, 1985", Set.of(PiiType.DOB));

            assertThat(result).hasSize(3);
            assertThat(result).extracting(DetectedEntity::getValue)
                    .containsExactly("01/15/1985", "1985-01-15", "January 15, 1985");
            assertThat(result).allSatisfy(e -> assertThat(e.getMaskedValue()).isEqualTo("**/**/****"));
        }

        @Test
        void date_of_birth_abbreviated_month() {
            assertThat(matcher.detect("Born Jan 15 1985 in Ohio", Set.of(PiiType.DOB)))
                    .extracting(DetectedEntity::getValue).containsExactly("Jan 15 1985");
            assertThat(matcher.detect("Born Sept. 3rd, 1990", Set.of(PiiType.DOB)))
                    .extracting(DetectedEntity::getValue).containsExactly("Sept. 3rd, 1990");
        }
    }

    @Nested
    @DisplayName("Filtering and helpers")
    class Filtering {

        @Test
        void type_filter_limits_output() {
            List<DetectedEntity> result = matcher.detect("SSN 123-45-6789, email a@b.co", Set.of(PiiType.EMAIL));

            assertThat(result).extracting(DetectedEntity::getType).containsExactly(PiiType.EMAIL);
        }

        @Test
        void results_sorted_and_non_overlapping() {
            List<DetectedEntity> result = matcher.detect(
                    "a@b.co then 123-45-6789 then (555) 234-5678", null);

            assertThat(result).extracting(DetectedEntity::start).isSorted();
            for (int i = 1; i < result.size(); i++) {
                assertThat(result.get(i).overlaps(result.get(i - 1))).isFalse();
            }
        }

        @Test
        void empty_text() {
            assertThat(matcher.detect("", null)).isEmpty();
            assertThat(matcher.detect(null, null)).isEmpty();
        }

        @Test
        void extract_values_deduplicates() {
            assertThat(matcher.extractValues("SSN 123-45-6789, again 123-45-6789", PiiType.SSN))
                    .containsExactly("123-45-6789");
        }

        @Test
        void base_confidence() {
            assertThat(matcher.supports(PiiType.SSN)).isTrue();
            assertThat(matcher.supports(PiiType.NAME)).isFalse();
            assertThat(matcher.baseConfidence(PiiType.DOB)).hasValue(0.70);
        }
    }
}
