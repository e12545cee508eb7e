package com.redactai.infrastructure.ai.pattern;

import com.redactai.domain.redaction.model.DetectedEntity;
import com.redactai.domain.redaction.model.DetectionMethod;
import com.redactai.domain.redaction.model.PiiType;
import com.redactai.domain.redaction.model.Span;
import com.redactai.infrastructure.ai.merge.EntityMerger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic pass: extracts structured PII (SSN, card and account numbers, phones, emails,
 * dates of birth) with per-type regular expressions and validators.
 *
 * Overlapping hits within this pass are pre-merged; the higher-confidence type wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PiiPatternMatcher {

    static final String CONTEXT = "Standard format detected by pattern matching";

    private final MaskingEngine maskingEngine;
    private final EntityMerger entityMerger;

    @Value("${redaction.pattern.luhn-check:true}")
    private boolean luhnCheck = true;

    /**
     * @param valueGroup capturing group holding the value (0 for the whole match)
     */
    private record PatternEntry(Pattern pattern, PiiType type, int valueGroup, double confidence,
                                Predicate<String> validator) {}

    private static final Predicate<String> ALWAYS = v -> true;

    private static final Pattern SSN_PATTERN = Pattern.compile(
            "\\b(?!000|666|9\\d{2})\\d{3}([-\\s]?)(?!00)\\d{2}\\1(?!0000)\\d{4}\\b");

    // Visa, Mastercard (51-55, 2200-2704), Amex, Discover (6011, 65, 644-649)
    private static final Pattern CARD_CONTIGUOUS_PATTERN = Pattern.compile(
            "\\b(?:4\\d{12}(?:\\d{3})?"
                    + "|5[1-5]\\d{14}"
                    + "|2(?:2\\d{2}|[3-6]\\d{2}|70[0-4])\\d{12}"
                    + "|3[47]\\d{13}"
                    + "|6(?:011\\d{12}|5\\d{14}|4[4-9]\\d{13}))\\b");

    private static final Pattern CARD_GROUPED_PATTERN = Pattern.compile(
            "\\b(?:4\\d{3}|5[1-5]\\d{2}|2(?:2\\d{2}|[3-6]\\d{2}|70[0-4])|6(?:011|5\\d{2}|4[4-9]\\d))([-\\s])\\d{4}\\1\\d{4}\\1\\d{4}\\b");

    private static final Pattern ACCOUNT_PATTERN = Pattern.compile(
            "(?:\\b(?:account|acct)\\.?\\s*(?:number|num|no\\.?|#)?\\s*[:#]?\\s*)?\\b(\\d{8,17})\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern PHONE_PATTERN = Pattern.compile(
            "(?<![\\w+])(?:\\+?1[-.\\s]?)?(?:\\(?[2-9]\\d{2}\\)?[-.\\s]?)?[2-9]\\d{2}[-.\\s]?\\d{4}\\b");

    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");

    private static final Pattern DOB_NUMERIC_PATTERN = Pattern.compile(
            "\\b(?:0?[1-9]|1[0-2])([-/])(?:0?[1-9]|[12]\\d|3[01])\\1(?:19|20)\\d{2}\\b");

    private static final Pattern DOB_ISO_PATTERN = Pattern.compile(
            "\\b(?:19|20)\\d{2}-(?:0[1-9]|1[0-2])-(?:0[1-9]|[12]\\d|3[01])\\b");

    private static final Pattern DOB_SPELLED_PATTERN = Pattern.compile(
            "\\b(?:jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?"
                    + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)\\.?\\s+"
                    + "(?:0?[1-9]|[12]\\d|3[01])(?:st|nd|rd|th)?,?\\s+(?:19|20)\\d{2}\\b",
            Pattern.CASE_INSENSITIVE);

    private List<PatternEntry> patterns() {
        Predicate<String> cardValidator = v -> !luhnCheck || isValidLuhn(v);
        return List.of(
                new PatternEntry(SSN_PATTERN, PiiType.SSN, 0, 0.95, ALWAYS),
                new PatternEntry(CARD_CONTIGUOUS_PATTERN, PiiType.CREDIT_CARD, 0, 0.95, cardValidator),
                new PatternEntry(CARD_GROUPED_PATTERN, PiiType.CREDIT_CARD, 0, 0.95, cardValidator),
                new PatternEntry(ACCOUNT_PATTERN, PiiType.ACCOUNT_NUMBER, 1, 0.80, ALWAYS),
                new PatternEntry(PHONE_PATTERN, PiiType.PHONE, 0, 0.85, PiiPatternMatcher::hasPhoneDigitCount),
                new PatternEntry(EMAIL_PATTERN, PiiType.EMAIL, 0, 0.95, ALWAYS),
                new PatternEntry(DOB_NUMERIC_PATTERN, PiiType.DOB, 0, 0.70, ALWAYS),
                new PatternEntry(DOB_ISO_PATTERN, PiiType.DOB, 0, 0.70, ALWAYS),
                new PatternEntry(DOB_SPELLED_PATTERN, PiiType.DOB, 0, 0.70, ALWAYS)
        );
    }

    /**
     * Detect structured PII in the text.
     *
     * @param text       the input text
     * @param typeFilter types to look for (null or empty for every pattern-capable type)
     * @return non-overlapping entities sorted by start offset
     */
    public List<DetectedEntity> detect(String text, Set<PiiType> typeFilter) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<DetectedEntity> raw = new ArrayList<>();
        for (PatternEntry entry : patterns()) {
            if (typeFilter != null && !typeFilter.isEmpty() && !typeFilter.contains(entry.type())) {
                continue;
            }
            Matcher matcher = entry.pattern().matcher(text);
            while (matcher.find()) {
                String value = matcher.group(entry.valueGroup());
                if (value == null || value.isEmpty() || !entry.validator().test(value)) {
                    continue;
                }
                raw.add(DetectedEntity.builder()
                        .type(entry.type())
                        .value(value)
                        .maskedValue(maskingEngine.mask(entry.type(), value))
                        .span(new Span(matcher.start(entry.valueGroup()), matcher.end(entry.valueGroup())))
                        .confidence(entry.confidence())
                        .detectionMethod(DetectionMethod.PATTERN)
                        .context(CONTEXT)
                        .build());
            }
        }

        List<DetectedEntity> merged = entityMerger.merge(raw);
        log.info("[Pattern] {} raw matches, {} after merge", raw.size(), merged.size());
        return merged;
    }

    /**
     * Literal values of the given type found in a passage, in order of first appearance.
     * Used to turn semantic search passages back into concrete values.
     */
    public Set<String> extractValues(String passage, PiiType type) {
        Set<String> values = new LinkedHashSet<>();
        for (DetectedEntity entity : detect(passage, Set.of(type))) {
            values.add(entity.getValue());
        }
        return values;
    }

    public boolean supports(PiiType type) {
        return baseConfidence(type).isPresent();
    }

    public OptionalDouble baseConfidence(PiiType type) {
        Map<PiiType, Double> confidences = new EnumMap<>(PiiType.class);
        for (PatternEntry entry : patterns()) {
            confidences.putIfAbsent(entry.type(), entry.confidence());
        }
        Double confidence = confidences.get(type);
        return confidence != null ? OptionalDouble.of(confidence) : OptionalDouble.empty();
    }

    static boolean isValidLuhn(String number) {
        String digits = number.replaceAll("[^0-9]", "");
        if (digits.length() < 13 || digits.length() > 19) {
            return false;
        }
        int sum = 0;
        boolean alternate = false;
        for (int i = digits.length() - 1; i >= 0; --i) {
            int digit = digits.charAt(i) - '0';
            if (alternate) {
                digit *= 2;
                if (digit > 9) {
                    digit -= 9;
                }
            }
            sum += digit;
            alternate = !alternate;
        }
        return sum % 10 == 0;
    }

    private static boolean hasPhoneDigitCount(String value) {
        long digits = value.chars().filter(Character::isDigit).count();
        return digits == 7 || digits == 10 || digits == 11;
    }
}
