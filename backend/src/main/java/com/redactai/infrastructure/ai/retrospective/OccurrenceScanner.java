package com.redactai.infrastructure.ai.retrospective;

import com.redactai.domain.redaction.model.DetectedEntity;
import com.redactai.domain.redaction.model.DetectionMethod;
import com.redactai.domain.redaction.model.Span;
import com.redactai.infrastructure.ai.parsing.SpanLocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Finds every further occurrence of values that were already detected once.
 *
 * Values are keyed case-insensitively; the highest-confidence entity per key supplies the type,
 * confidence and masking of the new occurrences. Cost is O(distinct values x text length).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OccurrenceScanner {

    private final SpanLocator spanLocator;

    public List<DetectedEntity> scan(String text, Collection<DetectedEntity> known) {
        if (text == null || text.isEmpty() || known == null || known.isEmpty()) {
            return List.of();
        }

        Map<String, DetectedEntity> byValue = new LinkedHashMap<>();
        for (DetectedEntity entity : known) {
            String key = entity.getValue().toLowerCase(Locale.ROOT);
            DetectedEntity current = byValue.get(key);
            if (current == null || entity.getConfidence() > current.getConfidence()) {
                byValue.put(key, entity);
            }
        }

        Set<Span> knownSpans = new HashSet<>();
        for (DetectedEntity entity : known) {
            knownSpans.add(entity.getSpan());
        }

        List<DetectedEntity> additional = new ArrayList<>();
        for (DetectedEntity source : byValue.values()) {
            int length = source.getValue().length();
            for (int start : spanLocator.occurrences(text, source.getValue(), true)) {
                Span span = new Span(start, start + length);
                if (!knownSpans.add(span)) {
                    continue;
                }
                additional.add(DetectedEntity.builder()
                        .type(source.getType())
                        .value(text.substring(start, start + length))
                        .normalizedValue(source.getNormalizedValue())
                        .maskedValue(source.getMaskedValue())
                        .span(span)
                        .confidence(source.getConfidence())
                        .detectionMethod(DetectionMethod.RETROSPECTIVE)
                        .context("Additional occurrence of \"" + source.getValue() + "\"")
                        .build());
            }
        }

        log.info("[Retrospective] {} distinct values, {} additional occurrences", byValue.size(), additional.size());
        return additional;
    }
}
