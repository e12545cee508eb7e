package com.redactai.infrastructure.ai.semantic;

import com.redactai.domain.redaction.model.DetectedEntity;
import com.redactai.domain.redaction.model.DetectionMethod;
import com.redactai.domain.redaction.model.DocumentContext;
import com.redactai.domain.redaction.model.PiiType;
import com.redactai.domain.redaction.model.Span;
import com.redactai.infrastructure.ai.detection.PassResult;
import com.redactai.infrastructure.ai.parsing.SpanLocator;
import com.redactai.infrastructure.ai.pattern.MaskingEngine;
import com.redactai.infrastructure.ai.pattern.PiiPatternMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Uses the document's semantic index to surface passages likely to hold PII, re-applies the
 * pattern extractors to those passages and locates every extracted value in the analysed text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SemanticSearchExtractor {

    private static final Map<PiiType, List<String>> QUERIES = new EnumMap<>(PiiType.class);

    static {
        QUERIES.put(PiiType.SSN, List.of(
                "social security number or taxpayer identification",
                "SSN tax ID"));
        QUERIES.put(PiiType.ACCOUNT_NUMBER, List.of(
                "bank account number or routing number",
                "account holder financial account"));
        QUERIES.put(PiiType.CREDIT_CARD, List.of(
                "credit card or debit card number",
                "card payment details"));
        QUERIES.put(PiiType.PHONE, List.of(
                "phone number or contact telephone",
                "mobile cell number"));
        QUERIES.put(PiiType.EMAIL, List.of(
                "email address contact"));
        QUERIES.put(PiiType.DOB, List.of(
                "date of birth or birthday",
                "born on"));
    }

    private final SemanticSearchClient searchClient;
    private final PiiPatternMatcher patternMatcher;
    private final SpanLocator spanLocator;
    private final MaskingEngine maskingEngine;

    @Value("${semantic-search.method:hybrid}")
    private String method = "hybrid";

    @Value("${semantic-search.top-k:5}")
    private int topK = 5;

    private record Candidate(PiiType type, String query) {}

    public PassResult extract(String text, Set<PiiType> types, DocumentContext documentContext) {
        if (text == null || text.isEmpty() || documentContext == null || !documentContext.isComplete()) {
            return PassResult.empty();
        }

        Map<String, Candidate> values = new LinkedHashMap<>();
        int attempted = 0;
        int failed = 0;

        for (Map.Entry<PiiType, List<String>> entry : QUERIES.entrySet()) {
            PiiType type = entry.getKey();
            if ((types != null && !types.isEmpty() && !types.contains(type)) || !patternMatcher.supports(type)) {
                continue;
            }
            for (String query : entry.getValue()) {
                attempted++;
                List<SearchPassage> passages;
                try {
                    passages = searchClient.search(
                            documentContext.vaultId(), documentContext.documentId(), query, method, topK);
                } catch (SemanticSearchException e) {
                    failed++;
                    log.warn("[SemanticSearch] Query for {} failed, skipping: {}", type, e.getMessage());
                    continue;
                }
                log.debug("[SemanticSearch] {} query: {} passages, top score {}", type, passages.size(),
                        passages.stream().mapToDouble(SearchPassage::score).max().orElse(0.0));
                for (SearchPassage passage : passages) {
                    if (passage.documentId() != null && !passage.documentId().equals(documentContext.documentId())) {
                        continue;
                    }
                    for (String value : patternMatcher.extractValues(passage.text(), type)) {
                        values.putIfAbsent(value, new Candidate(type, query));
                    }
                }
            }
        }

        if (attempted > 0 && failed == attempted) {
            log.warn("[SemanticSearch] Index unavailable ({} queries failed), returning empty result", failed);
            return PassResult.degraded(0, 0);
        }

        List<DetectedEntity> entities = new ArrayList<>();
        for (Map.Entry<String, Candidate> entry : values.entrySet()) {
            String value = entry.getKey();
            Candidate candidate = entry.getValue();
            double confidence = patternMatcher.baseConfidence(candidate.type()).orElse(0.5);
            for (int start : spanLocator.occurrences(text, value, false)) {
                entities.add(DetectedEntity.builder()
                        .type(candidate.type())
                        .value(value)
                        .maskedValue(maskingEngine.mask(candidate.type(), value))
                        .span(new Span(start, start + value.length()))
                        .confidence(confidence)
                        .detectionMethod(DetectionMethod.SEMANTIC)
                        .context("Found via semantic search: \"" + candidate.query() + "\"")
                        .build());
            }
        }

        log.info("[SemanticSearch] {} queries ({} failed), {} distinct values, {} occurrences",
                attempted, failed, values.size(), entities.size());
        return PassResult.of(entities, 0, 0);
    }
}
