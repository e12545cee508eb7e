package com.redactai.infrastructure.ai.pipeline;

import com.redactai.domain.redaction.model.DetectedEntity;
import com.redactai.domain.redaction.model.DetectionResult;
import com.redactai.domain.redaction.model.DetectionStats;
import com.redactai.domain.redaction.model.DocumentContext;
import com.redactai.domain.redaction.model.PiiType;
import com.redactai.domain.redaction.service.PiiDetectionService;
import com.redactai.infrastructure.ai.detection.ContextualPiiDetector;
import com.redactai.infrastructure.ai.detection.PassResult;
import com.redactai.infrastructure.ai.detection.UnstructuredPiiDetector;
import com.redactai.infrastructure.ai.merge.EntityMerger;
import com.redactai.infrastructure.ai.pattern.MaskingEngine;
import com.redactai.infrastructure.ai.pattern.PiiPatternMatcher;
import com.redactai.infrastructure.ai.retrospective.EntityVariationFinder;
import com.redactai.infrastructure.ai.retrospective.OccurrenceScanner;
import com.redactai.infrastructure.ai.semantic.SemanticSearchExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Multi-pass detection pipeline:
 *   A) pattern matching
 *   B) contextual + unstructured model passes (parallel), merged with A
 *   C) retrospective occurrence scan + variation discovery, merged with B
 *   D) optional semantic search extraction, final merge
 *   E) page attribution
 *
 * Every model-backed pass degrades to an empty result on failure; pattern hits always survive.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PiiDetectionPipeline implements PiiDetectionService {

    private static final char PAGE_BREAK = '\f';

    private final PiiPatternMatcher patternMatcher;
    private final ContextualPiiDetector contextualDetector;
    private final UnstructuredPiiDetector unstructuredDetector;
    private final OccurrenceScanner occurrenceScanner;
    private final EntityVariationFinder variationFinder;
    private final SemanticSearchExtractor semanticSearchExtractor;
    private final EntityMerger entityMerger;
    private final MaskingEngine maskingEngine;
    private final PassGate passGate;

    @Value("${redaction.pipeline.pass-timeout-seconds:90}")
    private long passTimeoutSeconds = 90;

    @Override
    public DetectionResult detect(String text, Set<PiiType> typeFilter, DocumentContext documentContext) {
        long startTime = System.currentTimeMillis();
        if (text == null || text.isEmpty()) {
            return new DetectionResult(List.of(),
                    new DetectionStats(0, 0, 0, 0, 0, 0, 0, List.of(), 0, 0, 0));
        }

        Set<PiiType> requested = resolveTypes(typeFilter);
        List<String> degraded = new ArrayList<>();
        long promptTokens = 0;
        long completionTokens = 0;

        // A) Pattern matching
        List<DetectedEntity> setA = patternMatcher.detect(text, requested);

        // B) Contextual + Unstructured, both fed A, run in parallel
        CompletableFuture<PassResult> contextualFuture = passGate.shouldFireContextual(requested)
                ? launch("contextual", () -> contextualDetector.detect(text, setA, requested))
                : CompletableFuture.completedFuture(PassResult.empty());
        CompletableFuture<PassResult> unstructuredFuture = passGate.shouldFireUnstructured(requested)
                ? launch("unstructured", () -> unstructuredDetector.detect(text, setA, requested))
                : CompletableFuture.completedFuture(PassResult.empty());

        PassResult contextual = contextualFuture.join();
        PassResult unstructured = unstructuredFuture.join();
        promptTokens += contextual.promptTokens() + unstructured.promptTokens();
        completionTokens += contextual.completionTokens() + unstructured.completionTokens();
        if (contextual.degraded()) degraded.add("contextual");
        if (unstructured.degraded()) degraded.add("unstructured");

        List<DetectedEntity> setB = entityMerger.mergeAll(
                setA,
                entityMerger.merge(contextual.entities()),
                entityMerger.merge(unstructured.entities()));

        // C) Retrospective: every occurrence of known values + model-found variations
        List<DetectedEntity> occurrences = entityMerger.merge(occurrenceScanner.scan(text, setB));
        PassResult variations = passGate.shouldFireVariations(setB)
                ? variationFinder.find(text, setB)
                : PassResult.empty();
        promptTokens += variations.promptTokens();
        completionTokens += variations.completionTokens();
        if (variations.degraded()) degraded.add("variations");

        List<DetectedEntity> setC = entityMerger.mergeAll(
                setB, occurrences, entityMerger.merge(variations.entities()));

        // D) Optional semantic search
        PassResult semantic = passGate.shouldFireSemanticSearch(documentContext)
                ? semanticSearchExtractor.extract(text, requested, documentContext)
                : PassResult.empty();
        if (semantic.degraded()) degraded.add("semantic");

        List<DetectedEntity> merged = entityMerger.mergeAll(setC, entityMerger.merge(semantic.entities()));

        // E) Page attribution
        List<DetectedEntity> entities = assignPageNumbers(text, merged);

        long elapsed = System.currentTimeMillis() - startTime;
        DetectionStats stats = new DetectionStats(
                setA.size(),
                contextual.entities().size(),
                unstructured.entities().size(),
                occurrences.size(),
                variations.entities().size(),
                semantic.entities().size(),
                entities.size(),
                List.copyOf(degraded),
                promptTokens,
                completionTokens,
                elapsed);

        log.info("[Pipeline] Detection complete: pattern={}, contextual={}, unstructured={}, occurrences={}, variations={}, semantic={}, final={}, degraded={}, tokens={}/{}, {}ms",
                stats.patternCount(), stats.contextualCount(), stats.unstructuredCount(), stats.occurrenceCount(),
                stats.variationCount(), stats.semanticCount(), stats.finalCount(), degraded,
                promptTokens, completionTokens, elapsed);

        return new DetectionResult(entities, stats);
    }

    @Override
    public String maskEntity(PiiType type, String value) {
        return maskingEngine.mask(type, value);
    }

    /**
     * Null or empty filter means every type except CUSTOM, which has no detector.
     */
    static Set<PiiType> resolveTypes(Set<PiiType> typeFilter) {
        if (typeFilter == null || typeFilter.isEmpty()) {
            return EnumSet.complementOf(EnumSet.of(PiiType.CUSTOM));
        }
        return EnumSet.copyOf(typeFilter);
    }

    private CompletableFuture<PassResult> launch(String passName, Supplier<PassResult> pass) {
        return CompletableFuture.supplyAsync(pass)
                .completeOnTimeout(PassResult.degraded(0, 0), passTimeoutSeconds, TimeUnit.SECONDS)
                .exceptionally(e -> {
                    log.warn("[Pipeline] {} pass failed, continuing without it: {}", passName, e.getMessage());
                    return PassResult.degraded(0, 0);
                });
    }

    /**
     * Page = 1 + number of form feeds before the entity start.
     */
    List<DetectedEntity> assignPageNumbers(String text, List<DetectedEntity> entities) {
        if (text.indexOf(PAGE_BREAK) < 0) {
            return entities;
        }

        List<DetectedEntity> result = new ArrayList<>(entities.size());
        int page = 1;
        int scanned = 0;
        // entities are sorted by start, so a single forward scan suffices
        for (DetectedEntity entity : entities) {
            while (scanned < entity.start()) {
                if (text.charAt(scanned) == PAGE_BREAK) {
                    page++;
                }
                scanned++;
            }
            result.add(entity.toBuilder().pageNumber(page).build());
        }
        return result;
    }
}
