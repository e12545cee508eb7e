package com.redactai.infrastructure.ai.retrospective;

import com.redactai.domain.redaction.model.DetectedEntity;
import com.redactai.domain.redaction.model.DetectionMethod;
import com.redactai.domain.redaction.model.PiiType;
import com.redactai.infrastructure.ai.AiCompletionService;
import com.redactai.infrastructure.ai.DetectionPromptBuilder;
import com.redactai.infrastructure.ai.LlmCallResult;
import com.redactai.infrastructure.ai.detection.FindingEntityMapper;
import com.redactai.infrastructure.ai.detection.PassResult;
import com.redactai.infrastructure.ai.parsing.FindingParseResult;
import com.redactai.infrastructure.ai.parsing.FindingResponseParser;
import com.redactai.infrastructure.ai.parsing.ModelFinding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Asks the model for aliases, partial references and other variants of names and addresses
 * already found. Each variant keeps a reference to the entity it stands for.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntityVariationFinder {

    static final double DEFAULT_CONFIDENCE = 0.8;
    private static final String DEFAULT_CONTEXT = "AI retrospective analysis";

    private final AiCompletionService aiCompletionService;
    private final DetectionPromptBuilder promptBuilder;
    private final FindingResponseParser responseParser;
    private final FindingEntityMapper entityMapper;

    public PassResult find(String text, Collection<DetectedEntity> known) {
        Map<String, DetectedEntity> names = canonicalByValue(known, PiiType.NAME);
        Map<String, DetectedEntity> addresses = canonicalByValue(known, PiiType.ADDRESS);
        if ((names.isEmpty() && addresses.isEmpty()) || text == null || text.isBlank()) {
            return PassResult.empty();
        }

        Set<PiiType> types = EnumSet.noneOf(PiiType.class);
        if (!names.isEmpty()) types.add(PiiType.NAME);
        if (!addresses.isEmpty()) types.add(PiiType.ADDRESS);

        Map<String, DetectedEntity> canonical = new LinkedHashMap<>(names);
        canonical.putAll(addresses);

        try {
            LlmCallResult result = aiCompletionService.call(
                    promptBuilder.buildVariationSystemPrompt(originalValues(names), originalValues(addresses)),
                    promptBuilder.buildVariationUserMessage(text));

            FindingParseResult parsed = responseParser.parse(result.content(), types);
            if (parsed.isMalformed()) {
                log.warn("[Variations] Unreadable model response, returning empty result: {}", parsed.error());
                return PassResult.degraded(result.promptTokens(), result.completionTokens());
            }

            List<DetectedEntity> entities = new ArrayList<>();
            for (ModelFinding finding : parsed.findings()) {
                DetectedEntity related = finding.relatedTo() != null
                        ? canonical.get(finding.relatedTo().toLowerCase(Locale.ROOT))
                        : null;
                String context = finding.relatedTo() != null
                        ? "Variation of \"" + finding.relatedTo() + "\""
                        : DEFAULT_CONTEXT;
                double confidence = FindingEntityMapper.clampConfidence(finding.confidence(), DEFAULT_CONFIDENCE);

                entityMapper.toEntity(text, finding, DetectionMethod.RETROSPECTIVE, confidence, context)
                        .ifPresent(builder -> entities.add(builder
                                .canonicalEntityId(related != null ? related.getId() : null)
                                .build()));
            }

            log.info("[Variations] {} findings, {} anchored", parsed.findings().size(), entities.size());
            return PassResult.of(entities, result.promptTokens(), result.completionTokens());
        } catch (Exception e) {
            log.warn("[Variations] LLM call failed, returning empty result: {}", e.getMessage());
            return PassResult.degraded(0, 0);
        }
    }

    private Map<String, DetectedEntity> canonicalByValue(Collection<DetectedEntity> known, PiiType type) {
        Map<String, DetectedEntity> result = new LinkedHashMap<>();
        if (known == null) {
            return result;
        }
        for (DetectedEntity entity : known) {
            if (entity.getType() == type) {
                result.putIfAbsent(entity.getValue().toLowerCase(Locale.ROOT), entity);
            }
        }
        return result;
    }

    private List<String> originalValues(Map<String, DetectedEntity> byValue) {
        return byValue.values().stream().map(DetectedEntity::getValue).toList();
    }
}
