package com.redactai.infrastructure.ai.detection;

import com.redactai.domain.redaction.model.DetectedEntity;
import com.redactai.domain.redaction.model.DetectionMethod;
import com.redactai.domain.redaction.model.PiiType;
import com.redactai.infrastructure.ai.AiCompletionService;
import com.redactai.infrastructure.ai.DetectionPromptBuilder;
import com.redactai.infrastructure.ai.LlmCallResult;
import com.redactai.infrastructure.ai.parsing.FindingParseResult;
import com.redactai.infrastructure.ai.parsing.FindingResponseParser;
import com.redactai.infrastructure.ai.parsing.ModelFinding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Model-backed pass for names and addresses, which have no reliable pattern.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UnstructuredPiiDetector {

    static final Set<PiiType> UNSTRUCTURED_TYPES = EnumSet.of(PiiType.NAME, PiiType.ADDRESS);

    static final double DEFAULT_CONFIDENCE = 0.85;
    private static final String DEFAULT_CONTEXT = "Detected by AI analysis";

    private final AiCompletionService aiCompletionService;
    private final DetectionPromptBuilder promptBuilder;
    private final FindingResponseParser responseParser;
    private final FindingEntityMapper entityMapper;

    public PassResult detect(String text, Collection<DetectedEntity> alreadyFound, Set<PiiType> typeFilter) {
        Set<PiiType> types = scope(typeFilter);
        if (types.isEmpty() || text == null || text.isBlank()) {
            return PassResult.empty();
        }

        try {
            LlmCallResult result = aiCompletionService.call(
                    promptBuilder.buildUnstructuredSystemPrompt(alreadyFound, types),
                    promptBuilder.buildUnstructuredUserMessage(text));

            FindingParseResult parsed = responseParser.parse(result.content(), types);
            if (parsed.isMalformed()) {
                log.warn("[Unstructured] Unreadable model response, returning empty result: {}", parsed.error());
                return PassResult.degraded(result.promptTokens(), result.completionTokens());
            }

            List<DetectedEntity> entities = new ArrayList<>();
            for (ModelFinding finding : parsed.findings()) {
                double confidence = FindingEntityMapper.clampConfidence(finding.confidence(), DEFAULT_CONFIDENCE);
                String context = finding.context() != null ? finding.context() : DEFAULT_CONTEXT;
                Optional<DetectedEntity.DetectedEntityBuilder> entity = entityMapper.toEntity(
                        text, finding, DetectionMethod.UNSTRUCTURED, confidence, context);
                entity.ifPresent(builder -> entities.add(builder.build()));
            }

            log.info("[Unstructured] {} findings, {} anchored", parsed.findings().size(), entities.size());
            return PassResult.of(entities, result.promptTokens(), result.completionTokens());
        } catch (Exception e) {
            log.warn("[Unstructured] LLM call failed, returning empty result: {}", e.getMessage());
            return PassResult.degraded(0, 0);
        }
    }

    static Set<PiiType> scope(Set<PiiType> typeFilter) {
        Set<PiiType> types = EnumSet.copyOf(UNSTRUCTURED_TYPES);
        if (typeFilter != null && !typeFilter.isEmpty()) {
            types.retainAll(typeFilter);
        }
        return types;
    }
}
