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
 * Model-backed pass for structured PII written in non-standard ways: spelled-out digits,
 * odd separators, OCR confusions, and values whose label follows them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContextualPiiDetector {

    static final Set<PiiType> CONTEXTUAL_TYPES = EnumSet.of(
            PiiType.SSN, PiiType.ACCOUNT_NUMBER, PiiType.CREDIT_CARD, PiiType.PHONE, PiiType.DOB);

    static final double CONFIDENCE = 0.75;
    private static final String DEFAULT_CONTEXT = "Non-standard format detected by AI analysis";

    private final AiCompletionService aiCompletionService;
    private final DetectionPromptBuilder promptBuilder;
    private final FindingResponseParser responseParser;
    private final FindingEntityMapper entityMapper;

    /**
     * @param alreadyFound entities from earlier passes, listed to the model as "do not re-report"
     * @param typeFilter   requested types (null or empty for all)
     */
    public PassResult detect(String text, Collection<DetectedEntity> alreadyFound, Set<PiiType> typeFilter) {
        Set<PiiType> types = scope(typeFilter);
        if (types.isEmpty() || text == null || text.isBlank()) {
            return PassResult.empty();
        }

        try {
            LlmCallResult result = aiCompletionService.call(
                    promptBuilder.buildContextualSystemPrompt(alreadyFound, types),
                    promptBuilder.buildContextualUserMessage(text, types));

            FindingParseResult parsed = responseParser.parse(result.content(), types);
            if (parsed.isMalformed()) {
                log.warn("[Contextual] Unreadable model response, returning empty result: {}", parsed.error());
                return PassResult.degraded(result.promptTokens(), result.completionTokens());
            }

            List<DetectedEntity> entities = new ArrayList<>();
            int unanchored = 0;
            for (ModelFinding finding : parsed.findings()) {
                String context = finding.context() != null ? finding.context() : DEFAULT_CONTEXT;
                Optional<DetectedEntity.DetectedEntityBuilder> entity = entityMapper.toEntity(
                        text, finding, DetectionMethod.CONTEXTUAL, CONFIDENCE, context);
                if (entity.isPresent()) {
                    entities.add(entity.get().build());
                } else {
                    unanchored++;
                }
            }

            log.info("[Contextual] {} findings, {} anchored, {} not found in text, {} skipped",
                    parsed.findings().size(), entities.size(), unanchored, parsed.skipped());
            return PassResult.of(entities, result.promptTokens(), result.completionTokens());
        } catch (Exception e) {
            log.warn("[Contextual] LLM call failed, returning empty result: {}", e.getMessage());
            return PassResult.degraded(0, 0);
        }
    }

    static Set<PiiType> scope(Set<PiiType> typeFilter) {
        Set<PiiType> types = EnumSet.copyOf(CONTEXTUAL_TYPES);
        if (typeFilter != null && !typeFilter.isEmpty()) {
            types.retainAll(typeFilter);
        }
        return types;
    }
}
