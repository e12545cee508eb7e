package com.redactai.infrastructure.ai.pipeline;

import com.redactai.domain.redaction.model.DetectedEntity;
import com.redactai.domain.redaction.model.DocumentContext;
import com.redactai.domain.redaction.model.PiiType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Evaluates gating conditions for the optional detection passes.
 */
@Slf4j
@Component
public class PassGate {

    private static final Set<PiiType> CONTEXTUAL_TYPES = EnumSet.of(
            PiiType.SSN, PiiType.ACCOUNT_NUMBER, PiiType.CREDIT_CARD, PiiType.PHONE, PiiType.DOB);
    private static final Set<PiiType> UNSTRUCTURED_TYPES = EnumSet.of(PiiType.NAME, PiiType.ADDRESS);

    @Value("${redaction.pipeline.contextual-enabled:true}")
    private boolean contextualEnabled = true;

    @Value("${redaction.pipeline.unstructured-enabled:true}")
    private boolean unstructuredEnabled = true;

    @Value("${redaction.pipeline.variations-enabled:true}")
    private boolean variationsEnabled = true;

    @Value("${semantic-search.enabled:false}")
    private boolean semanticSearchEnabled;

    /**
     * Contextual ON: enabled AND at least one requested type can be written non-standardly.
     */
    public boolean shouldFireContextual(Set<PiiType> requested) {
        if (contextualEnabled && intersects(requested, CONTEXTUAL_TYPES)) {
            log.info("[Gating] Contextual: ON");
            return true;
        }
        log.info("[Gating] Contextual: OFF (enabled={})", contextualEnabled);
        return false;
    }

    /**
     * Unstructured ON: enabled AND NAME or ADDRESS requested.
     */
    public boolean shouldFireUnstructured(Set<PiiType> requested) {
        if (unstructuredEnabled && intersects(requested, UNSTRUCTURED_TYPES)) {
            log.info("[Gating] Unstructured: ON");
            return true;
        }
        log.info("[Gating] Unstructured: OFF (enabled={})", unstructuredEnabled);
        return false;
    }

    /**
     * Variations ON: enabled AND at least one NAME or ADDRESS entity is known.
     */
    public boolean shouldFireVariations(Collection<DetectedEntity> known) {
        long candidates = known.stream()
                .filter(e -> UNSTRUCTURED_TYPES.contains(e.getType()))
                .count();
        if (variationsEnabled && candidates > 0) {
            log.info("[Gating] Variations: ON ({} name/address entities)", candidates);
            return true;
        }
        return false;
    }

    /**
     * Semantic search ON: enabled AND the text is tied to an indexed document.
     */
    public boolean shouldFireSemanticSearch(DocumentContext documentContext) {
        if (semanticSearchEnabled && documentContext != null && documentContext.isComplete()) {
            log.info("[Gating] SemanticSearch: ON");
            return true;
        }
        return false;
    }

    private boolean intersects(Set<PiiType> requested, Set<PiiType> supported) {
        return requested.stream().anyMatch(supported::contains);
    }
}
