package com.redactai.infrastructure.ai.pipeline;

import com.redactai.domain.redaction.model.DetectedEntity;
import com.redactai.domain.redaction.model.PiiType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Applies a reviewed redaction plan: every entity marked {@code shouldRedact} is replaced by
 * its masked value.
 *
 * Uses position-based replacement (right-to-left) so earlier offsets stay valid.
 */
@Slf4j
@Component
public class RedactionService {

    public record RedactionResult(
            String redactedText,
            int redactedCount,
            int skippedCount,
            Map<PiiType, Integer> byType
    ) {}

    public RedactionResult apply(String text, List<DetectedEntity> entities) {
        Map<PiiType, Integer> byType = new EnumMap<>(PiiType.class);
        if (text == null || entities == null || entities.isEmpty()) {
            return new RedactionResult(text, 0, 0, byType);
        }

        List<DetectedEntity> sorted = entities.stream()
                .filter(DetectedEntity::isShouldRedact)
                .sorted(Comparator.comparingInt(DetectedEntity::start).reversed())
                .toList();

        StringBuilder sb = new StringBuilder(text);
        int redactedCount = 0;
        int skippedCount = 0;
        int boundary = text.length();

        for (DetectedEntity entity : sorted) {
            int start = entity.start();
            int end = entity.end();

            // Out of bounds, or overlapping an entity already replaced to its right
            if (end > boundary) {
                log.warn("[Redaction] Skipping {} entity at [{}, {}): out of bounds or overlapping (limit={})",
                        entity.getType(), start, end, boundary);
                skippedCount++;
                continue;
            }

            String replacement = entity.getMaskedValue() != null ? entity.getMaskedValue() : "[REDACTED]";
            sb.replace(start, end, replacement);
            byType.merge(entity.getType(), 1, Integer::sum);
            redactedCount++;
            boundary = start;
        }

        log.info("[Redaction] redacted={}, skipped={}, excluded={}",
                redactedCount, skippedCount, entities.size() - sorted.size());

        return new RedactionResult(sb.toString(), redactedCount, skippedCount, byType);
    }
}
