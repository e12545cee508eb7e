package com.redactai.infrastructure.ai.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.redactai.domain.redaction.model.PiiType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tolerant reader for the JSON array of findings the detection prompts ask for.
 *
 * Accepts fenced code blocks, leading or trailing chatter, an object wrapping the array,
 * {@code start}/{@code startIndex} offset spellings and missing optional fields.
 * Findings with an unknown type, a type outside the allowed set, or a blank value are skipped.
 * Never throws.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FindingResponseParser {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON)?");
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    private final ObjectMapper objectMapper;

    public FindingParseResult parse(String content, Set<PiiType> allowedTypes) {
        if (content == null || content.isBlank()) {
            return FindingParseResult.ok(List.of(), 0);
        }

        String cleaned = CODE_FENCE.matcher(content).replaceAll("").trim();
        if (cleaned.isEmpty()) {
            return FindingParseResult.ok(List.of(), 0);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(extractJson(cleaned));
        } catch (Exception e) {
            return FindingParseResult.malformed("Invalid JSON: " + e.getMessage());
        }

        JsonNode array = root != null && root.isObject() ? firstArrayField(root) : root;
        if (array == null || !array.isArray()) {
            return FindingParseResult.malformed("Expected a JSON array of findings");
        }

        List<ModelFinding> findings = new ArrayList<>();
        int skipped = 0;
        for (JsonNode node : array) {
            Optional<ModelFinding> finding = toFinding(node, allowedTypes);
            if (finding.isPresent()) {
                findings.add(finding.get());
            } else {
                skipped++;
            }
        }

        if (skipped > 0) {
            log.debug("[Parser] Skipped {} unusable findings out of {}", skipped, array.size());
        }
        return FindingParseResult.ok(findings, skipped);
    }

    private String extractJson(String cleaned) {
        int arrayStart = cleaned.indexOf('[');
        int objectStart = cleaned.indexOf('{');
        if (objectStart >= 0 && (arrayStart < 0 || objectStart < arrayStart)) {
            int objectEnd = cleaned.lastIndexOf('}');
            if (objectEnd > objectStart) {
                return cleaned.substring(objectStart, objectEnd + 1);
            }
        }
        int arrayEnd = cleaned.lastIndexOf(']');
        if (arrayStart >= 0 && arrayEnd > arrayStart) {
            return cleaned.substring(arrayStart, arrayEnd + 1);
        }
        return cleaned;
    }

    private JsonNode firstArrayField(JsonNode object) {
        Iterator<JsonNode> fields = object.elements();
        while (fields.hasNext()) {
            JsonNode field = fields.next();
            if (field.isArray()) {
                return field;
            }
        }
        return null;
    }

    private Optional<ModelFinding> toFinding(JsonNode node, Set<PiiType> allowedTypes) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }

        Optional<PiiType> type = PiiType.fromName(node.path("type").asText(""));
        if (type.isEmpty() || (allowedTypes != null && !allowedTypes.contains(type.get()))) {
            return Optional.empty();
        }

        String value = node.path("value").asText("");
        if (value.isBlank()) {
            return Optional.empty();
        }

        return Optional.of(new ModelFinding(
                type.get(),
                value,
                optionalText(node, "normalizedValue"),
                optionalInt(node, "startIndex", "start"),
                optionalInt(node, "endIndex", "end"),
                optionalDouble(node, "confidence"),
                optionalText(node, "context"),
                optionalText(node, "relatedTo")
        ));
    }

    private String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText("").trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Offsets outside the int range, fractional or otherwise unusable, are treated as absent.
     */
    private Integer optionalInt(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isNumber()) {
                return value.canConvertToInt() && value.isIntegralNumber() ? value.asInt() : null;
            }
            if (value.isTextual()) {
                return parseInt(value.asText().trim());
            }
        }
        return null;
    }

    private Integer parseInt(String text) {
        if (!INTEGER.matcher(text).matches()) {
            return null;
        }
        try {
            long parsed = Long.parseLong(text);
            return parsed >= Integer.MIN_VALUE && parsed <= Integer.MAX_VALUE ? (int) parsed : null;
        } catch (NumberFormatException e) {
            log.debug("[Parser] Ignoring out-of-range offset of {} digits", text.length());
            return null;
        }
    }

    private Double optionalDouble(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value != null && value.isNumber()) {
            return value.asDouble();
        }
        return null;
    }
}
