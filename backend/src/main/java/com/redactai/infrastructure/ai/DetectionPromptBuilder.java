package com.redactai.infrastructure.ai;

import com.redactai.domain.redaction.model.DetectedEntity;
import com.redactai.domain.redaction.model.PiiType;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the fixed instruction templates for the model-backed detection passes.
 */
@Component
public class DetectionPromptBuilder {

    private static final String ALREADY_FOUND_PLACEHOLDER = "{ALREADY_FOUND}";
    private static final String TYPES_PLACEHOLDER = "{TYPES}";

    private static final String CONTEXTUAL_SYSTEM_PROMPT = """
            You are a meticulous PII reviewer. Pattern matching has already scanned the document for
            standard formats. Your job is to find sensitive values written in ways a regular
            expression cannot catch.

            Look in both directions around labels:
            - label before value: "SSN: one two three - four five - six seven eight nine"
            - value before label: "555 123 4567 is my cell", "January 15, 1985 is when I was born"

            Report values that are:
            - spelled out as words, fully or partly ("four one one one ...")
            - split by unusual separators or spread over lines ("123.45.6789", "123 / 45 / 6789")
            - damaged by OCR (letter l or I for 1, O for 0, S for 5)
            - obfuscated or partially hidden but still identifying
            - referenced indirectly next to words such as social, account, card, phone, birthday, DOB

            Only these types are in scope: {TYPES}

            These values were already found. Do NOT report them again:
            {ALREADY_FOUND}

            Respond with a JSON array only. Each element:
            - type: one of the in-scope types
            - value: the exact text as it appears in the document, copied character for character
            - normalizedValue: the standard form (e.g. "123-45-6789" for an SSN written in words)
            - startIndex: character offset where the value starts (best estimate)
            - endIndex: character offset where the value ends (best estimate)
            - context: a short reason for flagging it

            Example:
            [{"type": "SSN", "value": "one two three four five six seven eight nine", "normalizedValue": "123-45-6789", "startIndex": 40, "endIndex": 84, "context": "SSN spelled out after 'my social is'"}]

            If nothing new is found, respond with [].""";

    private static final String UNSTRUCTURED_SYSTEM_PROMPT = """
            You are a PII reviewer specialised in people and places. Find every personal name and
            every postal address in the document. When unsure, report it; a reviewer will
            discard false positives.

            Names include full names, first or last names that identify a specific person, names
            with titles (Mr., Mrs., Dr., Prof.), signatures, salutations ("Dear X", "Sincerely, X"),
            header fields (To, From, Attn, CC) and parties, witnesses, notaries or attorneys.

            Addresses include street addresses, PO boxes, suite or unit numbers, city/state/ZIP
            combinations, ZIP codes and international addresses.

            Only these types are in scope: {TYPES}

            These values were already found. Do NOT report them again:
            {ALREADY_FOUND}

            Respond with a JSON array only. Each element:
            - type: "NAME" or "ADDRESS"
            - value: the exact text as it appears in the document
            - startIndex: character offset where the value starts (best estimate)
            - endIndex: character offset where the value ends (best estimate)
            - confidence: 0.0 to 1.0

            Example:
            [{"type": "NAME", "value": "John Smith", "startIndex": 45, "endIndex": 55, "confidence": 0.95}]

            If nothing is found, respond with [].""";

    private static final String VARIATION_SYSTEM_PROMPT = """
            You are a PII reviewer performing a second look at a document. These entities were
            already identified:
            {ALREADY_FOUND}

            Find every other way the document refers to the same people and places.

            For names: first or last name alone, other titles or honorifics (Mr. Patterson),
            initials (R. J. Patterson), nicknames or short forms, misspellings and OCR errors,
            possessives (Patterson's), and role references ("the plaintiff") that clearly stand
            for the named person.

            For addresses: partial addresses (street only, city and state only), abbreviations
            (St., Ave., Blvd.) and references such as "the property" or "said address".

            Respond with a JSON array only. Each element:
            - type: "NAME" or "ADDRESS"
            - value: the exact text as it appears in the document
            - startIndex: character offset where it starts (best estimate)
            - endIndex: character offset where it ends (best estimate)
            - relatedTo: the already-identified entity this refers to, copied exactly
            - confidence: 0.0 to 1.0

            Example:
            [{"type": "NAME", "value": "Mr. Patterson", "startIndex": 500, "endIndex": 513, "relatedTo": "Robert J. Patterson", "confidence": 0.9}]

            If nothing is found, respond with [].""";

    public String buildContextualSystemPrompt(Collection<DetectedEntity> alreadyFound, Set<PiiType> types) {
        return CONTEXTUAL_SYSTEM_PROMPT
                .replace(TYPES_PLACEHOLDER, formatTypes(types))
                .replace(ALREADY_FOUND_PLACEHOLDER, formatAlreadyFound(alreadyFound));
    }

    public String buildContextualUserMessage(String text, Set<PiiType> types) {
        return "Find non-standard representations of: " + formatTypes(types) + "\n\nText:\n" + text;
    }

    public String buildUnstructuredSystemPrompt(Collection<DetectedEntity> alreadyFound, Set<PiiType> types) {
        return UNSTRUCTURED_SYSTEM_PROMPT
                .replace(TYPES_PLACEHOLDER, formatTypes(types))
                .replace(ALREADY_FOUND_PLACEHOLDER, formatAlreadyFound(alreadyFound));
    }

    public String buildUnstructuredUserMessage(String text) {
        return "Find names and addresses in this text:\n\n" + text;
    }

    public String buildVariationSystemPrompt(List<String> names, List<String> addresses) {
        StringBuilder known = new StringBuilder();
        if (!names.isEmpty()) {
            known.append("NAMES: ").append(String.join(", ", names));
        }
        if (!addresses.isEmpty()) {
            if (known.length() > 0) {
                known.append('\n');
            }
            known.append("ADDRESSES: ").append(String.join(", ", addresses));
        }
        return VARIATION_SYSTEM_PROMPT.replace(ALREADY_FOUND_PLACEHOLDER, known.toString());
    }

    public String buildVariationUserMessage(String text) {
        return "Find all variations of the identified entities in this text:\n\n" + text;
    }

    String formatAlreadyFound(Collection<DetectedEntity> alreadyFound) {
        if (alreadyFound == null || alreadyFound.isEmpty()) {
            return "None";
        }
        Set<String> lines = new LinkedHashSet<>();
        for (DetectedEntity entity : alreadyFound) {
            lines.add("- " + entity.getType().name() + ": \"" + entity.getValue() + "\"");
        }
        return String.join("\n", lines);
    }

    private String formatTypes(Set<PiiType> types) {
        return types.stream()
                .sorted()
                .map(Enum::name)
                .collect(Collectors.joining(", "));
    }
}
