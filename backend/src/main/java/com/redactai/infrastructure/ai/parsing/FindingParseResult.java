package com.redactai.infrastructure.ai.parsing;

import java.util.List;

/**
 * Outcome of parsing a model response: either the usable findings or the reason the payload
 * could not be read at all. Callers treat a malformed result as an empty pass.
 */
public record FindingParseResult(List<ModelFinding> findings, int skipped, String error) {

    public static FindingParseResult ok(List<ModelFinding> findings, int skipped) {
        return new FindingParseResult(List.copyOf(findings), skipped, null);
    }

    public static FindingParseResult malformed(String error) {
        return new FindingParseResult(List.of(), 0, error);
    }

    public boolean isMalformed() {
        return error != null;
    }
}
