package com.redactai.infrastructure.ai.semantic;

/**
 * One passage returned by the vault search endpoint.
 *
 * @param documentId id of the indexed object the passage came from (nullable)
 */
public record SearchPassage(String text, String documentId, double score) {}
