package com.redactai.domain.redaction.model;

/**
 * Identifies the indexed document a text was extracted from. Required for semantic search.
 */
public record DocumentContext(String vaultId, String documentId) {

    public boolean isComplete() {
        return vaultId != null && !vaultId.isBlank() && documentId != null && !documentId.isBlank();
    }
}
