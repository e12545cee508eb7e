package com.redactai.infrastructure.ai.semantic;

public class SemanticSearchException extends RuntimeException {

    public SemanticSearchException(String message) {
        super(message);
    }

    public SemanticSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
