package com.redactai.application.redaction.exception;

public class InvalidDetectionInputException extends RuntimeException {

    public InvalidDetectionInputException(String message) {
        super(message);
    }
}
