package com.redactai.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
