package com.redactai.interfaces.api.dto;

public record MaskResponse(String maskedValue) {}
