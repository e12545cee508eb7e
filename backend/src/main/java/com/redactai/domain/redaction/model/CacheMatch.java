package com.redactai.domain.redaction.model;

/**
 * A window of text whose hash equals a cached entry.
 */
public record CacheMatch(CachedRedaction cached, Span span, String value) {}
