package com.redactai.domain.redaction.model;

/**
 * Half-open character interval {@code [start, end)} into the analysed text.
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0) {
            throw new IllegalArgumentException("Span start must be >= 0: " + start);
        }
        if (end <= start) {
            throw new IllegalArgumentException("Span end must be > start: [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean overlaps(Span other) {
        return start < other.end && other.start < end;
    }

    public boolean fitsWithin(int textLength) {
        return end <= textLength;
    }
}
