package com.redactai.infrastructure.ai.parsing;

import com.redactai.domain.redaction.model.Span;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Anchors model-reported values to real offsets in the analysed text.
 * Model offsets are estimates; the value itself is the source of truth.
 */
@Component
public class SpanLocator {

    /**
     * Resolution order: exact match at the hinted start, nearest exact occurrence,
     * nearest case-insensitive occurrence. Values not present in the text yield empty.
     *
     * @param hintStart model-reported start offset (nullable)
     */
    public Optional<Span> locate(String text, String value, Integer hintStart) {
        if (text == null || value == null) {
            return Optional.empty();
        }
        String needle = value.trim();
        if (needle.isEmpty() || needle.length() > text.length()) {
            return Optional.empty();
        }

        if (hintStart != null && hintStart >= 0 && text.startsWith(needle, hintStart)) {
            return Optional.of(new Span(hintStart, hintStart + needle.length()));
        }

        List<Integer> starts = occurrences(text, needle, false);
        if (starts.isEmpty()) {
            starts = occurrences(text, needle, true);
        }
        if (starts.isEmpty()) {
            return Optional.empty();
        }

        int best = nearest(starts, hintStart);
        return Optional.of(new Span(best, best + needle.length()));
    }

    /**
     * Start offsets of every occurrence of {@code value}, overlapping occurrences included.
     */
    public List<Integer> occurrences(String text, String value, boolean ignoreCase) {
        List<Integer> starts = new ArrayList<>();
        if (text == null || value == null || value.isEmpty()) {
            return starts;
        }
        int last = text.length() - value.length();
        for (int i = 0; i <= last; i++) {
            if (text.regionMatches(ignoreCase, i, value, 0, value.length())) {
                starts.add(i);
            }
        }
        return starts;
    }

    private int nearest(List<Integer> starts, Integer hintStart) {
        if (hintStart == null) {
            return starts.get(0);
        }
        int best = starts.get(0);
        for (int start : starts) {
            if (Math.abs(start - hintStart) < Math.abs(best - hintStart)) {
                best = start;
            }
        }
        return best;
    }
}
