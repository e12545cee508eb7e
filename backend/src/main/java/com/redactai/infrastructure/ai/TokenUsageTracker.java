package com.redactai.infrastructure.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Cumulative token usage across all detection calls.
 */
@Slf4j
@Component
public class TokenUsageTracker {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong totalPromptTokens = new AtomicLong();
    private final AtomicLong totalCompletionTokens = new AtomicLong();
    private final AtomicLong totalCachedTokens = new AtomicLong();

    public void recordUsage(long promptTokens, long completionTokens, long cachedTokens) {
        long requests = totalRequests.incrementAndGet();
        totalPromptTokens.addAndGet(promptTokens);
        totalCompletionTokens.addAndGet(completionTokens);
        totalCachedTokens.addAndGet(cachedTokens);

        log.debug("Usage metrics - request #{}: prompt={}, completion={}, cached={}, cumulative prompt={}, completion={}, tokenCacheRate={}%",
                requests, promptTokens, completionTokens, cachedTokens,
                totalPromptTokens.get(), totalCompletionTokens.get(), String.format("%.1f", getTokenCacheRate()));
    }

    public double getTokenCacheRate() {
        long total = totalPromptTokens.get();
        return total > 0 ? (double) totalCachedTokens.get() / total * 100 : 0;
    }
}
