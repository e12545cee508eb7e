package com.redactai.application.redaction;

import com.redactai.domain.redaction.model.CacheMatch;
import com.redactai.domain.redaction.model.CacheStats;
import com.redactai.domain.redaction.model.CachedRedaction;
import com.redactai.domain.redaction.model.PiiType;
import com.redactai.infrastructure.cache.SessionCacheRegistry;
import com.redactai.infrastructure.cache.SessionRedactionCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class SessionCacheAppService {

    private final SessionCacheRegistry registry;

    public CachedRedaction add(String sessionId, String value, String maskedValue, PiiType type) {
        return registry.forSession(sessionId).add(value, maskedValue, type);
    }

    public List<CachedRedaction> addMany(String sessionId, List<SessionRedactionCache.Item> items) {
        List<CachedRedaction> stored = registry.forSession(sessionId).addMany(items);
        log.info("[SessionCache] Added {} entries", stored.size());
        return stored;
    }

    public List<CachedRedaction> entries(String sessionId) {
        return registry.forSession(sessionId).entries();
    }

    public List<CacheMatch> findMatches(String sessionId, String text) {
        List<CacheMatch> matches = registry.forSession(sessionId).findCachedMatches(text);
        log.info("[SessionCache] {} cached matches in text of length {}", matches.size(), text.length());
        return matches;
    }

    public Optional<CachedRedaction> lookup(String sessionId, String value) {
        return registry.forSession(sessionId).isValueCached(value);
    }

    public boolean remove(String sessionId, String entryId) {
        return registry.forSession(sessionId).remove(entryId);
    }

    public void clear(String sessionId) {
        registry.forSession(sessionId).clear();
    }

    public void endSession(String sessionId) {
        registry.endSession(sessionId);
    }

    public CacheStats stats(String sessionId) {
        return registry.forSession(sessionId).stats();
    }

    public String exportJson(String sessionId) {
        return registry.forSession(sessionId).exportJson();
    }

    public int importJson(String sessionId, String json, boolean merge) {
        return registry.forSession(sessionId).importJson(json, merge);
    }
}
