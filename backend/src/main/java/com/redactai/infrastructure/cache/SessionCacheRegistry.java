package com.redactai.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Holds one {@link SessionRedactionCache} per client session. Sessions idle longer than the
 * configured TTL, or evicted by the size bound, are cleared.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionCacheRegistry {

    private final RedactionHasher hasher;
    private final ObjectMapper objectMapper;

    @Value("${session-cache.max-entries:200}")
    private int maxEntries = 200;

    @Value("${session-cache.ttl-minutes:60}")
    private long ttlMinutes = 60;

    @Value("${session-cache.max-sessions:10000}")
    private long maxSessions = 10000;

    private Cache<String, SessionRedactionCache> sessions;

    @PostConstruct
    void init() {
        sessions = Caffeine.newBuilder()
                .maximumSize(maxSessions)
                .expireAfterAccess(ttlMinutes, TimeUnit.MINUTES)
                .removalListener((String sessionId, SessionRedactionCache cache, RemovalCause cause) -> {
                    if (cache != null) {
                        cache.clear();
                    }
                    log.debug("[SessionCache] Session ended ({})", cause);
                })
                .build();
        log.info("[SessionCache] Registry initialised (maxEntries={}, ttl={}m, maxSessions={})",
                maxEntries, ttlMinutes, maxSessions);
    }

    public SessionRedactionCache forSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session id is required");
        }
        return sessions.get(sessionId, id -> new SessionRedactionCache(
                new InMemoryRedactionCacheStore(), hasher, objectMapper, maxEntries, Clock.systemUTC()));
    }

    public void endSession(String sessionId) {
        sessions.invalidate(sessionId);
    }
}
