package com.redactai.infrastructure.cache;

import com.redactai.domain.redaction.model.CachedRedaction;
import com.redactai.domain.redaction.repository.RedactionCacheStore;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Session-scoped store kept in memory only. Each save replaces the list; last writer wins.
 */
public class InMemoryRedactionCacheStore implements RedactionCacheStore {

    private final AtomicReference<List<CachedRedaction>> entries = new AtomicReference<>(List.of());

    @Override
    public List<CachedRedaction> load() {
        return entries.get();
    }

    @Override
    public void save(List<CachedRedaction> newEntries) {
        entries.set(List.copyOf(newEntries));
    }

    @Override
    public void clear() {
        entries.set(List.of());
    }
}
