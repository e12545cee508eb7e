package com.redactai.domain.redaction.repository;

import com.redactai.domain.redaction.model.CachedRedaction;

import java.util.List;

/**
 * Backing storage for one session's redaction cache.
 * Implementations replace the whole entry list on each write; concurrent writers may lose updates.
 */
public interface RedactionCacheStore {

    List<CachedRedaction> load();

    void save(List<CachedRedaction> entries);

    void clear();
}
