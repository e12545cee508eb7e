package com.redactai.infrastructure.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.redactai.domain.redaction.model.CacheMatch;
import com.redactai.domain.redaction.model.CacheStats;
import com.redactai.domain.redaction.model.CachedRedaction;
import com.redactai.domain.redaction.model.PiiType;
import com.redactai.domain.redaction.model.Span;
import com.redactai.domain.redaction.repository.RedactionCacheStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * One client session's cache of produced maskings, indexed by value signature.
 * Raw values are never stored; a repeat value is recognised by recomputing its signature.
 *
 * Writes are read-modify-write against the store without locking, so concurrent writers
 * within a session may lose updates.
 */
@Slf4j
public class SessionRedactionCache {

    public record Item(String value, String maskedValue, PiiType type) {}

    private static final Comparator<CachedRedaction> RETENTION_ORDER = Comparator
            .comparingInt(CachedRedaction::usageCount).reversed()
            .thenComparing(CachedRedaction::createdAt, Comparator.reverseOrder());

    private final RedactionCacheStore store;
    private final RedactionHasher hasher;
    private final ObjectMapper objectMapper;
    private final int maxEntries;
    private final Clock clock;

    public SessionRedactionCache(RedactionCacheStore store, RedactionHasher hasher, ObjectMapper objectMapper,
                                 int maxEntries, Clock clock) {
        this.store = store;
        this.hasher = hasher;
        this.objectMapper = objectMapper;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public CachedRedaction add(String value, String maskedValue, PiiType type) {
        List<CachedRedaction> entries = new ArrayList<>(store.load());
        CachedRedaction stored = upsert(entries, value, maskedValue, type);
        persist(entries);
        return stored;
    }

    public List<CachedRedaction> addMany(List<Item> items) {
        List<CachedRedaction> entries = new ArrayList<>(store.load());
        List<CachedRedaction> stored = new ArrayList<>();
        for (Item item : items) {
            stored.add(upsert(entries, item.value(), item.maskedValue(), item.type()));
        }
        persist(entries);
        return stored;
    }

    public boolean remove(String id) {
        List<CachedRedaction> entries = new ArrayList<>(store.load());
        boolean removed = entries.removeIf(e -> e.id().equals(id));
        if (removed) {
            persist(entries);
        }
        return removed;
    }

    public void clear() {
        store.clear();
    }

    public List<CachedRedaction> entries() {
        return store.load();
    }

    /**
     * Every window of the text with the length of a cached value is hashed and compared with
     * that entry's signature. Results are sorted by start; overlaps resolve left to right,
     * first match wins.
     */
    public List<CacheMatch> findCachedMatches(String text) {
        List<CachedRedaction> entries = store.load();
        if (text == null || text.isEmpty() || entries.isEmpty()) {
            return List.of();
        }

        String lowered = RedactionHasher.lowerCase(text);
        List<CacheMatch> matches = new ArrayList<>();
        for (CachedRedaction cached : entries) {
            int len = cached.valueLength();
            if (len <= 0 || len > lowered.length()) {
                continue;
            }
            for (int i = 0; i <= lowered.length() - len; i++) {
                if (hasher.hashLowerCased(lowered.substring(i, i + len)).equals(cached.valueHash())) {
                    matches.add(new CacheMatch(cached, new Span(i, i + len), text.substring(i, i + len)));
                    i += len - 1;
                }
            }
        }

        matches.sort(Comparator.comparingInt(m -> m.span().start()));
        List<CacheMatch> resolved = new ArrayList<>();
        for (CacheMatch match : matches) {
            if (resolved.isEmpty() || !resolved.get(resolved.size() - 1).span().overlaps(match.span())) {
                resolved.add(match);
            }
        }
        return resolved;
    }

    public Optional<CachedRedaction> isValueCached(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String hash = hasher.hash(value);
        return store.load().stream()
                .filter(e -> e.valueHash().equals(hash))
                .findFirst();
    }

    public CacheStats stats() {
        List<CachedRedaction> entries = store.load();
        Map<PiiType, Integer> byType = new EnumMap<>(PiiType.class);
        long totalUsage = 0;
        for (CachedRedaction entry : entries) {
            byType.merge(entry.type(), 1, Integer::sum);
            totalUsage += entry.usageCount();
        }
        return new CacheStats(entries.size(), totalUsage, byType);
    }

    /**
     * Pretty-printed JSON array of the hash-only records, dates in ISO-8601.
     */
    public String exportJson() {
        try {
            return objectMapper.writer()
                    .without(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .withDefaultPrettyPrinter()
                    .writeValueAsString(store.load());
        } catch (Exception e) {
            throw new IllegalStateException("Failed to export redaction cache", e);
        }
    }

    /**
     * Imports a previously exported payload. Every record needs valueHash, maskedValue, a known
     * type and a positive valueLength; a single invalid record rejects the whole import and
     * leaves the cache untouched.
     *
     * @param merge true to merge by signature (higher usageCount wins), false to replace
     * @return number of records read from the payload
     * @throws CacheFormatException when the payload or any record is invalid
     */
    public int importJson(String json, boolean merge) {
        List<CachedRedaction> imported = parseImport(json);

        if (!merge) {
            persist(new ArrayList<>(imported));
            log.info("[SessionCache] Replaced cache with {} imported entries", imported.size());
            return imported.size();
        }

        Map<String, CachedRedaction> byHash = new LinkedHashMap<>();
        for (CachedRedaction existing : store.load()) {
            byHash.put(existing.valueHash(), existing);
        }
        for (CachedRedaction item : imported) {
            CachedRedaction existing = byHash.get(item.valueHash());
            if (existing == null || item.usageCount() > existing.usageCount()) {
                byHash.put(item.valueHash(), item);
            }
        }
        persist(new ArrayList<>(byHash.values()));
        log.info("[SessionCache] Merged {} imported entries", imported.size());
        return imported.size();
    }

    private List<CachedRedaction> parseImport(String json) {
        if (json == null || json.isBlank()) {
            throw new CacheFormatException("Invalid cache format: empty payload");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new CacheFormatException("Invalid cache format: not valid JSON", e);
        }
        if (root == null || !root.isArray()) {
            throw new CacheFormatException("Invalid cache format: expected a JSON array");
        }

        List<CachedRedaction> records = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            records.add(toRecord(node, index++));
        }
        return records;
    }

    private CachedRedaction toRecord(JsonNode node, int index) {
        if (!node.isObject()) {
            throw new CacheFormatException("Invalid cache format: record " + index + " is not an object");
        }
        String valueHash = node.path("valueHash").asText("");
        String maskedValue = node.path("maskedValue").asText("");
        Optional<PiiType> type = PiiType.fromName(node.path("type").asText(""));
        int valueLength = node.path("valueLength").asInt(0);

        if (valueHash.isBlank() || maskedValue.isEmpty() || type.isEmpty() || valueLength <= 0) {
            throw new CacheFormatException("Invalid cache format: record " + index + " is missing required fields");
        }

        String id = node.hasNonNull("id") ? node.get("id").asText() : UUID.randomUUID().toString();
        int usageCount = Math.max(1, node.path("usageCount").asInt(1));
        Instant createdAt;
        try {
            createdAt = node.hasNonNull("createdAt") ? Instant.parse(node.get("createdAt").asText()) : clock.instant();
        } catch (DateTimeParseException e) {
            throw new CacheFormatException("Invalid cache format: record " + index + " has an invalid createdAt", e);
        }

        return new CachedRedaction(id, valueHash, maskedValue, type.get(), createdAt, usageCount, valueLength);
    }

    private CachedRedaction upsert(List<CachedRedaction> entries, String value, String maskedValue, PiiType type) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Cached value must not be empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("Cached value type is required");
        }

        String hash = hasher.hash(value);
        for (int i = 0; i < entries.size(); i++) {
            CachedRedaction existing = entries.get(i);
            if (existing.valueHash().equals(hash)) {
                CachedRedaction updated = existing.withRepeatSighting(maskedValue);
                entries.set(i, updated);
                return updated;
            }
        }

        CachedRedaction created = new CachedRedaction(
                UUID.randomUUID().toString(), hash, maskedValue, type, clock.instant(), 1, value.length());
        entries.add(created);
        return created;
    }

    private void persist(List<CachedRedaction> entries) {
        entries.sort(RETENTION_ORDER);
        if (entries.size() > maxEntries) {
            log.debug("[SessionCache] Evicting {} least-used entries", entries.size() - maxEntries);
        }
        store.save(entries.size() > maxEntries ? entries.subList(0, maxEntries) : entries);
    }
}
