package com.redactai.interfaces.api.cache;

import com.redactai.application.redaction.SessionCacheAppService;
import com.redactai.domain.redaction.model.CacheStats;
import com.redactai.domain.redaction.model.CachedRedaction;
import com.redactai.infrastructure.cache.SessionRedactionCache;
import com.redactai.interfaces.api.dto.CacheBatchRequest;
import com.redactai.interfaces.api.dto.CacheEntryRequest;
import com.redactai.interfaces.api.dto.CacheImportResponse;
import com.redactai.interfaces.api.dto.CacheLookupRequest;
import com.redactai.interfaces.api.dto.CacheMatchRequest;
import com.redactai.interfaces.api.dto.CacheMatchResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Per-session redaction cache. The session is identified by the {@value #SESSION_HEADER} header.
 */
@RestController
@RequestMapping("/api/v1/cache")
@RequiredArgsConstructor
public class SessionCacheController {

    static final String SESSION_HEADER = "X-Session-Id";

    private final SessionCacheAppService sessionCacheAppService;

    @GetMapping("/entries")
    public ResponseEntity<List<CachedRedaction>> entries(@RequestHeader(SESSION_HEADER) String sessionId) {
        return ResponseEntity.ok(sessionCacheAppService.entries(sessionId));
    }

    @PostMapping("/entries")
    public ResponseEntity<CachedRedaction> add(@RequestHeader(SESSION_HEADER) String sessionId,
                                               @Valid @RequestBody CacheEntryRequest request) {
        return ResponseEntity.ok(sessionCacheAppService.add(
                sessionId, request.value(), request.maskedValue(), request.type()));
    }

    @PostMapping("/entries/batch")
    public ResponseEntity<List<CachedRedaction>> addMany(@RequestHeader(SESSION_HEADER) String sessionId,
                                                         @Valid @RequestBody CacheBatchRequest request) {
        List<SessionRedactionCache.Item> items = request.entries().stream()
                .map(e -> new SessionRedactionCache.Item(e.value(), e.maskedValue(), e.type()))
                .toList();
        return ResponseEntity.ok(sessionCacheAppService.addMany(sessionId, items));
    }

    @PostMapping("/matches")
    public ResponseEntity<List<CacheMatchResponse>> matches(@RequestHeader(SESSION_HEADER) String sessionId,
                                                            @Valid @RequestBody CacheMatchRequest request) {
        return ResponseEntity.ok(sessionCacheAppService.findMatches(sessionId, request.text()).stream()
                .map(CacheMatchResponse::from)
                .toList());
    }

    @PostMapping("/lookup")
    public ResponseEntity<CachedRedaction> lookup(@RequestHeader(SESSION_HEADER) String sessionId,
                                                  @Valid @RequestBody CacheLookupRequest request) {
        return sessionCacheAppService.lookup(sessionId, request.value())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/entries/{entryId}")
    public ResponseEntity<Void> remove(@RequestHeader(SESSION_HEADER) String sessionId,
                                       @PathVariable String entryId) {
        return sessionCacheAppService.remove(sessionId, entryId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @DeleteMapping("/entries")
    public ResponseEntity<Void> clear(@RequestHeader(SESSION_HEADER) String sessionId) {
        sessionCacheAppService.clear(sessionId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/session")
    public ResponseEntity<Void> endSession(@RequestHeader(SESSION_HEADER) String sessionId) {
        sessionCacheAppService.endSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/stats")
    public ResponseEntity<CacheStats> stats(@RequestHeader(SESSION_HEADER) String sessionId) {
        return ResponseEntity.ok(sessionCacheAppService.stats(sessionId));
    }

    @GetMapping("/export")
    public ResponseEntity<String> export(@RequestHeader(SESSION_HEADER) String sessionId) {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"redaction-cache.json\"")
                .body(sessionCacheAppService.exportJson(sessionId));
    }

    @PostMapping(value = "/import", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CacheImportResponse> importCache(@RequestHeader(SESSION_HEADER) String sessionId,
                                                           @RequestParam(defaultValue = "true") boolean merge,
                                                           @RequestBody String payload) {
        int imported = sessionCacheAppService.importJson(sessionId, payload, merge);
        return ResponseEntity.ok(new CacheImportResponse(imported, sessionCacheAppService.stats(sessionId)));
    }
}
