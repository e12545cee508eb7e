package com.redactai.infrastructure.ai.semantic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the vault semantic search endpoint:
 * {@code POST {base-url}/vault/{vaultId}/search}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SemanticSearchClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${semantic-search.base-url:http://localhost:8090}")
    private String baseUrl;

    @Value("${semantic-search.api-key:}")
    private String apiKey;

    /**
     * @param method search method understood by the index (e.g. "hybrid")
     * @param topK   maximum passages to return
     * @throws SemanticSearchException when the index is unreachable or answers with an unreadable body
     */
    public List<SearchPassage> search(String vaultId, String documentId, String query, String method, int topK) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", query);
        body.put("method", method);
        body.put("topK", topK);
        if (documentId != null) {
            body.put("filters", Map.of("object_id", documentId));
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(
                    baseUrl + "/vault/{vaultId}/search", new HttpEntity<>(body, headers), String.class, vaultId);
        } catch (RestClientException e) {
            throw new SemanticSearchException("Semantic search request failed", e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new SemanticSearchException("Semantic search returned status " + response.getStatusCode().value());
        }

        return parsePassages(response.getBody());
    }

    private List<SearchPassage> parsePassages(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (Exception e) {
            throw new SemanticSearchException("Unreadable semantic search response", e);
        }

        JsonNode chunks = root.has("chunks") ? root.get("chunks") : root.path("results");
        List<SearchPassage> passages = new ArrayList<>();
        if (!chunks.isArray()) {
            return passages;
        }
        for (JsonNode chunk : chunks) {
            String text = chunk.path("text").asText("");
            if (text.isBlank()) {
                continue;
            }
            String documentId = chunk.hasNonNull("object_id") ? chunk.get("object_id").asText() : null;
            passages.add(new SearchPassage(text, documentId, chunk.path("score").asDouble(0.0)));
        }
        log.debug("[SemanticSearch] {} passages returned", passages.size());
        return passages;
    }
}
