package com.deepansh.policyradar.api;

import com.deepansh.policyradar.memory.EmbeddingConfig;
import com.deepansh.policyradar.memory.EmbeddingService;
import com.deepansh.policyradar.memory.MemoryMatch;
import com.deepansh.policyradar.memory.RetrievalMemory;
import com.deepansh.policyradar.model.ChatRequest;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/memory")
@RequiredArgsConstructor
@Slf4j
public class MemoryController {

    private final RetrievalMemory retrievalMemory;
    private final EmbeddingService embeddingService;

    @PostMapping("/search")
    public ResponseEntity<Map<String, Object>> search(@Valid @RequestBody MemorySearchRequest request) {
        EmbeddingConfig config = embeddingService.defaultConfig().override(request.getEmbedding());
        int topK = request.getTopK() != null ? request.getTopK() : retrievalMemory.defaultTopK();
        List<MemoryMatch> matches = retrievalMemory.query(request.getSessionId(), request.getQuery(), topK, config);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", request.getQuery());
        body.put("namespace", config.namespace());
        body.put("count", matches.size());
        body.put("matches", matches.stream().map(MemoryMatch::toMap).toList());
        return ResponseEntity.ok(body);
    }

    /** Purges every chunk of the session across all embedding namespaces. */
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Map<String, Object>> deleteSession(@PathVariable String sessionId) {
        long deleted = retrievalMemory.deleteSession(sessionId);
        log.info("Purged session memory [session={}, chunks={}]", sessionId, deleted);
        return ResponseEntity.ok(Map.of("session_id", sessionId, "deleted", deleted));
    }

    @Data
    public static class MemorySearchRequest {
        @NotBlank
        @JsonProperty("session_id")
        private String sessionId;

        @NotBlank
        private String query;

        @Min(1)
        @Max(20)
        @JsonProperty("top_k")
        private Integer topK;

        private ChatRequest.EmbeddingOptions embedding;
    }
}
