package com.deepansh.policyradar.llm;

import com.deepansh.policyradar.exception.UpstreamErrors;
import com.deepansh.policyradar.tool.ToolImage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared plumbing for JSON-over-HTTP backends: request posting with typed error
 * mapping, tool argument parsing and the note that introduces image attachments.
 */
@Slf4j
abstract class HttpConversationBackend implements ConversationBackend {

    protected final String label;
    protected final LlmProviderProperties settings;
    protected final RestClient restClient;
    protected final ObjectMapper objectMapper;

    protected HttpConversationBackend(String label,
                                      LlmProviderProperties settings,
                                      RestClient restClient,
                                      ObjectMapper objectMapper) {
        this.label = label;
        this.settings = settings;
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String model() {
        return settings.getModel();
    }

    protected JsonNode post(String uri, Object body) {
        log.debug("{} request [model={}, uri={}]", label, settings.getModel(), uri);
        return restClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw UpstreamErrors.from(label, res);
                })
                .body(JsonNode.class);
    }

    /**
     * Malformed arguments become an empty map; the tool then reports its missing
     * parameters back to the model instead of failing the turn.
     */
    protected Map<String, Object> parseArguments(String json, String toolName) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            log.warn("{} sent unparsable arguments for [{}]: {}", label, toolName, e.getOriginalMessage());
            return Map.of();
        }
    }

    protected Map<String, Object> toMap(JsonNode node) {
        if (node == null || node.isNull() || !node.isObject()) return Map.of();
        return objectMapper.convertValue(node, new TypeReference<>() {});
    }

    static String imageNote(String toolName, List<ToolImage> images) {
        List<String> lines = new ArrayList<>();
        lines.add("Images extracted from " + toolName + ":");
        for (ToolImage image : images) {
            List<String> details = new ArrayList<>();
            if (image.page() != null) details.add("page " + image.page());
            if (image.source() != null) details.add(image.source());
            String name = image.id() != null ? image.id() : "image";
            lines.add("- " + (details.isEmpty() ? name : name + " (" + String.join(", ", details) + ")"));
        }
        return String.join("\n", lines);
    }

    static int intOrZero(JsonNode node, String field) {
        return node != null && node.hasNonNull(field) ? node.get(field).asInt() : 0;
    }
}
