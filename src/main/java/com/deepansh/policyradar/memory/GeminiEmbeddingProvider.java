package com.deepansh.policyradar.memory;

import com.deepansh.policyradar.exception.UpstreamErrors;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Gemini {@code models/{model}:batchEmbedContents}. */
public class GeminiEmbeddingProvider implements EmbeddingProvider {

    private final RestClient restClient;
    private final String model;

    public GeminiEmbeddingProvider(RestClient.Builder builder, String baseUrl, String apiKey, String model) {
        this.restClient = builder.clone()
                .baseUrl(baseUrl)
                .defaultHeader("x-goog-api-key", apiKey == null ? "" : apiKey)
                .defaultHeader("Content-Type", "application/json")
                .build();
        this.model = model.startsWith("models/") ? model.substring("models/".length()) : model;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        List<Map<String, Object>> requests = texts.stream()
                .map(t -> Map.<String, Object>of(
                        "model", "models/" + model,
                        "content", Map.of("parts", List.of(Map.of("text", t)))))
                .toList();

        JsonNode response = restClient.post()
                .uri("/models/{model}:batchEmbedContents", model)
                .body(Map.of("requests", requests))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw UpstreamErrors.from("Gemini embeddings", res);
                })
                .body(JsonNode.class);

        JsonNode embeddings = response == null ? null : response.path("embeddings");
        if (embeddings == null || !embeddings.isArray() || embeddings.size() != texts.size()) {
            throw new IllegalStateException("Gemini embeddings response has wrong shape");
        }
        List<float[]> out = new ArrayList<>(texts.size());
        for (JsonNode e : embeddings) out.add(OpenAiEmbeddingProvider.toVector(e.path("values")));
        return out;
    }
}
