package com.deepansh.policyradar.memory;

import com.deepansh.policyradar.exception.UpstreamErrors;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Hugging Face feature-extraction pipeline. Sentence-transformer models return one vector
 * per input; raw encoders return one vector per token, which are mean-pooled and L2-normalized.
 */
public class HuggingFaceEmbeddingProvider implements EmbeddingProvider {

    private final RestClient restClient;
    private final String model;

    public HuggingFaceEmbeddingProvider(RestClient.Builder builder, String baseUrl, String apiKey, String model) {
        RestClient.Builder b = builder.clone().baseUrl(baseUrl).defaultHeader("Content-Type", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            b.defaultHeader("Authorization", "Bearer " + apiKey);
        }
        this.restClient = b.build();
        this.model = model;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        JsonNode response = restClient.post()
                .uri("/pipeline/feature-extraction/{model}", model)
                .body(Map.of("inputs", texts, "options", Map.of("wait_for_model", true)))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw UpstreamErrors.from("Hugging Face embeddings", res);
                })
                .body(JsonNode.class);

        if (response == null || !response.isArray() || response.size() != texts.size()) {
            throw new IllegalStateException("Hugging Face embeddings response has wrong shape");
        }
        List<float[]> out = new ArrayList<>(texts.size());
        for (JsonNode item : response) {
            out.add(item.size() > 0 && item.get(0).isArray() ? meanPool(item) : OpenAiEmbeddingProvider.toVector(item));
        }
        return out;
    }

    static float[] meanPool(JsonNode tokenVectors) {
        int dims = tokenVectors.get(0).size();
        float[] pooled = new float[dims];
        for (JsonNode token : tokenVectors) {
            for (int i = 0; i < dims; i++) pooled[i] += (float) token.get(i).asDouble();
        }
        for (int i = 0; i < dims; i++) pooled[i] /= tokenVectors.size();
        HashingEmbeddingProvider.normalize(pooled);
        return pooled;
    }
}
