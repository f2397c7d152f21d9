package com.deepansh.policyradar.memory;

import com.deepansh.policyradar.exception.UpstreamErrors;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * OpenAI {@code /embeddings}. Also serves the "custom" provider: any server speaking the same API.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private final RestClient restClient;
    private final String model;
    private final String label;

    public OpenAiEmbeddingProvider(RestClient.Builder builder, String baseUrl, String apiKey, String model, String label) {
        RestClient.Builder b = builder.clone().baseUrl(baseUrl).defaultHeader("Content-Type", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            b.defaultHeader("Authorization", "Bearer " + apiKey);
        }
        this.restClient = b.build();
        this.model = model;
        this.label = label;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        JsonNode response = restClient.post()
                .uri("/embeddings")
                .body(Map.of("model", model, "input", texts))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw UpstreamErrors.from(label + " embeddings", res);
                })
                .body(JsonNode.class);

        float[][] ordered = new float[texts.size()][];
        JsonNode data = response == null ? null : response.path("data");
        if (data != null && data.isArray()) {
            int position = 0;
            for (JsonNode item : data) {
                int index = item.path("index").asInt(position++);
                if (index >= 0 && index < ordered.length) ordered[index] = toVector(item.path("embedding"));
            }
        }
        List<float[]> out = new ArrayList<>(texts.size());
        for (float[] v : ordered) {
            if (v == null) throw new IllegalStateException(label + " embeddings response missing vectors");
            out.add(v);
        }
        return out;
    }

    static float[] toVector(JsonNode array) {
        float[] v = new float[array.size()];
        for (int i = 0; i < v.length; i++) v[i] = (float) array.get(i).asDouble();
        return v;
    }
}
