package com.deepansh.policyradar.memory;

import com.deepansh.policyradar.config.RadarProperties;
import com.deepansh.policyradar.model.ChatRequest;

/**
 * Which embedding model turns text into vectors. Selects the vector-index namespace:
 * vectors from different (provider, model, base url) triples never share one.
 */
public record EmbeddingConfig(String provider, String model, String apiKey, String baseUrl) {

    public EmbeddingConfig {
        provider = provider == null || provider.isBlank() ? "local" : provider.trim().toLowerCase();
        model = model == null ? "" : model.trim();
        baseUrl = baseUrl == null ? "" : baseUrl.trim();
    }

    public static EmbeddingConfig from(RadarProperties.Embedding props) {
        return new EmbeddingConfig(props.getProvider(), props.getModel(), props.getApiKey(), props.getBaseUrl());
    }

    /** Applies a per-request override; blank fields keep the defaults. */
    public EmbeddingConfig override(ChatRequest.EmbeddingOptions options) {
        if (options == null) return this;
        return new EmbeddingConfig(
                pick(options.getProvider(), provider),
                pick(options.getModel(), model),
                pick(options.getApiKey(), apiKey),
                pick(options.getBaseUrl(), baseUrl));
    }

    public String namespace() {
        return "emb_" + Hashing.sha256(provider + "|" + model + "|" + baseUrl).substring(0, 12);
    }

    /** Identity for provider-instance caching, key included. */
    String instanceKey() {
        return namespace() + ":" + Hashing.sha256(apiKey == null ? "" : apiKey).substring(0, 8);
    }

    private static String pick(String candidate, String fallback) {
        return candidate != null && !candidate.isBlank() ? candidate : fallback;
    }

    @Override
    public String toString() {
        return "EmbeddingConfig[provider=" + provider + ", model=" + model + ", baseUrl=" + baseUrl + "]";
    }
}
