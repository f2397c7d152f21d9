package com.deepansh.policyradar.llm;

import lombok.Data;

/**
 * Connection settings for one model backend.
 * Populated from application.yml for openai / anthropic / gemini / custom.
 */
@Data
public class LlmProviderProperties {
    private String apiKey;
    private String baseUrl;
    private String model;
    private int maxTokens = 2048;
    private double temperature = 0.2;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    LlmProviderProperties copy() {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(apiKey);
        p.setBaseUrl(baseUrl);
        p.setModel(model);
        p.setMaxTokens(maxTokens);
        p.setTemperature(temperature);
        return p;
    }
}
