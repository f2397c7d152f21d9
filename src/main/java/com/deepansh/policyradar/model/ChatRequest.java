package com.deepansh.policyradar.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    /** Scopes retrieval memory. Optional; without it content is not indexed. */
    @JsonProperty("session_id")
    private String sessionId;

    @NotBlank(message = "message must not be blank")
    @Size(max = 8000)
    private String message;

    @Builder.Default
    private ChatMode mode = ChatMode.BOTH;

    @Valid
    private SourceSelection sources;

    @Min(7)
    @Max(90)
    @Builder.Default
    private Integer days = 30;

    /** openai | anthropic | gemini | custom. Defaults to llm.default-provider. */
    private String provider;

    /** responses | chat_completions, OpenAI only */
    @JsonProperty("api_mode")
    private String apiMode;

    private String model;

    @JsonProperty("custom_model")
    private CustomModel customModel;

    /** Per-request key override for the chosen provider */
    @JsonProperty("api_key")
    private String apiKey;

    @JsonProperty("previous_handle")
    private String previousHandle;

    @JsonProperty("request_id")
    private String requestId;

    private EmbeddingOptions embedding;

    public int resolvedDays() {
        return days != null ? days : 30;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CustomModel {
        @JsonProperty("base_url")
        private String baseUrl;
        @JsonProperty("model_name")
        private String modelName;
        @JsonProperty("api_key")
        private String apiKey;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EmbeddingOptions {
        private String provider;
        private String model;
        @JsonProperty("api_key")
        private String apiKey;
        @JsonProperty("base_url")
        private String baseUrl;
    }
}
