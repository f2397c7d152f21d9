package com.deepansh.policyradar.llm;

import com.deepansh.policyradar.exception.RequestValidationException;
import com.deepansh.policyradar.model.ChatRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Locale;

/**
 * Builds the conversation backend for one chat turn from the configured defaults
 * and the request's overrides (provider, api mode, model, api key, custom server).
 */
@Component
@Slf4j
public class BackendFactory {

    public static final String OPENAI = "openai";
    public static final String ANTHROPIC = "anthropic";
    public static final String GEMINI = "gemini";
    public static final String CUSTOM = "custom";

    public static final String MODE_RESPONSES = "responses";
    public static final String MODE_CHAT_COMPLETIONS = "chat_completions";

    private final LlmProperties properties;
    private final RestClient.Builder restClientBuilder;
    private final ObjectMapper objectMapper;

    public BackendFactory(LlmProperties properties, RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        this.properties = properties;
        this.restClientBuilder = restClientBuilder;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void logDefaultProvider() {
        String provider = normalize(properties.getDefaultProvider(), OPENAI);
        LlmProviderProperties settings = defaults(provider);
        log.info("================================================================");
        log.info("  Default model provider : {}", provider.toUpperCase(Locale.ROOT));
        log.info("  Model                  : {}", settings.getModel());
        if (provider.equals(OPENAI)) {
            log.info("  API mode               : {}", properties.getDefaultApiMode());
        }
        if (!settings.hasApiKey() && !provider.equals(CUSTOM)) {
            log.warn("  No API key configured; requests must supply api_key");
        } else {
            log.info("  Key                    : {}", mask(settings.getApiKey()));
        }
        log.info("================================================================");
    }

    public ConversationBackend create(ChatRequest request) {
        String provider = normalize(request.getProvider(), normalize(properties.getDefaultProvider(), OPENAI));
        LlmProviderProperties settings = resolveSettings(provider, request);

        if (!provider.equals(CUSTOM) && !settings.hasApiKey()) {
            throw new RequestValidationException("No API key configured for provider '" + provider + "'.");
        }

        String apiMode = normalize(request.getApiMode(), normalize(properties.getDefaultApiMode(), MODE_CHAT_COMPLETIONS));
        log.info("Model backend [provider={}, apiMode={}, model={}, key={}]",
                provider, provider.equals(OPENAI) ? apiMode : "-", settings.getModel(), mask(settings.getApiKey()));

        return switch (provider) {
            case OPENAI -> switch (apiMode) {
                case MODE_RESPONSES -> new ResponsesBackend(settings, bearerClient(settings), objectMapper,
                        request.getPreviousHandle());
                case MODE_CHAT_COMPLETIONS -> new ChatCompletionsBackend(OPENAI, settings, bearerClient(settings), objectMapper);
                default -> throw new RequestValidationException("Unsupported api_mode: " + apiMode);
            };
            case CUSTOM -> new ChatCompletionsBackend(CUSTOM, settings, bearerClient(settings), objectMapper);
            case ANTHROPIC -> new AnthropicMessagesBackend(settings, restClientBuilder.clone()
                    .baseUrl(settings.getBaseUrl())
                    .defaultHeader("x-api-key", settings.getApiKey())
                    .defaultHeader("anthropic-version", AnthropicMessagesBackend.API_VERSION)
                    .build(), objectMapper);
            case GEMINI -> new GeminiBackend(settings, restClientBuilder.clone()
                    .baseUrl(settings.getBaseUrl())
                    .defaultHeader("x-goog-api-key", settings.getApiKey())
                    .build(), objectMapper);
            default -> throw new RequestValidationException("Unsupported provider: " + provider);
        };
    }

    LlmProviderProperties resolveSettings(String provider, ChatRequest request) {
        LlmProviderProperties settings = defaults(provider).copy();
        if (provider.equals(CUSTOM) && request.getCustomModel() != null) {
            ChatRequest.CustomModel custom = request.getCustomModel();
            if (notBlank(custom.getBaseUrl())) settings.setBaseUrl(custom.getBaseUrl());
            if (notBlank(custom.getModelName())) settings.setModel(custom.getModelName());
            if (notBlank(custom.getApiKey())) settings.setApiKey(custom.getApiKey());
        }
        if (notBlank(request.getModel())) settings.setModel(request.getModel());
        if (notBlank(request.getApiKey())) settings.setApiKey(request.getApiKey());
        if (!notBlank(settings.getBaseUrl())) {
            throw new RequestValidationException("No base URL configured for provider '" + provider + "'.");
        }
        return settings;
    }

    private LlmProviderProperties defaults(String provider) {
        return switch (provider) {
            case OPENAI -> properties.getOpenai();
            case ANTHROPIC -> properties.getAnthropic();
            case GEMINI -> properties.getGemini();
            case CUSTOM -> properties.getCustom();
            default -> throw new RequestValidationException("Unsupported provider: " + provider);
        };
    }

    private RestClient bearerClient(LlmProviderProperties settings) {
        RestClient.Builder builder = restClientBuilder.clone().baseUrl(settings.getBaseUrl());
        if (settings.hasApiKey()) {
            builder.defaultHeader("Authorization", "Bearer " + settings.getApiKey());
        }
        return builder.build();
    }

    private static String normalize(String value, String fallback) {
        return notBlank(value) ? value.trim().toLowerCase(Locale.ROOT) : fallback;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    static String mask(String key) {
        if (key == null || key.isBlank()) return "<none>";
        if (key.length() <= 8) return "****";
        return key.substring(0, 4) + "..." + key.substring(key.length() - 4);
    }
}
