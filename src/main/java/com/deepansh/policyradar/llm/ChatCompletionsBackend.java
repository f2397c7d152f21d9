package com.deepansh.policyradar.llm;

import com.deepansh.policyradar.exception.ApiException;
import com.deepansh.policyradar.model.LlmResponse;
import com.deepansh.policyradar.model.ToolCall;
import com.deepansh.policyradar.tool.ToolImage;
import com.deepansh.policyradar.tool.ToolOutput;
import com.deepansh.policyradar.tool.ToolSpec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible {@code /chat/completions}. Used for OpenAI in chat_completions mode
 * and for any custom OpenAI-compatible server (Ollama, vLLM, Groq...).
 *
 * The API is stateless, so the full message history is resent on every call.
 * The handle is synthetic: {@code <provider>-<model>-<iteration>}.
 */
@Slf4j
public class ChatCompletionsBackend extends HttpConversationBackend {

    private final String provider;
    private final List<Map<String, Object>> messages = new ArrayList<>();
    private List<ToolSpec> tools = List.of();
    private int iteration;
    private String handle;

    public ChatCompletionsBackend(String provider,
                                  LlmProviderProperties settings,
                                  RestClient restClient,
                                  ObjectMapper objectMapper) {
        super(provider.equals("custom") ? "Custom model" : "OpenAI", settings, restClient, objectMapper);
        this.provider = provider;
    }

    @Override
    public LlmResponse start(String instructions, String prompt, List<ToolSpec> tools) {
        this.tools = tools;
        List<Map<String, Object>> opening = List.of(
                message("system", instructions),
                message("user", prompt));
        return send(opening);
    }

    @Override
    public LlmResponse respond(List<ToolOutput> outputs) {
        List<Map<String, Object>> pending = new ArrayList<>();
        List<Map<String, Object>> imageParts = new ArrayList<>();
        for (ToolOutput output : outputs) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("role", "tool");
            m.put("tool_call_id", output.callId());
            m.put("content", output.content());
            pending.add(m);
            if (!output.images().isEmpty()) {
                imageParts.add(Map.of("type", "text", "text", imageNote(output.toolName(), output.images())));
                for (ToolImage image : output.images()) {
                    imageParts.add(Map.of("type", "image_url", "image_url", Map.of("url", image.dataUrl())));
                }
            }
        }
        // Tool messages must directly follow the assistant turn; images go after them
        if (!imageParts.isEmpty()) {
            pending.add(Map.of("role", "user", "content", imageParts));
        }
        return send(pending);
    }

    @Override
    public String complete(String instructions, String prompt) {
        Map<String, Object> body = requestBody(List.of(message("system", instructions), message("user", prompt)), List.of());
        return parse(post("/chat/completions", body)).textOrEmpty();
    }

    @Override
    public String handle() {
        return handle;
    }

    private LlmResponse send(List<Map<String, Object>> pending) {
        List<Map<String, Object>> conversation = new ArrayList<>(messages);
        conversation.addAll(pending);

        JsonNode response = post("/chat/completions", requestBody(conversation, tools));
        LlmResponse parsed = parse(response);

        messages.addAll(pending);
        messages.add(assistantEcho(response));
        iteration++;
        handle = provider + "-" + settings.getModel() + "-" + iteration;
        parsed.setHandle(handle);
        return parsed;
    }

    private Map<String, Object> requestBody(List<Map<String, Object>> conversation, List<ToolSpec> toolSpecs) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", settings.getModel());
        body.put("max_tokens", settings.getMaxTokens());
        body.put("temperature", settings.getTemperature());
        body.put("messages", conversation);
        if (!toolSpecs.isEmpty()) {
            body.put("tools", toolSpecs.stream().map(ToolSpec::toChatCompletionsSchema).toList());
            body.put("tool_choice", "auto");
        }
        return body;
    }

    LlmResponse parse(JsonNode response) {
        JsonNode choices = response == null ? null : response.path("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            throw new ApiException(label + " returned no choices in response", 502);
        }
        JsonNode message = choices.get(0).path("message");
        JsonNode usage = response.path("usage");

        List<ToolCall> calls = new ArrayList<>();
        for (JsonNode call : message.path("tool_calls")) {
            JsonNode function = call.path("function");
            String name = function.path("name").asText();
            calls.add(ToolCall.builder()
                    .id(call.path("id").asText())
                    .toolName(name)
                    .arguments(parseArguments(function.path("arguments").asText(null), name))
                    .build());
        }

        log.debug("{} finish_reason={} toolCalls={}", label,
                choices.get(0).path("finish_reason").asText(), calls.size());

        return LlmResponse.builder()
                .content(message.hasNonNull("content") ? message.get("content").asText() : null)
                .toolCalls(calls)
                .promptTokens(intOrZero(usage, "prompt_tokens"))
                .completionTokens(intOrZero(usage, "completion_tokens"))
                .build();
    }

    /**
     * An assistant message that made tool calls must carry the tool_calls array,
     * otherwise the following tool messages cannot be correlated.
     */
    private Map<String, Object> assistantEcho(JsonNode response) {
        JsonNode message = response.path("choices").get(0).path("message");
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("role", "assistant");
        m.put("content", message.hasNonNull("content") ? message.get("content").asText() : null);
        if (message.path("tool_calls").isArray() && !message.path("tool_calls").isEmpty()) {
            List<Map<String, Object>> calls = new ArrayList<>();
            for (JsonNode call : message.path("tool_calls")) {
                calls.add(Map.of(
                        "id", call.path("id").asText(),
                        "type", "function",
                        "function", Map.of(
                                "name", call.path("function").path("name").asText(),
                                "arguments", call.path("function").path("arguments").asText("{}"))));
            }
            m.put("tool_calls", calls);
        }
        return m;
    }

    private static Map<String, Object> message(String role, String content) {
        return Map.of("role", role, "content", content != null ? content : "");
    }
}
