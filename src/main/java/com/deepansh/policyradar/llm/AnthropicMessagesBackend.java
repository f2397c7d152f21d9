package com.deepansh.policyradar.llm;

import com.deepansh.policyradar.exception.ApiException;
import com.deepansh.policyradar.model.LlmResponse;
import com.deepansh.policyradar.model.ToolCall;
import com.deepansh.policyradar.tool.ToolImage;
import com.deepansh.policyradar.tool.ToolOutput;
import com.deepansh.policyradar.tool.ToolSpec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API. Stateless like chat completions; assistant content blocks
 * are echoed back verbatim and tool outputs travel as {@code tool_result} blocks in
 * the next user message, with images inside the block they belong to.
 */
public class AnthropicMessagesBackend extends HttpConversationBackend {

    static final String API_VERSION = "2023-06-01";

    private final List<Map<String, Object>> messages = new ArrayList<>();
    private String instructions;
    private List<ToolSpec> tools = List.of();
    private int iteration;
    private String handle;

    public AnthropicMessagesBackend(LlmProviderProperties settings, RestClient restClient, ObjectMapper objectMapper) {
        super("Anthropic", settings, restClient, objectMapper);
    }

    @Override
    public LlmResponse start(String instructions, String prompt, List<ToolSpec> tools) {
        this.instructions = instructions;
        this.tools = tools;
        return send(Map.of("role", "user", "content", prompt));
    }

    @Override
    public LlmResponse respond(List<ToolOutput> outputs) {
        List<Map<String, Object>> blocks = new ArrayList<>();
        for (ToolOutput output : outputs) {
            List<Map<String, Object>> content = new ArrayList<>();
            content.add(Map.of("type", "text", "text", output.content()));
            for (ToolImage image : output.images()) {
                content.add(Map.of("type", "image", "source", Map.of(
                        "type", "base64",
                        "media_type", image.mimeType(),
                        "data", image.base64())));
            }
            Map<String, Object> block = new LinkedHashMap<>();
            block.put("type", "tool_result");
            block.put("tool_use_id", output.callId());
            block.put("content", content);
            blocks.add(block);
        }
        return send(Map.of("role", "user", "content", blocks));
    }

    @Override
    public String complete(String instructions, String prompt) {
        Map<String, Object> body = requestBody(instructions, List.of(Map.of("role", "user", "content", prompt)), List.of());
        return parse(post("/messages", body)).textOrEmpty();
    }

    @Override
    public String handle() {
        return handle;
    }

    private LlmResponse send(Map<String, Object> userMessage) {
        List<Map<String, Object>> conversation = new ArrayList<>(messages);
        conversation.add(userMessage);

        JsonNode response = post("/messages", requestBody(instructions, conversation, tools));
        LlmResponse parsed = parse(response);

        messages.add(userMessage);
        messages.add(Map.of("role", "assistant", "content", response.path("content")));
        iteration++;
        handle = "anthropic-" + settings.getModel() + "-" + iteration;
        parsed.setHandle(handle);
        return parsed;
    }

    private Map<String, Object> requestBody(String system, List<Map<String, Object>> conversation, List<ToolSpec> toolSpecs) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", settings.getModel());
        body.put("max_tokens", settings.getMaxTokens());
        body.put("temperature", settings.getTemperature());
        body.put("system", system);
        body.put("messages", conversation);
        if (!toolSpecs.isEmpty()) {
            body.put("tools", toolSpecs.stream().map(ToolSpec::toAnthropicSchema).toList());
        }
        return body;
    }

    LlmResponse parse(JsonNode response) {
        if (response == null || !response.path("content").isArray()) {
            throw new ApiException(label + " returned no content in response", 502);
        }
        List<ToolCall> calls = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        for (JsonNode block : response.path("content")) {
            String type = block.path("type").asText();
            if ("text".equals(type)) {
                text.append(block.path("text").asText());
            } else if ("tool_use".equals(type)) {
                calls.add(ToolCall.builder()
                        .id(block.path("id").asText())
                        .toolName(block.path("name").asText())
                        .arguments(toMap(block.path("input")))
                        .build());
            }
        }
        JsonNode usage = response.path("usage");
        return LlmResponse.builder()
                .content(text.length() > 0 ? text.toString() : null)
                .toolCalls(calls)
                .promptTokens(intOrZero(usage, "input_tokens"))
                .completionTokens(intOrZero(usage, "output_tokens"))
                .build();
    }
}
