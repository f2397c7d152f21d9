package com.deepansh.policyradar.llm;

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
 * OpenAI Responses API. The server keeps the conversation; each call links to the
 * previous one through {@code previous_response_id}, which is also the handle the
 * caller stores to continue the session on its next turn.
 */
@Slf4j
public class ResponsesBackend extends HttpConversationBackend {

    private String instructions;
    private List<ToolSpec> tools = List.of();
    private String responseId;

    /** @param previousHandle response id of the caller's previous turn, may be null */
    public ResponsesBackend(LlmProviderProperties settings,
                            RestClient restClient,
                            ObjectMapper objectMapper,
                            String previousHandle) {
        super("OpenAI", settings, restClient, objectMapper);
        this.responseId = previousHandle;
    }

    @Override
    public LlmResponse start(String instructions, String prompt, List<ToolSpec> tools) {
        this.instructions = instructions;
        this.tools = tools;
        return send(List.of(Map.of("role", "user", "content", prompt)));
    }

    @Override
    public LlmResponse respond(List<ToolOutput> outputs) {
        List<Map<String, Object>> input = new ArrayList<>();
        for (ToolOutput output : outputs) {
            input.add(Map.of(
                    "type", "function_call_output",
                    "call_id", output.callId(),
                    "output", output.content()));
            if (!output.images().isEmpty()) {
                List<Map<String, Object>> content = new ArrayList<>();
                content.add(Map.of("type", "input_text", "text", imageNote(output.toolName(), output.images())));
                for (ToolImage image : output.images()) {
                    content.add(Map.of("type", "input_image", "image_url", image.dataUrl()));
                }
                input.add(Map.of("type", "message", "role", "user", "content", content));
            }
        }
        return send(input);
    }

    @Override
    public String complete(String instructions, String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", settings.getModel());
        body.put("instructions", instructions);
        body.put("input", List.of(Map.of("role", "user", "content", prompt)));
        body.put("max_output_tokens", settings.getMaxTokens());
        body.put("store", false);
        return parse(post("/responses", body)).textOrEmpty();
    }

    @Override
    public String handle() {
        return responseId;
    }

    private LlmResponse send(List<Map<String, Object>> input) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", settings.getModel());
        body.put("instructions", instructions);
        body.put("input", input);
        body.put("max_output_tokens", settings.getMaxTokens());
        if (!tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolSpec::toResponsesSchema).toList());
            body.put("parallel_tool_calls", false);
        }
        if (responseId != null) body.put("previous_response_id", responseId);

        LlmResponse parsed = parse(post("/responses", body));
        responseId = parsed.getHandle();
        return parsed;
    }

    LlmResponse parse(JsonNode response) {
        List<ToolCall> calls = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        for (JsonNode item : response.path("output")) {
            switch (item.path("type").asText()) {
                case "function_call" -> {
                    String name = item.path("name").asText();
                    calls.add(ToolCall.builder()
                            .id(item.path("call_id").asText())
                            .toolName(name)
                            .arguments(parseArguments(item.path("arguments").asText(null), name))
                            .build());
                }
                case "message" -> {
                    for (JsonNode part : item.path("content")) {
                        if ("output_text".equals(part.path("type").asText())) {
                            text.append(part.path("text").asText());
                        }
                    }
                }
                default -> log.trace("Ignoring output item of type {}", item.path("type").asText());
            }
        }
        JsonNode usage = response.path("usage");
        return LlmResponse.builder()
                .content(text.length() > 0 ? text.toString() : null)
                .toolCalls(calls)
                .handle(response.path("id").asText(null))
                .promptTokens(intOrZero(usage, "input_tokens"))
                .completionTokens(intOrZero(usage, "output_tokens"))
                .build();
    }
}
