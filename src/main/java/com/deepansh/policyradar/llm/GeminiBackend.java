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
 * Gemini {@code generateContent}. Function calls carry no ids on this API, so ids are
 * generated per turn and mapped back to function names when outputs are sent.
 */
@Slf4j
public class GeminiBackend extends HttpConversationBackend {

    private final List<Map<String, Object>> contents = new ArrayList<>();
    private final Map<String, String> callNames = new LinkedHashMap<>();
    private String instructions;
    private List<ToolSpec> tools = List.of();
    private int iteration;
    private int callCounter;
    private String handle;

    public GeminiBackend(LlmProviderProperties settings, RestClient restClient, ObjectMapper objectMapper) {
        super("Gemini", settings, restClient, objectMapper);
    }

    @Override
    public LlmResponse start(String instructions, String prompt, List<ToolSpec> tools) {
        this.instructions = instructions;
        this.tools = tools;
        return send(Map.of("role", "user", "parts", List.of(Map.of("text", prompt))));
    }

    @Override
    public LlmResponse respond(List<ToolOutput> outputs) {
        List<Map<String, Object>> parts = new ArrayList<>();
        for (ToolOutput output : outputs) {
            String name = callNames.getOrDefault(output.callId(), output.toolName());
            parts.add(Map.of("functionResponse", Map.of(
                    "name", name,
                    "response", Map.of("result", output.content()))));
        }
        for (ToolOutput output : outputs) {
            if (output.images().isEmpty()) continue;
            parts.add(Map.of("text", imageNote(output.toolName(), output.images())));
            for (ToolImage image : output.images()) {
                parts.add(Map.of("inlineData", Map.of("mimeType", image.mimeType(), "data", image.base64())));
            }
        }
        return send(Map.of("role", "user", "parts", parts));
    }

    @Override
    public String complete(String instructions, String prompt) {
        Map<String, Object> body = requestBody(instructions,
                List.of(Map.of("role", "user", "parts", List.of(Map.of("text", prompt)))), List.of());
        return parse(post(generateUri(), body), false).textOrEmpty();
    }

    @Override
    public String handle() {
        return handle;
    }

    private LlmResponse send(Map<String, Object> userContent) {
        List<Map<String, Object>> conversation = new ArrayList<>(contents);
        conversation.add(userContent);

        JsonNode response = post(generateUri(), requestBody(instructions, conversation, tools));
        LlmResponse parsed = parse(response, true);

        contents.add(userContent);
        JsonNode modelContent = response.path("candidates").path(0).path("content");
        if (modelContent.isObject()) {
            contents.add(Map.of("role", "model", "parts", modelContent.path("parts")));
        }
        iteration++;
        handle = "gemini-" + settings.getModel() + "-" + iteration;
        parsed.setHandle(handle);
        return parsed;
    }

    private String generateUri() {
        return "/models/" + settings.getModel() + ":generateContent";
    }

    private Map<String, Object> requestBody(String system, List<Map<String, Object>> conversation, List<ToolSpec> toolSpecs) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (system != null) body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", system))));
        body.put("contents", conversation);
        if (!toolSpecs.isEmpty()) {
            body.put("tools", List.of(Map.of("functionDeclarations",
                    toolSpecs.stream().map(ToolSpec::toGeminiDeclaration).toList())));
        }
        body.put("generationConfig", Map.of(
                "maxOutputTokens", settings.getMaxTokens(),
                "temperature", settings.getTemperature()));
        return body;
    }

    /** @param track remember generated call ids so {@link #respond} can name the functions */
    LlmResponse parse(JsonNode response, boolean track) {
        JsonNode candidate = response.path("candidates").path(0);
        if (candidate.isMissingNode()) {
            log.warn("Gemini returned no candidates [blockReason={}]",
                    response.path("promptFeedback").path("blockReason").asText("none"));
        }
        List<ToolCall> calls = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (part.has("functionCall")) {
                JsonNode fn = part.get("functionCall");
                String name = fn.path("name").asText();
                String id = fn.hasNonNull("id") ? fn.get("id").asText() : "gemini-call-" + (++callCounter);
                if (track) callNames.put(id, name);
                calls.add(ToolCall.builder().id(id).toolName(name).arguments(toMap(fn.path("args"))).build());
            } else if (part.has("text")) {
                text.append(part.get("text").asText());
            }
        }
        JsonNode usage = response.path("usageMetadata");
        return LlmResponse.builder()
                .content(text.length() > 0 ? text.toString() : null)
                .toolCalls(calls)
                .promptTokens(intOrZero(usage, "promptTokenCount"))
                .completionTokens(intOrZero(usage, "candidatesTokenCount"))
                .build();
    }
}
