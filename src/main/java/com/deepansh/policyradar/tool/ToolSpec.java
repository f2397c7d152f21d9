package com.deepansh.policyradar.tool;

import com.deepansh.policyradar.model.DataSource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable description of a callable tool, decoupled from its implementation.
 * Each backend gets the same definition in its own wire shape.
 *
 * @param source null for tools that are always visible
 */
public record ToolSpec(String name, String description, Map<String, Object> parameters, DataSource source) {

    /** Chat completions: { "type": "function", "function": { name, description, parameters } } */
    public Map<String, Object> toChatCompletionsSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description,
                        "parameters", parameters
                )
        );
    }

    /** Responses API uses a flat function definition. */
    public Map<String, Object> toResponsesSchema() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", "function");
        m.put("name", name);
        m.put("description", description);
        m.put("parameters", parameters);
        m.put("strict", false);
        return m;
    }

    public Map<String, Object> toAnthropicSchema() {
        return Map.of(
                "name", name,
                "description", description,
                "input_schema", parameters
        );
    }

    public Map<String, Object> toGeminiDeclaration() {
        return Map.of(
                "name", name,
                "description", description,
                "parameters", parameters
        );
    }

    @SuppressWarnings("unchecked")
    public boolean declaresParameter(String parameter) {
        Object props = parameters.get("properties");
        return props instanceof Map<?, ?> map && ((Map<String, Object>) map).containsKey(parameter);
    }
}
