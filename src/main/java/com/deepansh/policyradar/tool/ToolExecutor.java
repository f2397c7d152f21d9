package com.deepansh.policyradar.tool;

import com.deepansh.policyradar.exception.RateLimitException;
import com.deepansh.policyradar.model.ToolCall;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dispatches tool calls by name and prepares results for a model.
 *
 * Never throws for tool failures: an exception from a tool, or an unknown name,
 * becomes an {"error": ...} payload, so the loop always continues and the model
 * decides what to do next.
 */
@Component
@Slf4j
public class ToolExecutor {

    private final ToolRegistry registry;
    private final SanitizePolicy sanitizePolicy;
    private final ObjectMapper objectMapper;

    public ToolExecutor(ToolRegistry registry, SanitizePolicy sanitizePolicy, ObjectMapper objectMapper) {
        this.registry = registry;
        this.sanitizePolicy = sanitizePolicy;
        this.objectMapper = objectMapper;
    }

    /** Label for the running step, computed before execution. */
    public String label(ToolCall call) {
        return registry.find(call.getToolName())
                .map(tool -> safeLabel(tool, call.getArguments()))
                .orElse("Execute: " + call.getToolName());
    }

    public ToolExecution execute(ToolCall call, ToolContext context) {
        Map<String, Object> args = call.getArguments() != null ? call.getArguments() : Map.of();
        AgentTool tool = registry.find(call.getToolName()).orElse(null);

        if (tool == null) {
            log.warn("Unknown tool requested: [{}]", call.getToolName());
            return finish(call, ToolResult.error("Unknown tool: " + call.getToolName()),
                    "Execute: " + call.getToolName(), null);
        }

        long start = System.currentTimeMillis();
        log.info("Tool call [{}] [session={}] args={}", call.getToolName(), context.sessionId(), args);

        ToolResult result;
        try {
            result = tool.execute(args, context);
            if (result == null) result = ToolResult.error("Tool returned no result.");
        } catch (RateLimitException e) {
            log.warn("Tool [{}] rate limited [retryAfter={}]", call.getToolName(), e.getRetryAfterSeconds());
            result = ToolResult.error(e.getMessage());
            if (e.getRetryAfterSeconds() != null) result.put("retry_after", e.getRetryAfterSeconds());
        } catch (RuntimeException e) {
            log.error("Tool [{}] failed: {}", call.getToolName(), e.getMessage());
            result = ToolResult.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        log.info("Tool [{}] finished in {}ms [error={}, sources={}]", call.getToolName(),
                System.currentTimeMillis() - start, result.isError(), result.getSources().size());
        return finish(call, result, completedLabel(tool, args, result), tool);
    }

    private ToolExecution finish(ToolCall call, ToolResult result, String label, AgentTool tool) {
        SanitizePolicy.Sanitized sanitized = sanitizePolicy.apply(result);
        String content = sanitizePolicy.toModelText(sanitized.payload(), objectMapper);
        ToolOutput output = new ToolOutput(call.getId(), call.getToolName(), content, sanitized.images());

        Map<String, Object> preview;
        if (result.isError()) {
            preview = new LinkedHashMap<>();
            preview.put("error", result.errorMessage());
        } else {
            preview = tool != null ? safePreview(tool, result) : Map.of();
        }
        return new ToolExecution(output, result.getSources(), label, preview, result.errorMessage());
    }

    private String safeLabel(AgentTool tool, Map<String, Object> args) {
        try {
            return tool.label(args != null ? args : Map.of());
        } catch (RuntimeException e) {
            return "Execute: " + tool.spec().name();
        }
    }

    private String completedLabel(AgentTool tool, Map<String, Object> args, ToolResult result) {
        try {
            return tool.completedLabel(args, result);
        } catch (RuntimeException e) {
            return safeLabel(tool, args);
        }
    }

    private Map<String, Object> safePreview(AgentTool tool, ToolResult result) {
        try {
            return tool.preview(result);
        } catch (RuntimeException e) {
            log.debug("Preview failed for [{}]: {}", tool.spec().name(), e.getMessage());
            return Map.of();
        }
    }
}
