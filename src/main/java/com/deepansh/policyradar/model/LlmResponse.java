package com.deepansh.policyradar.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * One model turn, normalized across backends. Tool calls take precedence over text.
 */
@Data
@Builder
public class LlmResponse {

    private String content;

    @Builder.Default
    private List<ToolCall> toolCalls = List.of();

    /** Backend conversation handle after this turn, null when the backend has none */
    private String handle;

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public String textOrEmpty() {
        return content != null ? content : "";
    }
}
