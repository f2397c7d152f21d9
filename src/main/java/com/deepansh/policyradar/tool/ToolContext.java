package com.deepansh.policyradar.tool;

import com.deepansh.policyradar.memory.EmbeddingConfig;

/**
 * Per-turn facts a tool may need beyond its arguments.
 * {@code sessionId} is null when the caller did not supply one.
 */
public record ToolContext(String sessionId, EmbeddingConfig embeddingConfig, int days) {

    public boolean hasSession() {
        return sessionId != null && !sessionId.isBlank();
    }
}
