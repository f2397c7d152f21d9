package com.deepansh.policyradar.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "llm")
@Data
public class LlmProperties {

    /** openai | anthropic | gemini | custom */
    private String defaultProvider = "openai";

    /** responses | chat_completions, OpenAI only */
    private String defaultApiMode = "chat_completions";

    private LlmProviderProperties openai = new LlmProviderProperties();
    private LlmProviderProperties anthropic = new LlmProviderProperties();
    private LlmProviderProperties gemini = new LlmProviderProperties();
    private LlmProviderProperties custom = new LlmProviderProperties();
}
