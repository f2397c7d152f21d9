package com.deepansh.policyradar.llm;

import com.deepansh.policyradar.model.LlmResponse;
import com.deepansh.policyradar.tool.ToolOutput;
import com.deepansh.policyradar.tool.ToolSpec;

import java.util.List;

/**
 * One multi-turn conversation with a model vendor. Instances hold the conversation
 * state of a single chat turn and are not shared between requests.
 *
 * Implementations commit state only after a call succeeds, so a failed call can be
 * retried as-is.
 */
public interface ConversationBackend {

    /**
     * Opens the conversation.
     *
     * @param instructions system instructions
     * @param prompt       first user message
     * @param tools        tools the model may call, possibly empty
     */
    LlmResponse start(String instructions, String prompt, List<ToolSpec> tools);

    /** Sends the outputs of every tool call from the previous response. */
    LlmResponse respond(List<ToolOutput> outputs);

    /** Single stateless exchange with no tools. Does not touch the conversation. */
    String complete(String instructions, String prompt);

    /** Conversation handle after the latest response; null before the first call. */
    String handle();

    String model();
}
