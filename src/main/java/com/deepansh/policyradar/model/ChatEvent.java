package com.deepansh.policyradar.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Envelope for everything a streamed chat emits. The {@code type} doubles as the SSE event name.
 *
 * Per turn: step pairs (running then done|error), zero or more assistant_delta,
 * then exactly one done or one error. Cancellation emits nothing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatEvent(
        String type,
        Step step,
        String delta,
        ChatResponse result,
        String error,
        @JsonProperty("retry_after") Integer retryAfter
) {

    public static final String STEP = "step";
    public static final String ASSISTANT_DELTA = "assistant_delta";
    public static final String DONE = "done";
    public static final String ERROR = "error";

    public static ChatEvent step(Step step) {
        return new ChatEvent(STEP, step, null, null, null, null);
    }

    public static ChatEvent delta(String text) {
        return new ChatEvent(ASSISTANT_DELTA, null, text, null, null, null);
    }

    public static ChatEvent done(ChatResponse result) {
        return new ChatEvent(DONE, null, null, result, null, null);
    }

    public static ChatEvent error(String message) {
        return new ChatEvent(ERROR, null, null, null, message, null);
    }

    public static ChatEvent rateLimited(String message, Integer retryAfter) {
        return new ChatEvent(ERROR, null, null, null, message, retryAfter);
    }
}
