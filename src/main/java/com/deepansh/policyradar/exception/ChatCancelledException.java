package com.deepansh.policyradar.exception;

import lombok.Getter;

/**
 * Raised at a cancellation checkpoint. Neither success nor failure: callers release
 * the token and drop any partial answer.
 */
@Getter
public class ChatCancelledException extends RadarException {

    private final String requestId;

    public ChatCancelledException(String requestId) {
        super("Chat request cancelled [" + requestId + "]");
        this.requestId = requestId;
    }
}
