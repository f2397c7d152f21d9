package com.deepansh.policyradar.exception;

import lombok.Getter;

/**
 * HTTP 429 from an upstream API. {@code retryAfterSeconds} is null when no Retry-After header was sent.
 */
@Getter
public class RateLimitException extends ApiException {

    private final Integer retryAfterSeconds;

    public RateLimitException(String message, Integer retryAfterSeconds) {
        super(message, 429);
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
