package com.deepansh.policyradar.exception;

import org.springframework.http.HttpHeaders;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Maps a non-2xx upstream response to the typed hierarchy. Used from RestClient
 * {@code onStatus} handlers by model backends, provider clients and embedding providers.
 *
 * | Status | Exception                       | Retried |
 * |--------|---------------------------------|---------|
 * | 429    | RateLimitException              | gov/embedding only |
 * | 5xx    | BackendUnavailableException     | yes     |
 * | other  | ApiException                    | no      |
 */
public final class UpstreamErrors {

    private static final int MAX_BODY_IN_MESSAGE = 500;

    private UpstreamErrors() {}

    public static ApiException from(String label, ClientHttpResponse response) throws IOException {
        int status = response.getStatusCode().value();
        String body = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
        return from(label, status, body, response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
    }

    public static ApiException from(String label, int status, String body, String retryAfterHeader) {
        String detail = body == null || body.isBlank() ? "" : ": " + abbreviate(body.trim());
        if (status == 429) {
            return new RateLimitException(label + " rate limit exceeded (HTTP 429)", parseRetryAfter(retryAfterHeader));
        }
        if (status >= 500) {
            return new BackendUnavailableException(label + " API error (HTTP " + status + ")" + detail, status);
        }
        return new ApiException(label + " API error (HTTP " + status + ")" + detail, status);
    }

    /** Seconds form only; HTTP-date values are ignored. */
    static Integer parseRetryAfter(String header) {
        if (header == null || header.isBlank()) return null;
        try {
            return Integer.parseInt(header.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String abbreviate(String body) {
        return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }
}
