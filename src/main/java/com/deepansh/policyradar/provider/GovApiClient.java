package com.deepansh.policyradar.provider;

import com.deepansh.policyradar.exception.UpstreamErrors;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Shared plumbing for the data-provider clients: JSON over a pooled RestClient,
 * error mapping to the typed hierarchy, and the "govApi" retry policy
 * (exponential backoff on 429, 5xx and I/O errors).
 */
@Slf4j
public abstract class GovApiClient {

    protected static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    protected final RestClient restClient;
    private final Retry retry;
    private final String label;

    protected GovApiClient(String label, RestClient restClient, Retry retry) {
        this.label = label;
        this.restClient = restClient;
        this.retry = retry;
    }

    public String label() {
        return label;
    }

    protected JsonNode getJson(Function<UriBuilder, URI> uri) {
        return getJson(uri, Map.of());
    }

    protected JsonNode getJson(Function<UriBuilder, URI> uri, Map<String, String> headers) {
        return withRetry(() -> restClient.get()
                .uri(uri)
                .headers(h -> headers.forEach(h::set))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw UpstreamErrors.from(label, res);
                })
                .body(JsonNode.class));
    }

    protected JsonNode postJson(Function<UriBuilder, URI> uri, Object body) {
        return withRetry(() -> restClient.post()
                .uri(uri)
                .body(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw UpstreamErrors.from(label, res);
                })
                .body(JsonNode.class));
    }

    protected <T> T withRetry(Supplier<T> call) {
        return Retry.decorateSupplier(retry, call).get();
    }

    protected static String since(int days) {
        return LocalDate.now().minusDays(days).format(ISO_DATE);
    }

    protected static String today() {
        return LocalDate.now().format(ISO_DATE);
    }

    /** Text of a node, or null when missing, null or blank. */
    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) return null;
        String s = value.asText();
        return s.isBlank() ? null : s;
    }

    protected static String abbreviate(String value, int max) {
        if (value == null) return null;
        String v = value.strip();
        return v.length() <= max ? v : v.substring(0, max) + "...";
    }
}
