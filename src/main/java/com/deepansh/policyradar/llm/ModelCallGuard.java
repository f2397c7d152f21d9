package com.deepansh.policyradar.llm;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Retry and circuit breaker around every model call.
 *
 * Retry config (application.yml, instance "modelBackend"):
 * - 3 attempts, exponential backoff: 2s, 4s
 * - only ResourceAccessException and BackendUnavailableException (5xx) are retried
 *
 * Circuit breaker:
 * - opens at 50% failures over a window of 10 calls, probes again after 30s
 * - rate limits, validation errors and cancellation are not counted as failures
 *
 * No fallback: exhausted calls propagate their typed exception to the caller.
 */
@Component
@Slf4j
public class ModelCallGuard {

    @Retry(name = "modelBackend")
    @CircuitBreaker(name = "modelBackend")
    public <T> T invoke(String operation, Supplier<T> call) {
        log.debug("Model call [{}]", operation);
        return call.get();
    }
}
