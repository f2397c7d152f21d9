package com.deepansh.policyradar.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Named retry instances used programmatically. Their policies live in application.yml
 * under resilience4j.retry.instances; the registry itself is auto-configured.
 *
 * Model calls use the annotation-driven "modelBackend" instance instead (see ModelCallGuard).
 */
@Configuration
public class ResilienceConfig {

    public static final String GOV_API = "govApi";
    public static final String EMBEDDING = "embedding";

    @Bean
    public Retry govApiRetry(RetryRegistry registry) {
        return registry.retry(GOV_API);
    }

    @Bean
    public Retry embeddingRetry(RetryRegistry registry) {
        return registry.retry(EMBEDDING);
    }
}
