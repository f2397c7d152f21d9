package com.deepansh.policyradar.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UpstreamErrorsTest {

    @Test
    void from_429_isRateLimitWithRetryAfter() {
        ApiException e = UpstreamErrors.from("Congress.gov", 429, "slow down", "30");

        assertThat(e).isInstanceOf(RateLimitException.class);
        assertThat(((RateLimitException) e).getRetryAfterSeconds()).isEqualTo(30);
        assertThat(e.getStatusCode()).isEqualTo(429);
    }

    @Test
    void from_503_isBackendUnavailable() {
        ApiException e = UpstreamErrors.from("GovInfo", 503, "maintenance", null);

        assertThat(e).isInstanceOf(BackendUnavailableException.class);
        assertThat(e.getMessage()).isEqualTo("GovInfo API error (HTTP 503): maintenance");
    }

    @Test
    void from_400_isPlainApiExceptionWithStatus() {
        ApiException e = UpstreamErrors.from("USAspending", 400, "", null);

        assertThat(e.getClass()).isEqualTo(ApiException.class);
        assertThat(e.getStatusCode()).isEqualTo(400);
        assertThat(e.getMessage()).isEqualTo("USAspending API error (HTTP 400)");
    }

    @Test
    void from_longBody_isAbbreviated() {
        ApiException e = UpstreamErrors.from("DOJ", 500, "x".repeat(2000), null);

        assertThat(e.getMessage()).endsWith("...").hasSizeLessThan(600);
    }

    @Test
    void parseRetryAfter_httpDateOrBlank_isNull() {
        assertThat(UpstreamErrors.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT")).isNull();
        assertThat(UpstreamErrors.parseRetryAfter(" ")).isNull();
        assertThat(UpstreamErrors.parseRetryAfter(" 5 ")).isEqualTo(5);
    }
}
