package com.deepansh.policyradar.provider;

import com.deepansh.policyradar.config.RadarProperties;
import com.deepansh.policyradar.fetch.FetchedContent;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GovInfoClientTest {

    private static final String BASE = "https://api.govinfo.gov";

    private MockRestServiceServer server;
    private GovInfoClient client;

    @BeforeEach
    void setUp() {
        RadarProperties properties = new RadarProperties();
        properties.getProviders().setGovApiKey("test-key");
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new GovInfoClient(properties, builder, Retry.of("test", RetryConfig.custom().maxAttempts(1).build()));
    }

    @Test
    void readContent_htmRendition_extractsPageText() {
        server.expect(requestTo(startsWith(BASE + "/packages/BILLS-118hr1enr/htm")))
                .andRespond(withSuccess("""
                        <html><head><script>var x = 1;</script></head>
                        <body><nav>Menu</nav><main><p>An Act to provide for reconciliation.</p></main></body></html>""",
                        MediaType.TEXT_HTML));

        ContentRead read = client.readContent("BILLS-118hr1enr");

        assertThat(read.failed()).isFalse();
        assertThat(read.contentType()).isEqualTo(FetchedContent.TYPE_HTML);
        assertThat(read.text()).isEqualTo("An Act to provide for reconciliation.");
        assertThat(read.record().getUrl()).isEqualTo("https://www.govinfo.gov/app/details/BILLS-118hr1enr");
        server.verify();
    }

    @Test
    void readContent_htmMissing_fallsBackToXml() {
        server.expect(requestTo(startsWith(BASE + "/packages/FR-2024-01-02/htm")))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(startsWith(BASE + "/packages/FR-2024-01-02/xml")))
                .andRespond(withSuccess("<doc><title>Notice</title><p>Comment period extended.</p></doc>",
                        MediaType.APPLICATION_XML));

        ContentRead read = client.readContent("FR-2024-01-02");

        assertThat(read.contentType()).isEqualTo(FetchedContent.TYPE_TEXT);
        assertThat(read.text()).contains("Comment period extended.");
        server.verify();
    }
}
