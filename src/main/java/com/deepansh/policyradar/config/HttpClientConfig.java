package com.deepansh.policyradar.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * One pooled Apache HttpClient shared by every outbound caller: model backends,
 * government API clients, the content fetcher and remote embedding providers.
 *
 * Each caller does {@code builder.clone()} and sets its own base URL and headers,
 * so the connection pool is shared but configuration never leaks between clients.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestClient.Builder restClientBuilder(RadarProperties properties) {
        RadarProperties.Http http = properties.getHttp();

        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(http.getMaxConnections())
                .setMaxConnPerRoute(http.getMaxConnectionsPerRoute())
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.ofMilliseconds(http.getConnectTimeoutMs()))
                        .setSocketTimeout(Timeout.ofMilliseconds(http.getReadTimeoutMs()))
                        .build())
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(http.getReadTimeoutMs()))
                        .build())
                .build();

        log.info("HttpClient pool configured [maxTotal={}, perRoute={}, readTimeout={}ms]",
                http.getMaxConnections(), http.getMaxConnectionsPerRoute(), http.getReadTimeoutMs());

        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
