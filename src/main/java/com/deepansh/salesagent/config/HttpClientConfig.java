package com.deepansh.salesagent.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Apache HttpClient 5 behind RestClient for the LLM provider calls.
 *
 * Every completion must finish within llm.timeout-seconds (connect, socket and
 * response timeouts all use it). A timeout surfaces as ResourceAccessException,
 * which the completion retry policy treats as retryable.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Value("${llm.timeout-seconds:15}")
    private long timeoutSeconds;

    @Bean("llmRestClientBuilder")
    public RestClient.Builder llmRestClientBuilder() {
        Timeout timeout = Timeout.ofSeconds(timeoutSeconds);

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(timeout)
                                        .setSocketTimeout(timeout)
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(timeout)
                        .build())
                .build();

        log.info("LLM HttpClient configured [timeout={}s]", timeoutSeconds);
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
