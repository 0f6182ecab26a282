package com.deepansh.codeagent.config;

import com.deepansh.codeagent.llm.LlmProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Provider HTTP client on Apache HttpClient 5 with a pooled connection manager.
 *
 * The response timeout comes from {@code llm.timeout-seconds}; thinking-enabled
 * models can take minutes for a single reply.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    private static final int CONNECT_TIMEOUT_SECONDS = 10;

    @Bean
    public RestClient.Builder restClientBuilder(LlmProperties llmProperties) {
        Timeout responseTimeout = Timeout.ofSeconds(llmProperties.getTimeoutSeconds());

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(20)
                                .setMaxConnPerRoute(10)
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.ofSeconds(CONNECT_TIMEOUT_SECONDS))
                                        .setSocketTimeout(responseTimeout)
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(responseTimeout)
                        .build())
                .build();

        log.info("HttpClient configured: connect timeout {}s, response timeout {}s",
                CONNECT_TIMEOUT_SECONDS, llmProperties.getTimeoutSeconds());
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
