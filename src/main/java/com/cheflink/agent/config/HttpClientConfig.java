package com.cheflink.agent.config;

import com.cheflink.agent.llm.LlmProperties;
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
 * Pooled Apache HttpClient behind Spring's RestClient for the model provider.
 *
 * The response timeout is a transport guard only; the loop enforces its own,
 * usually shorter, per-call deadline.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestClient.Builder restClientBuilder(LlmProperties llmProperties) {
        LlmProperties.Http http = llmProperties.getHttp();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setMaxConnTotal(http.getMaxConnections())
                        .setMaxConnPerRoute(http.getMaxConnections())
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(Timeout.of(http.getConnectTimeout()))
                                .build())
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.of(http.getResponseTimeout()))
                        .build())
                .build();

        log.info("HttpClient configured [maxConnections={}, connectTimeout={}, responseTimeout={}]",
                http.getMaxConnections(), http.getConnectTimeout(), http.getResponseTimeout());
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
