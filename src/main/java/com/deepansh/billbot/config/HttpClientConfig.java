package com.deepansh.billbot.config;

import com.deepansh.billbot.llm.LlmProviderProperties;
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
 * Pooled Apache HttpClient behind the RestClient used for the text-generation API.
 *
 * The response timeout bounds the gap between streamed chunks, not the whole
 * answer, so long answers keep flowing as long as tokens keep arriving.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestClient.Builder llmRestClientBuilder(LlmProviderProperties props) {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(props.getMaxConnections())
                                .setMaxConnPerRoute(props.getMaxConnections())
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.of(props.getConnectTimeout()))
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.of(props.getReadTimeout()))
                        .build())
                .build();

        log.info("HttpClient configured for text generation [connectTimeout={}, readTimeout={}]",
                props.getConnectTimeout(), props.getReadTimeout());
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
