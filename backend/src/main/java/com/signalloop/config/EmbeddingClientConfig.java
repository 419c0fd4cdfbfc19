package com.signalloop.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(prefix = "signalloop.embedding", name = "enabled", havingValue = "true")
public class EmbeddingClientConfig {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingClientConfig.class);

    @Bean
    public RestClient embeddingRestClient(SignalLoopProperties properties) {
        SignalLoopProperties.Embedding embedding = properties.getEmbedding();
        int timeoutMs = (int) Math.max(1, embedding.getTimeoutMs());

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);

        RestClient.Builder builder = RestClient.builder()
                .baseUrl(embedding.getBaseUrl())
                .requestFactory(requestFactory);
        if (StringUtils.hasText(embedding.getApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + embedding.getApiKey().trim());
        }
        log.info("Initializing embedding client for {} (model={}, timeoutMs={})",
                embedding.getBaseUrl(), embedding.getModel(), timeoutMs);
        return builder.build();
    }
}
