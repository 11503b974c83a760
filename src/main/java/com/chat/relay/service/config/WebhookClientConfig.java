package com.chat.relay.service.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client used to reach the Discord webhook.
 */
@Slf4j
@Configuration
public class WebhookClientConfig {

    /**
     * RestClient with the configured connect and read timeouts. A request that
     * exceeds them is classified as a transient failure.
     */
    @Bean(name = "webhookRestClient")
    public RestClient webhookRestClient(RestClient.Builder builder, WebhookConfig webhookConfig) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(webhookConfig.getConnectTimeoutMs());
        requestFactory.setReadTimeout(webhookConfig.getReadTimeoutMs());

        log.info("Initializing webhook client (connect timeout: {}ms, read timeout: {}ms)",
                webhookConfig.getConnectTimeoutMs(), webhookConfig.getReadTimeoutMs());
        return builder
                .requestFactory(requestFactory)
                .build();
    }
}
