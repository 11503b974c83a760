package com.chat.relay.service.dispatch;

import com.chat.relay.service.config.DispatchConfig;
import com.chat.relay.service.config.MetricsConfig;
import com.chat.relay.service.config.WebhookConfig;
import com.chat.relay.service.format.Batch;
import com.chat.relay.service.format.BatchSplitter;
import com.chat.relay.service.stats.RelayStats;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Discord webhook implementation of WebhookSender.
 *
 * Posts the batch content with mentions disabled and maps the HTTP response to
 * a {@link DispatchOutcome}:
 * - 2xx: success
 * - 429: rate limited, retry-after and scope taken from the response
 * - 401/404: webhook invalid or deleted
 * - other 4xx: payload rejected
 * - 5xx, timeout, network error: transient failure
 */
@Slf4j
@Component
public class DiscordWebhookSender implements WebhookSender {

    static final String SCOPE_HEADER = "X-RateLimit-Scope";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String RESET_AFTER_HEADER = "X-RateLimit-Reset-After";

    private final RestClient restClient;
    private final WebhookConfig webhookConfig;
    private final DispatchConfig dispatchConfig;
    private final RelayStats stats;
    private final MetricsConfig metricsConfig;
    private final ObjectMapper objectMapper;

    public DiscordWebhookSender(@Qualifier("webhookRestClient") RestClient restClient,
                                WebhookConfig webhookConfig,
                                DispatchConfig dispatchConfig,
                                RelayStats stats,
                                MetricsConfig metricsConfig,
                                ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.webhookConfig = webhookConfig;
        this.dispatchConfig = dispatchConfig;
        this.stats = stats;
        this.metricsConfig = metricsConfig;
        this.objectMapper = objectMapper;
    }

    @Override
    public DispatchOutcome send(Batch batch) {
        String content = batch.content();
        if (content.length() > webhookConfig.getHardCharLimit()) {
            content = BatchSplitter.truncate(content, webhookConfig.getHardCharLimit());
            log.warn("Payload truncated to {} characters", webhookConfig.getHardCharLimit());
        }

        Map<String, Object> payload = buildPayload(content);
        stats.recordRequest();

        long start = System.nanoTime();
        try {
            return post(payload);
        } finally {
            metricsConfig.getWebhookRequestTimer().record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        }
    }

    private DispatchOutcome post(Map<String, Object> payload) {
        try {
            return restClient.post()
                    .uri(webhookConfig.getUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .exchange((request, response) -> classify(response));
        } catch (ResourceAccessException e) {
            log.error("Timeout or network error sending to webhook: {}", e.getMessage());
            return transientFailure("network: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Webhook send error: {}", e.getMessage(), e);
            return transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Map<String, Object> buildPayload(String content) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("username", webhookConfig.getUsername());
        payload.put("content", content);
        payload.put("allowed_mentions", Map.of("parse", List.of()));
        if (webhookConfig.hasAvatar()) {
            payload.put("avatar_url", webhookConfig.getAvatarUrl());
        }
        return payload;
    }

    // ==================== Response Classification ====================

    private DispatchOutcome classify(ClientHttpResponse response) throws IOException {
        HttpStatusCode status = response.getStatusCode();
        int code = status.value();

        if (status.is2xxSuccessful()) {
            return DispatchOutcome.success();
        }
        if (code == 429) {
            return rateLimited(response);
        }
        if (code == 401 || code == 404) {
            logInvalidWebhook(code);
            return new DispatchOutcome.PermanentReject(code, "Webhook invalid or deleted", true);
        }

        String body = readBody(response);
        if (status.is5xxServerError()) {
            log.error("Webhook error {}: {}", code, body);
            return transientFailure("HTTP " + code);
        }

        log.error("Webhook rejected request with {}: {}", code, body);
        return new DispatchOutcome.PermanentReject(code, body, false);
    }

    private DispatchOutcome rateLimited(ClientHttpResponse response) {
        HttpHeaders headers = response.getHeaders();
        JsonNode body = parseBody(readBody(response));

        RateLimitScope scope = body.path("global").asBoolean(false)
                ? RateLimitScope.GLOBAL
                : RateLimitScope.fromHeader(headers.getFirst(SCOPE_HEADER));
        Duration retryAfter = retryAfter(body, headers);

        switch (scope) {
            case GLOBAL -> log.error("GLOBAL RATE LIMIT! Wait {}ms - reduce traffic immediately", retryAfter.toMillis());
            case SHARED -> log.warn("Rate limit (shared resource) - {}ms, other bots may use this channel",
                    retryAfter.toMillis());
            case USER -> log.warn("Rate limit (endpoint) - {}ms (remaining: {}, reset: {}s)",
                    retryAfter.toMillis(),
                    headerOrUnknown(headers, REMAINING_HEADER),
                    headerOrUnknown(headers, RESET_AFTER_HEADER));
        }
        return new DispatchOutcome.RateLimited(retryAfter, scope);
    }

    private Duration retryAfter(JsonNode body, HttpHeaders headers) {
        JsonNode retryAfter = body.path("retry_after");
        if (retryAfter.isNumber()) {
            return secondsToDuration(retryAfter.asDouble());
        }
        String header = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (header != null) {
            try {
                return secondsToDuration(Double.parseDouble(header.trim()));
            } catch (NumberFormatException e) {
                log.debug("Unparseable Retry-After header: {}", header);
            }
        }
        return Duration.ofMillis(dispatchConfig.getDefaultRateLimitRetryMs());
    }

    private JsonNode parseBody(String body) {
        if (body.isEmpty()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Rate limit body is not JSON: {}", body);
            return objectMapper.createObjectNode();
        }
    }

    private String readBody(ClientHttpResponse response) {
        try {
            return StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Could not read webhook response body: {}", e.getMessage());
            return "";
        }
    }

    private DispatchOutcome transientFailure(String reason) {
        return new DispatchOutcome.TransientFailure(Duration.ofMillis(dispatchConfig.getTransientRetryMs()), reason);
    }

    private void logInvalidWebhook(int code) {
        log.error("============================================================");
        log.error("CRITICAL ERROR: Discord webhook invalid or deleted (HTTP {})!", code);
        log.error("Check relay.webhook.url in the configuration.");
        log.error("============================================================");
    }

    private static Duration secondsToDuration(double seconds) {
        return Duration.ofMillis(Math.max(0, Math.round(seconds * 1000)));
    }

    private static String headerOrUnknown(HttpHeaders headers, String name) {
        String value = headers.getFirst(name);
        return value != null ? value : "?";
    }
}
