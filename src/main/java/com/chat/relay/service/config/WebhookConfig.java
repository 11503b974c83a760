package com.chat.relay.service.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the downstream Discord webhook.
 *
 * The URL is validated at startup: a missing or placeholder value stops the
 * application before the dispatch worker is started.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "relay.webhook")
public class WebhookConfig {

    /**
     * Webhook URL taken from the Discord channel settings.
     */
    @NotBlank(message = "relay.webhook.url must be configured")
    @Pattern(regexp = "https?://\\S+", message = "relay.webhook.url must be an http(s) URL")
    private String url;

    /**
     * Display name used for relayed messages.
     */
    private String username = "CONAN_CHAT";

    /**
     * Optional avatar URL used for relayed messages.
     */
    private String avatarUrl = "";

    /**
     * Character budget of one batch, kept below the hard limit to leave room
     * for formatting.
     */
    @Min(1)
    private int safeCharLimit = 1900;

    /**
     * Hard message length limit of the webhook.
     */
    @Min(4)
    private int hardCharLimit = 2000;

    private int connectTimeoutMs = 5000;

    private int readTimeoutMs = 10000;

    public boolean hasAvatar() {
        return avatarUrl != null && !avatarUrl.isBlank();
    }
}
