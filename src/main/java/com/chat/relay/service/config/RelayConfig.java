package com.chat.relay.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overall application configuration for the Chat Relay Service.
 *
 * Contains feature toggles for the optional background activities.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "relay")
public class RelayConfig {

    /**
     * Feature flags for optional capabilities.
     */
    private Features features = new Features();

    @Getter
    @Setter
    public static class Features {

        /**
         * Start the dispatch worker at startup. When disabled, events are
         * accepted and queued but never delivered.
         */
        private boolean dispatchEnabled = true;

        /**
         * Emit the periodic throughput summary to the log.
         */
        private boolean periodicSummaryEnabled = true;
    }
}
