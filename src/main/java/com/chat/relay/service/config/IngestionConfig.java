package com.chat.relay.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the intake side.
 *
 * Controls the queue occupancy gate and the channel allow-list.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "relay.ingest")
public class IngestionConfig {

    /**
     * Maximum number of queued events before intake starts refusing new ones.
     */
    private int maxQueueSize = 500;

    /**
     * Channels accepted by intake. An empty list accepts every channel.
     */
    private List<String> allowedChannels = new ArrayList<>();

    public boolean isChannelAllowed(String channel) {
        return allowedChannels.isEmpty() || allowedChannels.contains(channel);
    }
}
