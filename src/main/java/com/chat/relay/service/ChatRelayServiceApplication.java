package com.chat.relay.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Chat Relay Service - entry point for the Spring Boot application.
 *
 * Accepts chat events from the game server over HTTP and relays them to a
 * Discord webhook:
 * - Intake: GET/POST /message captures each event and queues it
 * - Dispatch: a single background worker batches events and respects the webhook rate limits
 * - Reporting: GET /stats and the actuator health endpoint expose throughput and health
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan("com.chat.relay.service.config")
public class ChatRelayServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatRelayServiceApplication.class, args);
    }
}
