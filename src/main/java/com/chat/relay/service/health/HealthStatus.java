package com.chat.relay.service.health;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative health of the relay.
 */
public enum HealthStatus {

    OK("OK"),
    WARNING("WARNING"),
    CRITICAL("CRITICAL"),
    RATE_LIMITED("RATE LIMITED");

    private final String label;

    HealthStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
