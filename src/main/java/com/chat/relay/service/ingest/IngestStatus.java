package com.chat.relay.service.ingest;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Synchronous answer given to the game server for one submitted event.
 */
public enum IngestStatus {

    ACCEPTED("ok"),
    IGNORED("ignored"),
    QUEUE_FULL("queue_full");

    private final String label;

    IngestStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
