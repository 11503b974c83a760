package com.chat.relay.service.format;

import com.chat.relay.service.ingest.ChatEvent;

import java.util.List;

/**
 * Ordered, non-empty group of events delivered by one webhook request.
 *
 * @param events  the events in arrival order
 * @param content the rendered lines joined by newlines
 */
public record Batch(List<ChatEvent> events, String content) {

    public Batch {
        if (events.isEmpty()) {
            throw new IllegalArgumentException("A batch needs at least one event");
        }
        events = List.copyOf(events);
    }

    public int size() {
        return events.size();
    }

    public int length() {
        return content.length();
    }
}
