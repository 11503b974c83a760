package com.chat.relay.service.format;

import com.chat.relay.service.ingest.ChatEvent;

import java.util.Optional;

/**
 * Renders one chat event as a line of webhook text.
 */
public interface MessageFormatter {

    /**
     * Formats the event.
     *
     * @param event the event to render
     * @return the rendered text, empty when the event has no message body
     */
    Optional<String> format(ChatEvent event);
}
