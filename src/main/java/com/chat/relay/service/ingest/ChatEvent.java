package com.chat.relay.service.ingest;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * One chat message as received from the game server.
 *
 * The reception timestamp is captured once at intake, before queueing, and is
 * the basis both for the timestamp rendered in Discord and for latency
 * measurement. Optional text fields are normalized to empty strings.
 */
public record ChatEvent(
        String sender,
        String character,
        String message,
        String radius,
        String location,
        String channel,
        Instant receivedAt
) {

    public static final String UNKNOWN_SENDER = "Unknown";
    public static final String DEFAULT_RADIUS = "say";

    public ChatEvent {
        Objects.requireNonNull(receivedAt, "receivedAt");
        sender = isBlank(sender) ? UNKNOWN_SENDER : sender;
        character = character == null ? "" : character;
        message = message == null ? "" : message;
        radius = isBlank(radius) ? DEFAULT_RADIUS : radius;
        location = location == null ? "" : location;
        channel = channel == null ? "" : channel;
    }

    /**
     * Creates an event stamped with the current time of the given clock.
     */
    public static ChatEvent received(String sender, String character, String message,
                                     String radius, String location, String channel,
                                     Clock clock) {
        return new ChatEvent(sender, character, message, radius, location, channel, clock.instant());
    }

    public boolean hasMessage() {
        return !message.isBlank();
    }

    public boolean hasCharacter() {
        return !character.isEmpty();
    }

    /**
     * Short form of the message for log lines.
     */
    public String preview(int maxLength) {
        if (message.isEmpty()) {
            return "(empty)";
        }
        return message.length() <= maxLength ? message : message.substring(0, maxLength);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
