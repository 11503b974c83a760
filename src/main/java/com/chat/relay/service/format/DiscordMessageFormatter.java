package com.chat.relay.service.format;

import com.chat.relay.service.config.FormatConfig;
import com.chat.relay.service.ingest.ChatEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Formats chat events with Discord markdown.
 *
 * Example: {@code <t:1771684200:T> **Alice** (Lyra) [Shout]: Hello}
 * followed by an optional small-text footer line for location and channel.
 * The timestamp is the reception time, rendered by Discord in each reader's
 * timezone.
 */
@Component
@RequiredArgsConstructor
public class DiscordMessageFormatter implements MessageFormatter {

    private final FormatConfig config;

    @Override
    public Optional<String> format(ChatEvent event) {
        if (event.message().isEmpty()) {
            return Optional.empty();
        }

        StringBuilder line = new StringBuilder();
        String style = config.getTimestampStyle();
        if (style != null && !style.isEmpty()) {
            line.append("<t:").append(event.receivedAt().getEpochSecond()).append(':').append(style).append("> ");
        }

        line.append("**").append(event.sender()).append("**");
        if (config.isShowCharacterName() && event.hasCharacter() && !event.character().equals(event.sender())) {
            line.append(" (").append(event.character()).append(')');
        }

        if (config.isShowRadius()) {
            line.append(" [").append(capitalize(event.radius())).append(']');
        }
        line.append(": ").append(event.message());

        List<String> footer = new ArrayList<>(2);
        if (config.isShowLocation() && !event.location().isEmpty()) {
            footer.add("Location: " + event.location());
        }
        if (config.isShowChannel() && !event.channel().isEmpty()) {
            footer.add("Channel: " + event.channel());
        }
        if (!footer.isEmpty()) {
            line.append("\n-# ").append(String.join(" | ", footer));
        }

        return Optional.of(line.toString());
    }

    private static String capitalize(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
