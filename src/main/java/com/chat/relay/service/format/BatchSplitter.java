package com.chat.relay.service.format;

import com.chat.relay.service.config.WebhookConfig;
import com.chat.relay.service.ingest.ChatEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits an ordered run of events into character-bounded batches.
 *
 * Lines are accumulated while {@code current + line + 1 <= safeCharLimit}; the
 * next line that would overflow starts a new batch. Events are never reordered
 * and never split across batches. A line longer than the hard limit is
 * truncated with a {@value #TRUNCATION_MARKER} marker and travels alone, as does
 * any line between the safe and the hard limit.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchSplitter {

    public static final String TRUNCATION_MARKER = "...";

    private final MessageFormatter formatter;
    private final WebhookConfig webhookConfig;

    /**
     * Splits the events, keeping at most {@code maxBatches} batches
     * (0 = unlimited). Events past the cap are returned as deferred, in order.
     */
    public DispatchPlan plan(List<ChatEvent> events, int maxBatches) {
        int safeLimit = webhookConfig.getSafeCharLimit();
        int hardLimit = webhookConfig.getHardCharLimit();

        List<Batch> batches = new ArrayList<>();
        List<ChatEvent> deferred = new ArrayList<>();

        List<ChatEvent> currentEvents = new ArrayList<>();
        List<String> currentLines = new ArrayList<>();
        int currentLength = 0;

        for (ChatEvent event : events) {
            if (capReached(batches, maxBatches)) {
                deferred.add(event);
                continue;
            }

            Optional<String> formatted = formatter.format(event);
            if (formatted.isEmpty()) {
                continue;
            }
            String line = truncate(formatted.get(), hardLimit);
            int lineLength = line.length() + 1; // newline separator

            if (!currentLines.isEmpty() && currentLength + lineLength > safeLimit) {
                batches.add(new Batch(currentEvents, String.join("\n", currentLines)));
                currentEvents = new ArrayList<>();
                currentLines = new ArrayList<>();
                currentLength = 0;

                if (capReached(batches, maxBatches)) {
                    deferred.add(event);
                    continue;
                }
            }

            currentEvents.add(event);
            currentLines.add(line);
            currentLength += lineLength;
        }

        if (!currentLines.isEmpty()) {
            batches.add(new Batch(currentEvents, String.join("\n", currentLines)));
        }

        if (!deferred.isEmpty()) {
            log.info("Request limit ({}/cycle) reached, {} event(s) deferred to next cycle",
                    maxBatches, deferred.size());
        }
        return new DispatchPlan(batches, deferred);
    }

    /**
     * Cuts text longer than {@code hardLimit} to {@code hardLimit - 3} characters
     * plus the truncation marker, without splitting a surrogate pair.
     */
    public static String truncate(String text, int hardLimit) {
        if (text.length() <= hardLimit) {
            return text;
        }
        int end = hardLimit - TRUNCATION_MARKER.length();
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end) + TRUNCATION_MARKER;
    }

    private static boolean capReached(List<Batch> batches, int maxBatches) {
        return maxBatches > 0 && batches.size() >= maxBatches;
    }
}
