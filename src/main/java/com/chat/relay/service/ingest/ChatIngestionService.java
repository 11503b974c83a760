package com.chat.relay.service.ingest;

import com.chat.relay.service.config.IngestionConfig;
import com.chat.relay.service.stats.RelayStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Intake gate in front of the event queue.
 *
 * Applies the channel allow-list, records the reception, enforces the queue
 * occupancy limit and enqueues events with a non-blank body.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatIngestionService {

    private static final int LOG_PREVIEW_LENGTH = 80;

    private final EventQueue queue;
    private final RelayStats stats;
    private final IngestionConfig config;

    // Guards the occupancy check and the enqueue as one step. The worker only
    // removes events, so it never needs the lock.
    private final Object admissionLock = new Object();

    public IngestStatus submit(ChatEvent event) {
        try {
            return admit(event);
        } catch (RuntimeException e) {
            throw new IngestionException(
                    "Failed to take in event from " + event.sender() + ": " + e.getMessage(),
                    "INGESTION_FAILED",
                    e
            );
        }
    }

    private IngestStatus admit(ChatEvent event) {
        if (!config.isChannelAllowed(event.channel())) {
            log.info("[Channel {} ignored] {}: {}", event.channel(), event.sender(), event.preview(50));
            return IngestStatus.IGNORED;
        }

        stats.recordReceived();
        log.info("[{}] {}: {}", event.radius(), event.sender(), event.preview(LOG_PREVIEW_LENGTH));

        synchronized (admissionLock) {
            stats.updateQueuePeak(queue.size());
            if (queue.isFull()) {
                stats.recordDropped(1);
                log.warn("Queue full ({}), event from {} dropped", queue.getCapacity(), event.sender());
                return IngestStatus.QUEUE_FULL;
            }
            if (event.hasMessage()) {
                queue.enqueue(event);
            }
        }
        return IngestStatus.ACCEPTED;
    }
}
