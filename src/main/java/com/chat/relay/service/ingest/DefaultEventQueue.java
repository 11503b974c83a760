package com.chat.relay.service.ingest;

import com.chat.relay.service.config.IngestionConfig;
import com.chat.relay.service.config.MetricsConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Default implementation of EventQueue backed by an unbounded LinkedBlockingQueue.
 *
 * Capacity is enforced by the intake gate, so producers never block here,
 * including while the worker is waiting out a rate limit.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultEventQueue implements EventQueue {

    private final IngestionConfig config;
    private final MetricsConfig metricsConfig;

    private final BlockingQueue<ChatEvent> queue = new LinkedBlockingQueue<>();
    private int capacity;

    @PostConstruct
    public void init() {
        this.capacity = config.getMaxQueueSize();

        metricsConfig.registerQueueGauge(
                "relay.ingest.queue.size",
                "Current intake queue size",
                this::size
        );
        metricsConfig.registerQueueGauge(
                "relay.ingest.queue.utilization",
                "Intake queue utilization percentage",
                this::getUtilizationPercent
        );

        log.info("EventQueue initialized with max occupancy: {}", capacity);
    }

    @Override
    public void enqueue(ChatEvent event) {
        queue.add(event);
        log.debug("Enqueued event from {}", event.sender());
    }

    @Override
    public Optional<ChatEvent> dequeue(long timeoutMs) {
        if (timeoutMs <= 0) {
            return Optional.ofNullable(queue.poll());
        }
        try {
            return Optional.ofNullable(queue.poll(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while dequeuing event");
            return Optional.empty();
        }
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public int getCapacity() {
        return capacity;
    }

    @Override
    public List<ChatEvent> drainAll() {
        List<ChatEvent> drained = new ArrayList<>();
        queue.drainTo(drained);
        return drained;
    }
}
