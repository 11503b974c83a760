package com.chat.relay.service.ingest;

import java.util.List;
import java.util.Optional;

/**
 * Interface for the intake queue.
 *
 * FIFO buffer between the HTTP intake and the single dispatch worker. The queue
 * itself never rejects: callers compare {@link #size()} with
 * {@link #getCapacity()} before enqueueing and refuse events when full.
 */
public interface EventQueue {

    /**
     * Appends an event. Never blocks.
     *
     * @param event the event to enqueue
     */
    void enqueue(ChatEvent event);

    /**
     * Waits up to the given timeout for the next event.
     *
     * @param timeoutMs timeout in milliseconds
     * @return the oldest event if one arrived in time, empty otherwise
     */
    Optional<ChatEvent> dequeue(long timeoutMs);

    /**
     * Gets the current queue size.
     *
     * @return number of events waiting
     */
    int size();

    /**
     * Gets the configured occupancy limit enforced by intake.
     *
     * @return maximum occupancy
     */
    int getCapacity();

    /**
     * Gets the queue utilization as a percentage.
     *
     * @return utilization percentage
     */
    default double getUtilizationPercent() {
        int capacity = getCapacity();
        return capacity > 0 ? (size() * 100.0) / capacity : 0.0;
    }

    /**
     * Checks if the queue reached its occupancy limit.
     *
     * @return true if full
     */
    default boolean isFull() {
        return size() >= getCapacity();
    }

    /**
     * Removes and returns every queued event in FIFO order.
     */
    List<ChatEvent> drainAll();
}
