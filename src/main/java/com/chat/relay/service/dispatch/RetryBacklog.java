package com.chat.relay.service.dispatch;

import com.chat.relay.service.ingest.ChatEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * Events carried from one dispatch cycle into the next, oldest first.
 *
 * Owned by the dispatch worker thread only, hence not synchronized.
 */
class RetryBacklog {

    private final Deque<ChatEvent> events = new ArrayDeque<>();
    private final int maxSize;

    RetryBacklog(int maxSize) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must not be negative: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    void addAll(Collection<ChatEvent> carried) {
        events.addAll(carried);
    }

    /**
     * Removes and returns every event, oldest first.
     */
    List<ChatEvent> drainAll() {
        List<ChatEvent> drained = new ArrayList<>(events);
        events.clear();
        return drained;
    }

    /**
     * Removes the oldest events beyond the size cap.
     *
     * @return the evicted events, oldest first
     */
    List<ChatEvent> evictOverflow() {
        int overflow = events.size() - maxSize;
        if (overflow <= 0) {
            return List.of();
        }
        List<ChatEvent> evicted = new ArrayList<>(overflow);
        for (int i = 0; i < overflow; i++) {
            evicted.add(events.pollFirst());
        }
        return evicted;
    }

    int size() {
        return events.size();
    }

    boolean isEmpty() {
        return events.isEmpty();
    }

    int getMaxSize() {
        return maxSize;
    }
}
