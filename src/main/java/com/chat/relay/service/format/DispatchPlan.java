package com.chat.relay.service.format;

import com.chat.relay.service.ingest.ChatEvent;

import java.util.List;

/**
 * Batches to send in this cycle plus the events held back for the next one
 * because the per-cycle request cap was reached.
 */
public record DispatchPlan(List<Batch> batches, List<ChatEvent> deferred) {

    public DispatchPlan {
        batches = List.copyOf(batches);
        deferred = List.copyOf(deferred);
    }
}
