package com.chat.relay.service.dispatch;

/**
 * Phase of the dispatch worker's current cycle.
 */
public enum WorkerState {
    COLLECTING,
    BACKOFF,
    SENDING
}
