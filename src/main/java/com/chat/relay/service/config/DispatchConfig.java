package com.chat.relay.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the dispatch worker.
 *
 * Capacity with the defaults: one request every 2.5 seconds (24 req/min, well
 * below the webhook's ~30 req/min sustained limit) carrying up to 20 events,
 * i.e. 480 events per minute in theory.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "relay.dispatch")
public class DispatchConfig {

    /**
     * Collection window of one dispatch cycle in milliseconds.
     */
    private long batchWindowMs = 2500;

    /**
     * Maximum number of events collected into one cycle.
     */
    private int maxBatchSize = 20;

    /**
     * Pause between two webhook requests of the same cycle. 500ms keeps us
     * at 4 requests per 2 seconds, under the burst limit of 5.
     */
    private long interRequestDelayMs = 500;

    /**
     * Maximum webhook requests per cycle (0 = unlimited). Events beyond the
     * cap are deferred to the next cycle, not lost.
     */
    private int maxRequestsPerCycle = 1;

    /**
     * Maximum number of events carried over between cycles.
     */
    private int maxBacklogSize = 200;

    /**
     * Upper bound of a single sleep while a rate limit is active.
     */
    private long backoffPollCeilingMs = 500;

    /**
     * Pause when neither the queue nor the backlog hold anything.
     */
    private long idlePauseMs = 100;

    /**
     * Pause after an unexpected error in the worker loop.
     */
    private long errorPauseMs = 1000;

    /**
     * Backoff applied after a transient failure (5xx, timeout, network).
     */
    private long transientRetryMs = 2000;

    /**
     * Backoff applied when a 429 response carries no usable retry-after.
     */
    private long defaultRateLimitRetryMs = 2000;

    /**
     * Maximum age of an event before it is discarded instead of sent
     * (0 = no limit).
     */
    private long maxEventAgeMs = 0;

    /**
     * Interval of the periodic throughput summary.
     */
    private long summaryIntervalMs = 300000; // 5 minutes

    /**
     * How long shutdown waits for the worker thread.
     */
    private int shutdownTimeoutSeconds = 10;

    /**
     * Events per minute the configuration can carry if every cycle is full.
     */
    public int getTheoreticalCapacity() {
        if (batchWindowMs <= 0) {
            return 0;
        }
        return (int) ((60_000.0 / batchWindowMs) * maxBatchSize);
    }
}
