package com.chat.relay.service.dispatch;

import com.chat.relay.service.config.DispatchConfig;
import com.chat.relay.service.config.MetricsConfig;
import com.chat.relay.service.config.RelayConfig;
import com.chat.relay.service.format.Batch;
import com.chat.relay.service.format.BatchSplitter;
import com.chat.relay.service.format.DispatchPlan;
import com.chat.relay.service.ingest.ChatEvent;
import com.chat.relay.service.ingest.EventQueue;
import com.chat.relay.service.stats.RelayStats;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single background worker that drains the event queue and delivers batches
 * to the webhook.
 *
 * Each cycle collects the retry backlog followed by fresh queue events for up
 * to one batch window, then either waits (rate limit still active) or splits
 * and sends. A rate limit never blocks the loop for its full duration: the
 * worker sleeps at most {@code backoffPollCeilingMs} at a time and keeps
 * collecting, so intake stays live.
 */
@Slf4j
@Service
public class DispatchWorker {

    private final EventQueue queue;
    private final BatchSplitter splitter;
    private final WebhookSender sender;
    private final RelayStats stats;
    private final DispatchConfig config;
    private final RelayConfig relayConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    // Touched by the worker thread only.
    private final RetryBacklog backlog;

    private ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile WorkerState state = WorkerState.COLLECTING;
    private volatile int backlogSize;

    // Monotonic deadline, meaningful only once backoffStarted is set.
    private volatile long backoffUntilNanos;
    private volatile boolean backoffStarted;

    public DispatchWorker(EventQueue queue,
                          BatchSplitter splitter,
                          WebhookSender sender,
                          RelayStats stats,
                          DispatchConfig config,
                          RelayConfig relayConfig,
                          MetricsConfig metricsConfig,
                          Clock clock) {
        this.queue = queue;
        this.splitter = splitter;
        this.sender = sender;
        this.stats = stats;
        this.config = config;
        this.relayConfig = relayConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.backlog = new RetryBacklog(config.getMaxBacklogSize());
    }

    // ==================== Lifecycle ====================

    @PostConstruct
    void start() {
        metricsConfig.registerQueueGauge(
                "relay.dispatch.backlog.size",
                "Events waiting in the retry backlog",
                this::getBacklogSize
        );

        if (!relayConfig.getFeatures().isDispatchEnabled()) {
            log.warn("Dispatch worker disabled, events will be queued but not delivered");
            return;
        }

        executorService = Executors.newSingleThreadExecutor(this::createWorkerThread);
        running.set(true);
        executorService.submit(this::processLoop);
        log.info("Dispatch worker started (window: {}ms, max batch: {}, inter-request delay: {}ms, max requests/cycle: {})",
                config.getBatchWindowMs(), config.getMaxBatchSize(),
                config.getInterRequestDelayMs(), config.getMaxRequestsPerCycle());
    }

    /**
     * Stops the loop and accounts every event still pending as dropped.
     * Nothing is persisted across restarts.
     */
    @PreDestroy
    void stop() {
        if (executorService == null) {
            return;
        }
        running.set(false);
        executorService.shutdownNow();

        boolean terminated = false;
        try {
            terminated = executorService.awaitTermination(config.getShutdownTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        int abandoned = queue.drainAll().size();
        if (terminated) {
            abandoned += backlog.drainAll().size();
        } else {
            log.warn("Dispatch worker did not stop within {}s", config.getShutdownTimeoutSeconds());
        }
        if (abandoned > 0) {
            stats.recordDropped(abandoned);
            log.warn("Shutdown: {} undelivered event(s) abandoned", abandoned);
        }
        log.info("Dispatch worker stopped");
    }

    private Thread createWorkerThread(Runnable runnable) {
        var thread = new Thread(runnable, "relay-dispatch-worker");
        thread.setDaemon(true);
        return thread;
    }

    // ==================== Processing Loop ====================

    private void processLoop() {
        while (running.get()) {
            try {
                runCycle();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Dispatch worker interrupted");
                return;
            } catch (Exception e) {
                log.error("Unexpected error in dispatch worker loop", e);
                if (!pauseAfterError()) {
                    return;
                }
            }
        }
    }

    /**
     * Runs one collect-then-send cycle.
     *
     * Every event taken from the backlog or the queue leaves the cycle sent,
     * failed, dropped or back in the backlog, also when the cycle is
     * interrupted or a send throws.
     */
    void runCycle() throws InterruptedException {
        state = WorkerState.COLLECTING;
        List<ChatEvent> events = backlog.drainAll();
        collect(events);

        // dequeue swallows the interrupt, so check it here before sending anything
        if (Thread.interrupted()) {
            backlog.addAll(events);
            enforceBacklogLimit();
            throw new InterruptedException("Dispatch worker interrupted while collecting");
        }

        stats.updateQueuePeak(queue.size());
        discardExpired(events);

        long remainingNanos = backoffRemainingNanos();
        if (remainingNanos > 0) {
            state = WorkerState.BACKOFF;
            backlog.addAll(events);
            enforceBacklogLimit();
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(remainingNanos + 999_999);
            log.debug("Rate limit active, waiting {}ms (backlog: {})", remainingMs, backlog.size());
            pause(Math.min(config.getBackoffPollCeilingMs(), remainingMs));
            return;
        }

        try {
            if (!events.isEmpty()) {
                state = WorkerState.SENDING;
                dispatch(events);
            }
        } finally {
            enforceBacklogLimit();
            state = WorkerState.COLLECTING;
        }

        if (events.isEmpty() && backlog.isEmpty()) {
            pause(config.getIdlePauseMs());
        }
    }

    private void collect(List<ChatEvent> events) {
        long deadline = nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getBatchWindowMs());
        while (events.size() < config.getMaxBatchSize()) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - nanoTime());
            if (remainingMs <= 0) {
                break;
            }
            Optional<ChatEvent> next = queue.dequeue(remainingMs);
            if (next.isEmpty()) {
                break;
            }
            events.add(next.get());
        }
    }

    // ==================== Sending ====================

    /**
     * Sends the cycle's batches in order. Whatever is not resolved when the
     * loop ends (the batch that hit a rate limit or transient failure, the
     * batches after it, the deferred events) goes back into the backlog in
     * order. A batch whose send throws is counted as failed.
     */
    private void dispatch(List<ChatEvent> events) throws InterruptedException {
        DispatchPlan plan;
        try {
            plan = splitter.plan(events, config.getMaxRequestsPerCycle());
        } catch (RuntimeException e) {
            stats.recordFailed(events.size());
            log.error("Could not prepare {} event(s) for delivery, abandoned", events.size());
            throw e;
        }
        List<Batch> batches = plan.batches();

        int unresolvedFrom = 0;
        try {
            for (int i = 0; i < batches.size(); i++) {
                unresolvedFrom = i;
                if (i > 0 && config.getInterRequestDelayMs() > 0) {
                    pause(config.getInterRequestDelayMs());
                }

                Batch batch = batches.get(i);
                DispatchOutcome outcome;
                try {
                    outcome = sender.send(batch);
                } catch (RuntimeException e) {
                    unresolvedFrom = i + 1;
                    stats.recordFailed(batch.size());
                    log.error("Batch of {} event(s) abandoned after unexpected send error", batch.size());
                    throw e;
                }

                if (outcome instanceof DispatchOutcome.Success) {
                    onSuccess(batch, i + 1);
                } else if (outcome instanceof DispatchOutcome.RateLimited rateLimited) {
                    stats.recordRateLimit(rateLimited.scope());
                    startBackoff(rateLimited.retryAfter());
                    log.warn("Rate limited ({}), resuming in {}ms | Queue: {}",
                            rateLimited.scope(), rateLimited.retryAfter().toMillis(), queue.size());
                    return;
                } else if (outcome instanceof DispatchOutcome.TransientFailure failure) {
                    stats.recordTransientFailure();
                    startBackoff(failure.retryAfter());
                    log.warn("Delivery failed ({}), retrying in {}ms", failure.reason(), failure.retryAfter().toMillis());
                    return;
                } else if (outcome instanceof DispatchOutcome.PermanentReject reject) {
                    stats.recordFailed(batch.size());
                    log.error("Batch of {} event(s) permanently rejected (HTTP {}), abandoned",
                            batch.size(), reject.statusCode());
                } else {
                    unresolvedFrom = i + 1;
                    stats.recordFailed(batch.size());
                    throw new IllegalStateException("Unhandled dispatch outcome: " + outcome);
                }
                unresolvedFrom = i + 1;
            }
        } finally {
            for (int i = unresolvedFrom; i < batches.size(); i++) {
                backlog.addAll(batches.get(i).events());
            }
            backlog.addAll(plan.deferred());
        }
    }

    private void onSuccess(Batch batch, int requestNumber) {
        stats.recordSent(batch.size());
        Instant sentAt = clock.instant();
        for (ChatEvent event : batch.events()) {
            stats.recordLatency(Duration.between(event.receivedAt(), sentAt));
        }
        log.info("Sent {} event(s) [req {}] | Queue: {}", batch.size(), requestNumber, queue.size());
    }

    private void startBackoff(Duration retryAfter) {
        backoffUntilNanos = nanoTime() + retryAfter.toNanos();
        backoffStarted = true;
    }

    private long backoffRemainingNanos() {
        if (!backoffStarted) {
            return 0;
        }
        return Math.max(0, backoffUntilNanos - nanoTime());
    }

    // ==================== Bounding ====================

    private void enforceBacklogLimit() {
        List<ChatEvent> evicted = backlog.evictOverflow();
        if (!evicted.isEmpty()) {
            stats.recordDropped(evicted.size());
            log.warn("Retry backlog full ({}), {} oldest event(s) abandoned", backlog.getMaxSize(), evicted.size());
        }
        backlogSize = backlog.size();
    }

    private void discardExpired(List<ChatEvent> events) {
        long maxAgeMs = config.getMaxEventAgeMs();
        if (maxAgeMs <= 0 || events.isEmpty()) {
            return;
        }
        Instant cutoff = clock.instant().minusMillis(maxAgeMs);
        int before = events.size();
        events.removeIf(event -> event.receivedAt().isBefore(cutoff));
        int expired = before - events.size();
        if (expired > 0) {
            stats.recordDropped(expired);
            log.warn("{} event(s) older than {}ms abandoned", expired, maxAgeMs);
        }
    }

    // ==================== Pausing ====================

    /**
     * Sleeps for the given time. The only deliberate delay of the loop.
     */
    protected void pause(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }

    /**
     * Monotonic time source for backoff and batch windows, unaffected by
     * wall-clock steps.
     */
    protected long nanoTime() {
        return System.nanoTime();
    }

    private boolean pauseAfterError() {
        try {
            pause(config.getErrorPauseMs());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ==================== Monitoring ====================

    public WorkerState getState() {
        return state;
    }

    public int getBacklogSize() {
        return backlogSize;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Remaining backoff, zero when no rate limit is active.
     */
    public Duration getBackoffRemaining() {
        return Duration.ofNanos(backoffRemainingNanos());
    }
}
