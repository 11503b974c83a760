package com.chat.relay.service.config;

import com.chat.relay.service.dispatch.RateLimitScope;
import com.chat.relay.service.stats.RelayStats;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;
import java.util.function.Supplier;
import java.util.function.ToDoubleFunction;

/**
 * Metrics configuration for the Chat Relay Service.
 *
 * Publishes the relay statistics through Micrometer. Counters read the
 * {@link RelayStats} totals, so the stats aggregator stays the single source
 * of truth.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Timers
    private final Timer webhookRequestTimer;

    public MetricsConfig(MeterRegistry registry, RelayStats stats) {
        this.registry = registry;

        registerCounter("relay.messages.received", "Chat events received from the game server",
                stats, RelayStats::getTotalReceived);
        registerCounter("relay.messages.sent", "Chat events delivered to the webhook",
                stats, RelayStats::getTotalSent);
        registerCounter("relay.messages.dropped", "Chat events lost to a full queue, backlog overflow or shutdown",
                stats, RelayStats::getTotalDropped);
        registerCounter("relay.messages.failed", "Chat events permanently rejected by the webhook",
                stats, RelayStats::getTotalFailed);
        registerCounter("relay.webhook.requests", "Webhook requests attempted",
                stats, RelayStats::getTotalRequests);

        for (RateLimitScope scope : RateLimitScope.values()) {
            FunctionCounter.builder("relay.webhook.rate-limits", stats, s -> s.getRateLimits(scope))
                    .description("Rate limit responses received from the webhook")
                    .tag("scope", scope.name().toLowerCase(Locale.ROOT))
                    .register(registry);
        }

        this.webhookRequestTimer = Timer.builder("relay.webhook.request.duration")
                .description("Time taken by one webhook delivery attempt")
                .register(registry);
    }

    /**
     * Registers a gauge for queue depth monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerQueueGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }

    private void registerCounter(String name, String description, RelayStats stats,
                                 ToDoubleFunction<RelayStats> total) {
        FunctionCounter.builder(name, stats, total)
                .description(description)
                .register(registry);
    }
}
