package com.chat.relay.service.api.health;

import com.chat.relay.service.dispatch.DispatchWorker;
import com.chat.relay.service.health.HealthEvaluator;
import com.chat.relay.service.health.HealthStatus;
import com.chat.relay.service.ingest.EventQueue;
import com.chat.relay.service.stats.RelayStats;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the relay pipeline.
 *
 * CRITICAL (queue above 80%) reports DOWN; WARNING and RATE LIMITED stay UP
 * with the status in the details.
 */
@Component
@RequiredArgsConstructor
public class RelayHealthIndicator implements HealthIndicator {

    private final HealthEvaluator healthEvaluator;
    private final EventQueue queue;
    private final RelayStats stats;
    private final DispatchWorker worker;

    @Override
    public Health health() {
        HealthStatus status = healthEvaluator.currentStatus();

        Health.Builder builder = status == HealthStatus.CRITICAL
                ? Health.down()
                : Health.up();

        return builder
                .withDetail("relayStatus", status.getLabel())
                .withDetail("queueSize", queue.size())
                .withDetail("maxQueueSize", queue.getCapacity())
                .withDetail("utilizationPercent", Math.round(queue.getUtilizationPercent() * 10.0) / 10.0)
                .withDetail("backlogSize", worker.getBacklogSize())
                .withDetail("workerState", worker.getState().name())
                .withDetail("rateLimits", stats.getTotalRateLimits())
                .withDetail("totalSent", stats.getTotalSent())
                .build();
    }
}
