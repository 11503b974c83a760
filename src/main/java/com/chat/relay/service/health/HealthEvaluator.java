package com.chat.relay.service.health;

import com.chat.relay.service.ingest.EventQueue;
import com.chat.relay.service.stats.RelayStats;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Derives the relay health from queue occupancy and rate limit frequency.
 *
 * Evaluated on every call, never cached.
 */
@Component
@RequiredArgsConstructor
public class HealthEvaluator {

    static final double CRITICAL_OCCUPANCY_PERCENT = 80.0;
    static final double WARNING_OCCUPANCY_PERCENT = 50.0;
    static final double RATE_LIMITED_PERCENT = 10.0;

    private final EventQueue queue;
    private final RelayStats stats;

    public HealthStatus currentStatus() {
        return evaluate(queue.size(), queue.getCapacity(), stats.getTotalRateLimits(), stats.getTotalSent());
    }

    /**
     * Occupancy above 80% is CRITICAL, above 50% WARNING; otherwise more than
     * one rate limit per ten sent events is RATE_LIMITED.
     */
    public static HealthStatus evaluate(int queueSize, int maxQueueSize, long totalRateLimits, long totalSent) {
        double occupancy = maxQueueSize > 0 ? (queueSize * 100.0) / maxQueueSize : 0.0;

        if (occupancy > CRITICAL_OCCUPANCY_PERCENT) {
            return HealthStatus.CRITICAL;
        }
        if (occupancy > WARNING_OCCUPANCY_PERCENT) {
            return HealthStatus.WARNING;
        }
        if (totalRateLimits > 0 && totalSent > 0
                && (totalRateLimits * 100.0) / totalSent > RATE_LIMITED_PERCENT) {
            return HealthStatus.RATE_LIMITED;
        }
        return HealthStatus.OK;
    }
}
