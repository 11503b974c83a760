package com.chat.relay.service.stats;

import com.chat.relay.service.api.dto.StatsSnapshotResponse;
import com.chat.relay.service.config.DispatchConfig;
import com.chat.relay.service.config.IngestionConfig;
import com.chat.relay.service.dispatch.DispatchWorker;
import com.chat.relay.service.health.HealthEvaluator;
import com.chat.relay.service.ingest.EventQueue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Assembles the monitoring snapshot from stats, queue, worker and configuration.
 */
@Service
@RequiredArgsConstructor
public class StatsReporter {

    private final RelayStats stats;
    private final EventQueue queue;
    private final DispatchWorker worker;
    private final DispatchConfig dispatchConfig;
    private final IngestionConfig ingestionConfig;

    public StatsSnapshotResponse snapshot() {
        int queueSize = queue.size();
        int maxQueueSize = queue.getCapacity();

        RelayStats.Throughput throughput = stats.getMessagesPerMinute();
        RelayStats.Counters counters = stats.counters();
        Duration uptime = stats.getUptime();

        return StatsSnapshotResponse.builder()
                .status(HealthEvaluator.evaluate(queueSize, maxQueueSize,
                        counters.totalRateLimits(), counters.totalSent()))
                .uptime(RelayStats.formatUptime(uptime))
                .uptimeSeconds(uptime.getSeconds())
                .queue(StatsSnapshotResponse.QueueInfo.builder()
                        .current(queueSize)
                        .max(maxQueueSize)
                        .percent(maxQueueSize > 0 ? round1((queueSize * 100.0) / maxQueueSize) : 0.0)
                        .peak(counters.peakQueueSize())
                        .peakTime(counters.peakQueueTime())
                        .backlog(worker.getBacklogSize())
                        .build())
                .messages(StatsSnapshotResponse.MessageTotals.builder()
                        .totalReceived(counters.totalReceived())
                        .totalSent(counters.totalSent())
                        .totalDropped(counters.totalDropped())
                        .totalFailed(counters.totalFailed())
                        .receivedPerMinute(round1(throughput.receivedPerMinute()))
                        .sentPerMinute(round1(throughput.sentPerMinute()))
                        .peakPerMinute(round1(counters.peakMessagesPerMinute()))
                        .build())
                .performance(StatsSnapshotResponse.Performance.builder()
                        .totalRequests(counters.totalRequests())
                        .requestsPerMinute(round1(stats.getRequestsPerMinute()))
                        .rateLimits(counters.totalRateLimits())
                        .rateLimitsGlobal(counters.rateLimitsGlobal())
                        .rateLimitsShared(counters.rateLimitsShared())
                        .rateLimitsUser(counters.rateLimitsUser())
                        .transientFailures(counters.totalTransientFailures())
                        .averageLatencyMs(round1(stats.getAverageLatency().toNanos() / 1_000_000.0))
                        .backoffRemainingMs(worker.getBackoffRemaining().toMillis())
                        .build())
                .config(StatsSnapshotResponse.ConfigEcho.builder()
                        .batchWindowMs(dispatchConfig.getBatchWindowMs())
                        .maxBatchSize(dispatchConfig.getMaxBatchSize())
                        .interRequestDelayMs(dispatchConfig.getInterRequestDelayMs())
                        .maxRequestsPerCycle(dispatchConfig.getMaxRequestsPerCycle())
                        .theoreticalCapacity(dispatchConfig.getTheoreticalCapacity())
                        .allowedChannels(List.copyOf(ingestionConfig.getAllowedChannels()))
                        .build())
                .build();
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
