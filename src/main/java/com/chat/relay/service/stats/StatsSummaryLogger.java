package com.chat.relay.service.stats;

import com.chat.relay.service.config.RelayConfig;
import com.chat.relay.service.ingest.EventQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Logs a throughput summary at a fixed interval, independent of dispatch cycles.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatsSummaryLogger {

    private final RelayStats stats;
    private final EventQueue queue;
    private final RelayConfig relayConfig;

    @Scheduled(fixedDelayString = "${relay.dispatch.summary-interval-ms:300000}",
            initialDelayString = "${relay.dispatch.summary-interval-ms:300000}")
    public void logSummary() {
        if (!relayConfig.getFeatures().isPeriodicSummaryEnabled()) {
            return;
        }
        log.info(summaryLine());
    }

    String summaryLine() {
        RelayStats.Throughput throughput = stats.getMessagesPerMinute();
        RelayStats.Counters counters = stats.counters();
        return String.format(Locale.ROOT,
                "[STATS] Received: %.1f/min | Sent: %.1f/min | Requests: %.1f/min | Queue: %d/%d | "
                        + "Peak queue: %d | Lost: %d | Rate limits: %d (G:%d/S:%d/U:%d)",
                throughput.receivedPerMinute(),
                throughput.sentPerMinute(),
                stats.getRequestsPerMinute(),
                queue.size(),
                queue.getCapacity(),
                counters.peakQueueSize(),
                counters.totalDropped(),
                counters.totalRateLimits(),
                counters.rateLimitsGlobal(),
                counters.rateLimitsShared(),
                counters.rateLimitsUser());
    }
}
