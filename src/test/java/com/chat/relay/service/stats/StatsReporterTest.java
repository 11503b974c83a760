package com.chat.relay.service.stats;

import com.chat.relay.service.api.dto.StatsSnapshotResponse;
import com.chat.relay.service.config.DispatchConfig;
import com.chat.relay.service.config.IngestionConfig;
import com.chat.relay.service.config.MetricsConfig;
import com.chat.relay.service.config.RelayConfig;
import com.chat.relay.service.config.WebhookConfig;
import com.chat.relay.service.dispatch.DispatchWorker;
import com.chat.relay.service.dispatch.RateLimitScope;
import com.chat.relay.service.dispatch.DispatchOutcome;
import com.chat.relay.service.format.BatchSplitter;
import com.chat.relay.service.format.DiscordMessageFormatter;
import com.chat.relay.service.config.FormatConfig;
import com.chat.relay.service.health.HealthStatus;
import com.chat.relay.service.ingest.ChatEvent;
import com.chat.relay.service.ingest.DefaultEventQueue;
import com.chat.relay.service.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StatsReporterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));

    private RelayStats stats;
    private DefaultEventQueue queue;
    private StatsReporter reporter;
    private StatsSummaryLogger summaryLogger;

    @BeforeEach
    void setUp() {
        stats = new RelayStats(clock);
        MetricsConfig metricsConfig = new MetricsConfig(new SimpleMeterRegistry(), stats);

        IngestionConfig ingestionConfig = new IngestionConfig();
        ingestionConfig.setMaxQueueSize(10);
        ingestionConfig.setAllowedChannels(List.of("global"));
        queue = new DefaultEventQueue(ingestionConfig, metricsConfig);
        queue.init();

        DispatchConfig dispatchConfig = new DispatchConfig();
        RelayConfig relayConfig = new RelayConfig();
        WebhookConfig webhookConfig = new WebhookConfig();
        webhookConfig.setUrl("http://localhost/webhook");
        BatchSplitter splitter = new BatchSplitter(new DiscordMessageFormatter(new FormatConfig()), webhookConfig);
        DispatchWorker worker = new DispatchWorker(queue, splitter, batch -> DispatchOutcome.success(),
                stats, dispatchConfig, relayConfig, metricsConfig, clock);

        reporter = new StatsReporter(stats, queue, worker, dispatchConfig, ingestionConfig);
        summaryLogger = new StatsSummaryLogger(stats, queue, relayConfig);
    }

    @Test
    void snapshot_reportsQueueTotalsAndConfiguration() {
        for (int i = 0; i < 6; i++) {
            stats.recordReceived();
            queue.enqueue(new ChatEvent("Alice", "", "m" + i, "say", "", "", clock.instant()));
        }
        stats.updateQueuePeak(6);
        stats.recordSent(4);
        stats.recordRequest();
        stats.recordRateLimit(RateLimitScope.SHARED);
        clock.advance(Duration.ofSeconds(65));

        StatsSnapshotResponse snapshot = reporter.snapshot();

        assertThat(snapshot.getStatus()).isEqualTo(HealthStatus.WARNING);
        assertThat(snapshot.getUptime()).isEqualTo("1m 5s");
        assertThat(snapshot.getUptimeSeconds()).isEqualTo(65);

        assertThat(snapshot.getQueue().getCurrent()).isEqualTo(6);
        assertThat(snapshot.getQueue().getMax()).isEqualTo(10);
        assertThat(snapshot.getQueue().getPercent()).isEqualTo(60.0);
        assertThat(snapshot.getQueue().getPeak()).isEqualTo(6);
        assertThat(snapshot.getQueue().getPeakTime()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));

        assertThat(snapshot.getMessages().getTotalReceived()).isEqualTo(6);
        assertThat(snapshot.getMessages().getTotalSent()).isEqualTo(4);

        assertThat(snapshot.getPerformance().getTotalRequests()).isEqualTo(1);
        assertThat(snapshot.getPerformance().getRateLimits()).isEqualTo(1);
        assertThat(snapshot.getPerformance().getRateLimitsShared()).isEqualTo(1);
        assertThat(snapshot.getPerformance().getBackoffRemainingMs()).isZero();

        assertThat(snapshot.getConfig().getBatchWindowMs()).isEqualTo(2500);
        assertThat(snapshot.getConfig().getMaxBatchSize()).isEqualTo(20);
        assertThat(snapshot.getConfig().getTheoreticalCapacity()).isEqualTo(480);
        assertThat(snapshot.getConfig().getAllowedChannels()).containsExactly("global");
    }

    @Test
    void summaryLine_listsRatesQueueAndRateLimitsByScope() {
        stats.recordReceived();
        stats.recordRateLimit(RateLimitScope.GLOBAL);
        queue.enqueue(new ChatEvent("Alice", "", "hello", "say", "", "", clock.instant()));

        String line = summaryLogger.summaryLine();

        assertThat(line).startsWith("[STATS] Received: 6.0/min");
        assertThat(line).contains("Queue: 1/10");
        assertThat(line).contains("Rate limits: 1 (G:1/S:0/U:0)");
    }
}
