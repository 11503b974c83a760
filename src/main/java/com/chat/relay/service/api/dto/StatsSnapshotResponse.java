package com.chat.relay.service.api.dto;

import com.chat.relay.service.health.HealthStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the relay for external monitoring.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatsSnapshotResponse {

    private HealthStatus status;
    private String uptime;
    private long uptimeSeconds;
    private QueueInfo queue;
    private MessageTotals messages;
    private Performance performance;
    private ConfigEcho config;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class QueueInfo {
        private int current;
        private int max;
        private double percent;
        private int peak;
        private Instant peakTime;
        private int backlog;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MessageTotals {
        private long totalReceived;
        private long totalSent;
        private long totalDropped;
        private long totalFailed;
        private double receivedPerMinute;
        private double sentPerMinute;
        private double peakPerMinute;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Performance {
        private long totalRequests;
        private double requestsPerMinute;
        private long rateLimits;
        private long rateLimitsGlobal;
        private long rateLimitsShared;
        private long rateLimitsUser;
        private long transientFailures;
        private double averageLatencyMs;
        private long backoffRemainingMs;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConfigEcho {
        private long batchWindowMs;
        private int maxBatchSize;
        private long interRequestDelayMs;
        private int maxRequestsPerCycle;
        private int theoreticalCapacity;
        private List<String> allowedChannels;
    }
}
