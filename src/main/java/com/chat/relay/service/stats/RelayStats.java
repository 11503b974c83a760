package com.chat.relay.service.stats;

import com.chat.relay.service.dispatch.RateLimitScope;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

/**
 * Process-wide relay statistics.
 *
 * Written by intake and by the dispatch worker, read by reporting. Every field
 * is guarded by this instance's monitor, so readers never see a half-applied
 * update and slot rotation cannot be corrupted by concurrent writers.
 *
 * Throughput is estimated over a sliding window of {@value #HISTORY_SLOTS}
 * archived 10-second slots plus the slot in progress.
 */
@Component
public class RelayStats {

    static final long SLOT_MILLIS = 10_000;
    static final int HISTORY_SLOTS = 30;
    static final int LATENCY_SAMPLES = 100;

    private final Clock clock;
    private final Instant startedAt;

    private long totalReceived;
    private long totalSent;
    private long totalDropped;
    private long totalFailed;
    private long totalTransientFailures;
    private long totalRequests;
    private long totalRateLimits;
    private final Map<RateLimitScope, Long> rateLimitsByScope = new EnumMap<>(RateLimitScope.class);

    private int peakQueueSize;
    private Instant peakQueueTime;
    private double peakMessagesPerMinute;

    private final Deque<SlotCounts> history = new ArrayDeque<>(HISTORY_SLOTS + 1);
    private final Deque<Duration> latencies = new ArrayDeque<>(LATENCY_SAMPLES + 1);
    private long currentSlot;
    private long slotReceived;
    private long slotSent;

    public RelayStats(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
        this.currentSlot = slotOf(clock.millis());
        for (RateLimitScope scope : RateLimitScope.values()) {
            rateLimitsByScope.put(scope, 0L);
        }
    }

    // ==================== Writers ====================

    public synchronized void recordReceived() {
        rotateSlot();
        totalReceived++;
        slotReceived++;
    }

    public synchronized void recordSent(int count) {
        rotateSlot();
        totalSent += count;
        slotSent += count;
    }

    public synchronized void recordDropped(int count) {
        totalDropped += count;
    }

    public synchronized void recordFailed(int count) {
        totalFailed += count;
    }

    public synchronized void recordTransientFailure() {
        totalTransientFailures++;
    }

    public synchronized void recordRequest() {
        totalRequests++;
    }

    public synchronized void recordRateLimit(RateLimitScope scope) {
        totalRateLimits++;
        rateLimitsByScope.merge(scope, 1L, Long::sum);
    }

    /**
     * Keeps the last {@value #LATENCY_SAMPLES} reception-to-send latencies.
     */
    public synchronized void recordLatency(Duration latency) {
        latencies.addLast(latency.isNegative() ? Duration.ZERO : latency);
        if (latencies.size() > LATENCY_SAMPLES) {
            latencies.removeFirst();
        }
    }

    public synchronized void updateQueuePeak(int queueSize) {
        if (queueSize > peakQueueSize) {
            peakQueueSize = queueSize;
            peakQueueTime = clock.instant();
        }
    }

    // ==================== Derived reads ====================

    /**
     * Average received and sent events per minute over the sliding window.
     * Also raises the received-per-minute peak.
     */
    public synchronized Throughput getMessagesPerMinute() {
        rotateSlot();

        long receivedSum = slotReceived;
        long sentSum = slotSent;
        for (SlotCounts slot : history) {
            receivedSum += slot.received();
            sentSum += slot.sent();
        }

        int slots = history.size() + 1;
        double minutes = (slots * SLOT_MILLIS) / 60_000.0;
        double receivedPerMinute = receivedSum / minutes;
        double sentPerMinute = sentSum / minutes;

        if (receivedPerMinute > peakMessagesPerMinute) {
            peakMessagesPerMinute = receivedPerMinute;
        }
        return new Throughput(receivedPerMinute, sentPerMinute);
    }

    public synchronized Duration getAverageLatency() {
        if (latencies.isEmpty()) {
            return Duration.ZERO;
        }
        long totalNanos = 0;
        for (Duration latency : latencies) {
            totalNanos += latency.toNanos();
        }
        return Duration.ofNanos(totalNanos / latencies.size());
    }

    /**
     * Average webhook requests per minute since startup.
     */
    public synchronized double getRequestsPerMinute() {
        double uptimeSeconds = getUptime().toMillis() / 1000.0;
        if (uptimeSeconds <= 0) {
            return 0.0;
        }
        return (totalRequests / uptimeSeconds) * 60;
    }

    public Duration getUptime() {
        Duration uptime = Duration.between(startedAt, clock.instant());
        return uptime.isNegative() ? Duration.ZERO : uptime;
    }

    /**
     * Consistent copy of every counter taken under a single lock acquisition.
     */
    public synchronized Counters counters() {
        return new Counters(
                totalReceived,
                totalSent,
                totalDropped,
                totalFailed,
                totalTransientFailures,
                totalRequests,
                totalRateLimits,
                rateLimitsByScope.get(RateLimitScope.GLOBAL),
                rateLimitsByScope.get(RateLimitScope.SHARED),
                rateLimitsByScope.get(RateLimitScope.USER),
                peakQueueSize,
                peakQueueTime,
                peakMessagesPerMinute
        );
    }

    public synchronized long getTotalReceived() {
        return totalReceived;
    }

    public synchronized long getTotalSent() {
        return totalSent;
    }

    public synchronized long getTotalDropped() {
        return totalDropped;
    }

    public synchronized long getTotalFailed() {
        return totalFailed;
    }

    public synchronized long getTotalRequests() {
        return totalRequests;
    }

    public synchronized long getTotalRateLimits() {
        return totalRateLimits;
    }

    public synchronized long getRateLimits(RateLimitScope scope) {
        return rateLimitsByScope.get(scope);
    }

    public synchronized int getPeakQueueSize() {
        return peakQueueSize;
    }

    /**
     * Formats an uptime as {@code 1h 2m 3s}, dropping leading zero units.
     */
    public static String formatUptime(Duration uptime) {
        long totalSeconds = uptime.getSeconds();
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;
        if (hours > 0) {
            return hours + "h " + minutes + "m " + seconds + "s";
        }
        if (minutes > 0) {
            return minutes + "m " + seconds + "s";
        }
        return seconds + "s";
    }

    // ==================== Slot rotation ====================

    // Caller holds the monitor.
    private void rotateSlot() {
        long slot = slotOf(clock.millis());
        if (slot <= currentSlot) {
            return;
        }
        archive(new SlotCounts(slotReceived, slotSent));

        // slots that passed without any write count as empty
        long idleSlots = Math.min(slot - currentSlot - 1, HISTORY_SLOTS);
        for (long i = 0; i < idleSlots; i++) {
            archive(SlotCounts.EMPTY);
        }

        slotReceived = 0;
        slotSent = 0;
        currentSlot = slot;
    }

    private void archive(SlotCounts counts) {
        history.addLast(counts);
        if (history.size() > HISTORY_SLOTS) {
            history.removeFirst();
        }
    }

    private static long slotOf(long epochMillis) {
        return Math.floorDiv(epochMillis, SLOT_MILLIS);
    }

    private record SlotCounts(long received, long sent) {
        static final SlotCounts EMPTY = new SlotCounts(0, 0);
    }

    /**
     * Events per minute over the sliding window.
     */
    public record Throughput(double receivedPerMinute, double sentPerMinute) {
    }

    /**
     * Point-in-time copy of the counters.
     */
    public record Counters(
            long totalReceived,
            long totalSent,
            long totalDropped,
            long totalFailed,
            long totalTransientFailures,
            long totalRequests,
            long totalRateLimits,
            long rateLimitsGlobal,
            long rateLimitsShared,
            long rateLimitsUser,
            int peakQueueSize,
            Instant peakQueueTime,
            double peakMessagesPerMinute
    ) {
    }
}
