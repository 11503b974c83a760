package com.chat.relay.service.api.controller;

import com.chat.relay.service.api.dto.ApiResponse;
import com.chat.relay.service.api.dto.StatsSnapshotResponse;
import com.chat.relay.service.stats.StatsReporter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller exposing relay statistics for external monitoring.
 */
@RestController
@Tag(name = "Monitoring", description = "Relay throughput and health statistics")
@RequiredArgsConstructor
public class StatsController {

    private final StatsReporter statsReporter;

    @GetMapping("/stats")
    @Operation(summary = "Get relay statistics",
               description = "Returns health status, queue occupancy, message totals, rates and configuration")
    public ResponseEntity<ApiResponse<StatsSnapshotResponse>> getStats() {
        return ResponseEntity.ok(ApiResponse.success(statsReporter.snapshot()));
    }
}
