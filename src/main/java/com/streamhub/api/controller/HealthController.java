package com.streamhub.api.controller;

import com.streamhub.api.stream.SseStreamRegistry;
import com.streamhub.market.SummaryRefreshScheduler;
import com.streamhub.market.provider.StockDataProvider;
import com.streamhub.sse.RoomRegistry;
import com.streamhub.sse.StreamStats;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health check endpoint for monitoring and load balancer probes.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final RoomRegistry roomRegistry;
    private final SseStreamRegistry sseStreamRegistry;
    private final SummaryRefreshScheduler summaryRefreshScheduler;
    private final StockDataProvider stockDataProvider;

    public HealthController(
            RoomRegistry roomRegistry,
            SseStreamRegistry sseStreamRegistry,
            SummaryRefreshScheduler summaryRefreshScheduler,
            StockDataProvider stockDataProvider) {
        this.roomRegistry = roomRegistry;
        this.sseStreamRegistry = sseStreamRegistry;
        this.summaryRefreshScheduler = summaryRefreshScheduler;
        this.stockDataProvider = stockDataProvider;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        StreamStats stats = roomRegistry.getStreamStats();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("rooms", stats.rooms());
        body.put("connections", stats.connections());
        body.put("openStreams", sseStreamRegistry.getOpenStreamCount());
        body.put("summaryScheduler", summaryRefreshScheduler.getState());
        body.put("provider", stockDataProvider.getName());
        return ResponseEntity.ok(body);
    }
}
