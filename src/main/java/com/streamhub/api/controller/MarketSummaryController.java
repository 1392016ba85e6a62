package com.streamhub.api.controller;

import com.streamhub.api.dto.response.SchedulerStatusResponse;
import com.streamhub.api.stream.SseStreamRegistry;
import com.streamhub.auth.PeerIdentityService;
import com.streamhub.config.StreamHubProperties;
import com.streamhub.domain.model.MarketSummary;
import com.streamhub.exception.ResourceNotFoundException;
import com.streamhub.market.MarketSummaryService;
import com.streamhub.market.SummaryRefreshScheduler;
import com.streamhub.sse.ReplayService;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

/**
 * REST endpoints for the shared market summary.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/market/summary -- cached summary, 404 when absent or older than the TTL</li>
 *   <li>POST /api/market/summary/refresh -- fetch all tracked symbols now</li>
 *   <li>GET /api/market/summary/stream -- market-summary events</li>
 *   <li>GET /api/market/summary/scheduler -- background refresh state</li>
 *   <li>DELETE /api/market/summary/scheduler -- stop the background refresh</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/market/summary")
public class MarketSummaryController {

    private final MarketSummaryService marketSummaryService;
    private final SummaryRefreshScheduler summaryRefreshScheduler;
    private final SseStreamRegistry sseStreamRegistry;
    private final PeerIdentityService peerIdentityService;
    private final StreamHubProperties properties;

    public MarketSummaryController(
            MarketSummaryService marketSummaryService,
            SummaryRefreshScheduler summaryRefreshScheduler,
            SseStreamRegistry sseStreamRegistry,
            PeerIdentityService peerIdentityService,
            StreamHubProperties properties) {
        this.marketSummaryService = marketSummaryService;
        this.summaryRefreshScheduler = summaryRefreshScheduler;
        this.sseStreamRegistry = sseStreamRegistry;
        this.peerIdentityService = peerIdentityService;
        this.properties = properties;
    }

    /**
     * Never calls the provider. Clients seeing 404 should POST /refresh or open the stream.
     */
    @GetMapping
    public ResponseEntity<MarketSummary> getSummary() {
        return marketSummaryService
                .getSummary()
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Market summary", "global"));
    }

    @PostMapping("/refresh")
    public ResponseEntity<MarketSummary> refresh() {
        return ResponseEntity.ok(marketSummaryService.refreshSummaryViaProvider());
    }

    @GetMapping("/stream")
    public ResponseEntity<ResponseBodyEmitter> stream(
            @RequestParam(required = false) String connectionId,
            @RequestParam(required = false) String lastEventId,
            @RequestParam(required = false) String token,
            @RequestHeader(value = SseController.LAST_EVENT_ID_HEADER, required = false) String lastEventIdHeader,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String roomId = properties.getSummary().getRoomId();
        String peerId =
                peerIdentityService.resolvePeerId(roomId, PeerIdentityService.extractCredential(authorization, token));
        String id = StreamResponses.connectionIdOrNew(connectionId);
        Long cursor = ReplayService.parseLastEventId(lastEventIdHeader != null ? lastEventIdHeader : lastEventId);

        ResponseBodyEmitter emitter =
                sseStreamRegistry.open(id, () -> marketSummaryService.subscribe(id, peerId, cursor));
        return StreamResponses.eventStream(emitter, id, peerId);
    }

    @GetMapping("/scheduler")
    public ResponseEntity<SchedulerStatusResponse> getSchedulerStatus() {
        return ResponseEntity.ok(SchedulerStatusResponse.builder()
                .state(summaryRefreshScheduler.getState())
                .lastActivity(marketSummaryService.getLastActivity().orElse(null))
                .lastTickAt(summaryRefreshScheduler.getLastTickAt().orElse(null))
                .lastError(summaryRefreshScheduler.getLastError().orElse(null))
                .summaryCachedAt(marketSummaryService
                        .peekCachedSummary()
                        .map(MarketSummary::getCachedAt)
                        .orElse(null))
                .build());
    }

    @DeleteMapping("/scheduler")
    public ResponseEntity<Map<String, Object>> stopScheduler() {
        boolean stopped = summaryRefreshScheduler.stop();
        return ResponseEntity.ok(Map.of("stopped", stopped, "state", summaryRefreshScheduler.getState()));
    }
}
