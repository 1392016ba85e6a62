package com.streamhub.api.controller;

import com.streamhub.api.stream.SseStreamRegistry;
import com.streamhub.auth.PeerIdentityService;
import com.streamhub.domain.model.Stock;
import com.streamhub.exception.ResourceNotFoundException;
import com.streamhub.market.StockDataService;
import com.streamhub.market.StockSubscriptionService;
import com.streamhub.sse.ReplayService;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

/**
 * REST endpoints for per-stock data and the stock event streams.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/stocks/{symbol} -- cached snapshot, fetched from the provider when due</li>
 *   <li>GET /api/stocks/{symbol}/cached -- cached snapshot only, 404 when due for refresh</li>
 *   <li>GET /api/stocks/{symbol}/stream -- price-update and news-update events of the symbol</li>
 *   <li>GET /api/stocks/{symbol}/subscribers -- connection ids subscribed to the symbol</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/stocks")
public class StockController {

    private final StockDataService stockDataService;
    private final StockSubscriptionService stockSubscriptionService;
    private final SseStreamRegistry sseStreamRegistry;
    private final PeerIdentityService peerIdentityService;

    public StockController(
            StockDataService stockDataService,
            StockSubscriptionService stockSubscriptionService,
            SseStreamRegistry sseStreamRegistry,
            PeerIdentityService peerIdentityService) {
        this.stockDataService = stockDataService;
        this.stockSubscriptionService = stockSubscriptionService;
        this.sseStreamRegistry = sseStreamRegistry;
        this.peerIdentityService = peerIdentityService;
    }

    @GetMapping("/{symbol}")
    public ResponseEntity<Stock> getStock(@PathVariable String symbol) {
        return ResponseEntity.ok(stockDataService.getOrFetch(symbol));
    }

    @GetMapping("/{symbol}/cached")
    public ResponseEntity<Stock> getCachedStock(@PathVariable String symbol) {
        return stockDataService
                .findCached(symbol)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Cached stock", symbol));
    }

    @GetMapping("/{symbol}/stream")
    public ResponseEntity<ResponseBodyEmitter> stream(
            @PathVariable String symbol,
            @RequestParam(required = false) String connectionId,
            @RequestParam(required = false) String lastEventId,
            @RequestParam(required = false) String token,
            @RequestHeader(value = SseController.LAST_EVENT_ID_HEADER, required = false) String lastEventIdHeader,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String roomId = stockDataService.stockRoomId(symbol);
        String peerId =
                peerIdentityService.resolvePeerId(roomId, PeerIdentityService.extractCredential(authorization, token));
        String id = StreamResponses.connectionIdOrNew(connectionId);
        Long cursor = ReplayService.parseLastEventId(lastEventIdHeader != null ? lastEventIdHeader : lastEventId);

        ResponseBodyEmitter emitter =
                sseStreamRegistry.open(id, () -> stockSubscriptionService.subscribe(id, symbol, peerId, cursor));
        return StreamResponses.eventStream(emitter, id, peerId);
    }

    @GetMapping("/{symbol}/subscribers")
    public ResponseEntity<Map<String, Object>> getSubscribers(@PathVariable String symbol) {
        List<String> subscribers = stockSubscriptionService.getSubscribers(symbol);
        return ResponseEntity.ok(Map.of(
                "symbol", stockDataService.normalizeSymbol(symbol),
                "subscribers", subscribers));
    }
}
