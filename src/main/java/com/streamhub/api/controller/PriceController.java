package com.streamhub.api.controller;

import com.streamhub.api.dto.request.PriceSubmissionRequest;
import com.streamhub.auth.PeerIdentityService;
import com.streamhub.domain.model.PriceQuote;
import com.streamhub.domain.model.PriceSnapshot;
import com.streamhub.exception.ResourceNotFoundException;
import com.streamhub.exception.UnauthorizedException;
import com.streamhub.pricefeed.PriceFeedService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the price feed.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/prices -- latest price of every symbol</li>
 *   <li>GET /api/prices/{symbol} -- latest price of one symbol</li>
 *   <li>POST /api/prices -- submit a price (price oracle only, Bearer token required)</li>
 *   <li>GET /api/prices/history -- retained snapshots, oldest first</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/prices")
public class PriceController {

    private final PriceFeedService priceFeedService;
    private final PeerIdentityService peerIdentityService;

    public PriceController(PriceFeedService priceFeedService, PeerIdentityService peerIdentityService) {
        this.priceFeedService = priceFeedService;
        this.peerIdentityService = peerIdentityService;
    }

    @GetMapping
    public ResponseEntity<List<PriceQuote>> getAllPrices() {
        return ResponseEntity.ok(priceFeedService.getAllPrices());
    }

    @GetMapping("/history")
    public ResponseEntity<List<PriceSnapshot>> getHistory() {
        return ResponseEntity.ok(priceFeedService.getPriceHistory());
    }

    @GetMapping("/{symbol}")
    public ResponseEntity<PriceQuote> getPrice(@PathVariable String symbol) {
        return priceFeedService
                .getPrice(symbol)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Price", symbol));
    }

    @PostMapping
    public ResponseEntity<PriceQuote> submitPrice(
            @Valid @RequestBody PriceSubmissionRequest request,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String credential = PeerIdentityService.extractCredential(authorization, null);
        if (credential == null || credential.isBlank()) {
            throw new UnauthorizedException("Bearer token required");
        }
        String peerId = peerIdentityService.requirePeerId(credential);
        return ResponseEntity.ok(priceFeedService.submitPrice(peerId, request.getSymbol(), request.getPrice()));
    }
}
