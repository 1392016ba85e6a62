package com.streamhub.market;

import com.streamhub.config.StreamHubProperties;
import com.streamhub.domain.enums.SseEventType;
import com.streamhub.domain.model.MarketSummary;
import com.streamhub.domain.model.SseEvent;
import com.streamhub.domain.model.Stock;
import com.streamhub.event.EventPublisherHelper;
import com.streamhub.exception.MarketDataException;
import com.streamhub.market.provider.StockDataProvider;
import com.streamhub.pricefeed.PriceFeedService;
import com.streamhub.sse.BroadcastEngine;
import com.streamhub.sse.ReplayService;
import com.streamhub.sse.RoomRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Process-wide market summary over the tracked symbols.
 *
 * <p>Every read records reader activity, which keeps the {@link SummaryRefreshScheduler}
 * alive. The cached summary is replaced as a whole and only by a refresh in which at least
 * one symbol succeeded. Both the scheduler and request threads may refresh; the newer
 * summary wins.
 */
@Service
public class MarketSummaryService {

    private static final Logger log = LoggerFactory.getLogger(MarketSummaryService.class);

    private final StockDataProvider stockDataProvider;
    private final RoomRegistry roomRegistry;
    private final BroadcastEngine broadcastEngine;
    private final ReplayService replayService;
    private final MarketPayloads marketPayloads;
    private final PriceFeedService priceFeedService;
    private final EventPublisherHelper eventPublisherHelper;
    private final StreamHubProperties properties;
    private final Clock clock;

    private final AtomicReference<MarketSummary> cachedSummary = new AtomicReference<>();
    private final AtomicReference<Instant> lastActivity = new AtomicReference<>();

    public MarketSummaryService(
            StockDataProvider stockDataProvider,
            RoomRegistry roomRegistry,
            BroadcastEngine broadcastEngine,
            ReplayService replayService,
            MarketPayloads marketPayloads,
            PriceFeedService priceFeedService,
            EventPublisherHelper eventPublisherHelper,
            StreamHubProperties properties,
            Clock clock) {
        this.stockDataProvider = stockDataProvider;
        this.roomRegistry = roomRegistry;
        this.broadcastEngine = broadcastEngine;
        this.replayService = replayService;
        this.marketPayloads = marketPayloads;
        this.priceFeedService = priceFeedService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Cached summary if younger than the TTL. Never calls the provider.
     */
    public Optional<MarketSummary> getSummary() {
        recordActivity();
        return freshCachedSummary();
    }

    /**
     * Cached summary if still fresh, otherwise a provider-backed refresh.
     *
     * @throws MarketDataException if a refresh was needed and every symbol failed
     */
    public MarketSummary getSummaryOrRefresh() {
        recordActivity();
        return freshCachedSummary().orElseGet(this::refreshSummaryViaProvider);
    }

    /**
     * Fetches every tracked symbol and replaces the cached summary if at least one succeeded.
     *
     * @throws MarketDataException if every symbol failed; the previous summary is kept
     */
    public MarketSummary refreshSummaryViaProvider() {
        List<String> symbols = properties.getSummary().getTrackedSymbols();
        Map<String, Stock> stocks = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();

        for (String symbol : symbols) {
            try {
                stocks.put(symbol, stockDataProvider.fetch(symbol));
            } catch (RuntimeException e) {
                failed.add(symbol);
                log.warn("Summary fetch for {} failed: {}", symbol, e.getMessage());
            }
        }

        if (stocks.isEmpty()) {
            log.error("Market summary refresh failed for all {} symbols", symbols.size());
            throw new MarketDataException("Failed to fetch any of the " + symbols.size() + " tracked symbols");
        }
        if (!failed.isEmpty()) {
            log.warn("Market summary refreshed without {} symbols: {}", failed.size(), failed);
        }

        MarketSummary fresh = MarketSummary.builder()
                .stocks(Collections.unmodifiableMap(stocks))
                .cachedAt(clock.instant())
                .build();
        MarketSummary current = cachedSummary.accumulateAndGet(
                fresh, (previous, next) -> previous != null && previous.getCachedAt().isAfter(next.getCachedAt())
                        ? previous
                        : next);
        if (current != fresh) {
            // a newer concurrent refresh already recorded and published its own snapshot
            log.debug("Discarding market summary from {}, a newer one is cached", fresh.getCachedAt());
            return current;
        }
        log.info("Market summary refreshed: {} of {} symbols", stocks.size(), symbols.size());

        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        stocks.forEach((symbol, stock) -> prices.put(symbol, stock.getCurrentPrice()));
        priceFeedService.recordPrices(prices, "market-summary");

        publishSummary(current);
        eventPublisherHelper.publishSummaryActivity(this, false);
        return current;
    }

    /**
     * Attaches a connection to the summary room, counting as reader activity.
     *
     * @return buffered summary events after {@code lastEventId}
     */
    public List<SseEvent> subscribe(String connectionId, String peerId, Long lastEventId) {
        String roomId = properties.getSummary().getRoomId();
        recordActivity();
        roomRegistry.addConnection(roomId, connectionId, peerId, lastEventId);
        return replayService.eventsSince(roomId, lastEventId);
    }

    public void recordActivity() {
        lastActivity.set(clock.instant());
        eventPublisherHelper.publishSummaryActivity(this, true);
    }

    public boolean hasRecentActivity(Instant now) {
        Instant last = lastActivity.get();
        if (last == null) {
            return false;
        }
        return Duration.between(last, now).compareTo(properties.getSummary().getActivityWindow()) < 0;
    }

    public Optional<Instant> getLastActivity() {
        return Optional.ofNullable(lastActivity.get());
    }

    /** Cached summary regardless of age, for diagnostics. */
    public Optional<MarketSummary> peekCachedSummary() {
        return Optional.ofNullable(cachedSummary.get());
    }

    private Optional<MarketSummary> freshCachedSummary() {
        MarketSummary summary = cachedSummary.get();
        if (summary == null) {
            return Optional.empty();
        }
        Duration age = Duration.between(summary.getCachedAt(), clock.instant());
        return age.compareTo(properties.getSummary().getTtl()) < 0 ? Optional.of(summary) : Optional.empty();
    }

    private void publishSummary(MarketSummary summary) {
        String roomId = properties.getSummary().getRoomId();
        if (roomRegistry.findRoom(roomId).isEmpty()) {
            return;
        }
        try {
            broadcastEngine.broadcast(roomId, SseEventType.MARKET_SUMMARY, marketPayloads.marketSummary(summary.getStocks()));
        } catch (RuntimeException e) {
            log.warn("Failed to push market summary to {}: {}", roomId, e.getMessage());
        }
    }
}
