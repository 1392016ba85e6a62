package com.streamhub.market;

import com.streamhub.config.StreamHubProperties;
import com.streamhub.domain.enums.SseEventType;
import com.streamhub.domain.model.Stock;
import com.streamhub.domain.model.StockCacheEntry;
import com.streamhub.exception.BusinessException;
import com.streamhub.exception.MarketDataException;
import com.streamhub.exception.ResourceNotFoundException;
import com.streamhub.market.provider.StockDataProvider;
import com.streamhub.observability.StreamMetricsService;
import com.streamhub.repository.StockCacheRepository;
import com.streamhub.sse.BroadcastEngine;
import com.streamhub.sse.RoomRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Read-through cache in front of the market data provider.
 *
 * <p>Cache reads and write-backs run on this instance's monitor; the provider call does not.
 * After the call returns the entry is read again, and an entry stored by a concurrent request
 * while this one was fetching is kept rather than overwritten.
 *
 * <p>A failed fetch leaves any stale entry untouched and surfaces as {@link MarketDataException}.
 * Stale data is never served in place of an error.
 */
@Service
public class StockDataService {

    private static final Logger log = LoggerFactory.getLogger(StockDataService.class);

    private static final Pattern SYMBOL_PATTERN = Pattern.compile("[A-Z0-9.\\-]{1,20}");

    private final StockCacheRepository stockCacheRepository;
    private final StockCachePolicy stockCachePolicy;
    private final StockDataProvider stockDataProvider;
    private final RoomRegistry roomRegistry;
    private final BroadcastEngine broadcastEngine;
    private final MarketPayloads marketPayloads;
    private final StreamMetricsService streamMetricsService;
    private final StreamHubProperties properties;
    private final Clock clock;

    public StockDataService(
            StockCacheRepository stockCacheRepository,
            StockCachePolicy stockCachePolicy,
            StockDataProvider stockDataProvider,
            RoomRegistry roomRegistry,
            BroadcastEngine broadcastEngine,
            MarketPayloads marketPayloads,
            StreamMetricsService streamMetricsService,
            StreamHubProperties properties,
            Clock clock) {
        this.stockCacheRepository = stockCacheRepository;
        this.stockCachePolicy = stockCachePolicy;
        this.stockDataProvider = stockDataProvider;
        this.roomRegistry = roomRegistry;
        this.broadcastEngine = broadcastEngine;
        this.marketPayloads = marketPayloads;
        this.streamMetricsService = streamMetricsService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Returns the cached snapshot when it is not due for refresh, otherwise fetches a fresh one,
     * caches it and pushes price and news updates to the symbol's room if anyone opened it.
     *
     * @throws MarketDataException if a fetch was needed and failed
     */
    public Stock getOrFetch(String symbol) {
        String key = normalizeSymbol(symbol);

        Optional<Stock> cached = readCached(key);
        if (cached.isPresent()) {
            streamMetricsService.recordCacheHit();
            log.debug("Cache hit for {}", key);
            return cached.get();
        }

        streamMetricsService.recordCacheMiss();
        Instant fetchStartedAt = clock.instant();
        Stock fresh = fetchFromProvider(key);

        Stock result;
        boolean stored;
        synchronized (this) {
            Optional<StockCacheEntry> current = stockCacheRepository.findBySymbol(key);
            if (current.isPresent() && current.get().getCachedAt().isAfter(fetchStartedAt)) {
                log.debug("{} was refreshed concurrently, keeping that entry", key);
                result = current.get().getStock();
                stored = false;
            } else {
                Instant now = clock.instant();
                stockCacheRepository.save(StockCacheEntry.builder()
                        .symbol(key)
                        .stock(fresh)
                        .cachedAt(now)
                        .expiryTime(now.plus(properties.getCache().getDuration()))
                        .accessCount(1)
                        .lastAccess(now)
                        .build());
                result = fresh;
                stored = true;
            }
        }

        if (stored) {
            log.info("Cached fresh data for {} from {} provider", key, stockDataProvider.getName());
            publishUpdates(key, fresh);
        }
        return result;
    }

    /**
     * Cached snapshot if present and not due for refresh. Never calls the provider.
     */
    public Optional<Stock> findCached(String symbol) {
        return readCached(normalizeSymbol(symbol));
    }

    /**
     * Deletes entries that expired more than one cache duration ago.
     *
     * @return number of entries removed
     */
    @Scheduled(
            fixedRateString = "${streamhub.sse.cleanup-interval-ms:60000}",
            initialDelayString = "${streamhub.sse.cleanup-interval-ms:60000}")
    public synchronized int sweepExpired() {
        Instant cutoff = clock.instant().minus(properties.getCache().getDuration());
        int removed = 0;
        for (String symbol : stockCacheRepository.findAllSymbols()) {
            Optional<StockCacheEntry> entry = stockCacheRepository.findBySymbol(symbol);
            if (entry.isPresent() && entry.get().getExpiryTime().isBefore(cutoff)) {
                stockCacheRepository.delete(symbol);
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} long-expired stock cache entries", removed);
        }
        return removed;
    }

    public String stockRoomId(String symbol) {
        return properties.getStock().getRoomPrefix() + "_" + normalizeSymbol(symbol);
    }

    public String normalizeSymbol(String symbol) {
        String key = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        if (!SYMBOL_PATTERN.matcher(key).matches()) {
            throw new BusinessException("Invalid stock symbol: " + symbol);
        }
        return key;
    }

    private synchronized Optional<Stock> readCached(String key) {
        Optional<StockCacheEntry> found = stockCacheRepository.findBySymbol(key);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        StockCacheEntry entry = found.get();
        Instant now = clock.instant();
        if (stockCachePolicy.shouldRefresh(entry, now)) {
            return Optional.empty();
        }
        entry.setAccessCount(entry.getAccessCount() + 1);
        entry.setLastAccess(now);
        stockCacheRepository.save(entry);
        return Optional.of(entry.getStock());
    }

    private Stock fetchFromProvider(String key) {
        try {
            return stockDataProvider.fetch(key);
        } catch (MarketDataException | ResourceNotFoundException e) {
            streamMetricsService.recordProviderFailure();
            log.warn("Provider fetch for {} failed: {}", key, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            streamMetricsService.recordProviderFailure();
            log.warn("Provider fetch for {} failed: {}", key, e.getMessage());
            throw new MarketDataException("Market data unavailable for " + key + ": " + e.getMessage(), e);
        }
    }

    private void publishUpdates(String key, Stock stock) {
        String roomId = stockRoomId(key);
        if (roomRegistry.findRoom(roomId).isEmpty()) {
            return;
        }
        try {
            broadcastEngine.broadcast(roomId, SseEventType.PRICE_UPDATE, marketPayloads.priceUpdate(stock));
            broadcastEngine.broadcast(roomId, SseEventType.NEWS_UPDATE, marketPayloads.newsUpdate(stock));
        } catch (RuntimeException e) {
            // The snapshot is cached already; subscribers catch up on the next refresh
            log.warn("Failed to push updates for {} to {}: {}", key, roomId, e.getMessage());
        }
    }
}
