package com.streamhub.pricefeed;

import com.streamhub.config.StreamHubProperties;
import com.streamhub.domain.model.PriceQuote;
import com.streamhub.domain.model.PriceSnapshot;
import com.streamhub.exception.BusinessException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Latest price per symbol, fed by the price oracle and by market summary refreshes, with a
 * rolling history of periodic snapshots.
 */
@Service
public class PriceFeedService {

    private static final Logger log = LoggerFactory.getLogger(PriceFeedService.class);

    private final StreamHubProperties properties;
    private final Clock clock;
    private final PriceHistoryRing priceHistoryRing;

    private final Map<String, PriceQuote> latestPrices = new ConcurrentHashMap<>();

    public PriceFeedService(StreamHubProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.priceHistoryRing = new PriceHistoryRing(properties.getPriceHistory().getCapacity());
    }

    /**
     * Stores a price submitted by a peer. Only the configured oracle peer may submit.
     */
    public PriceQuote submitPrice(String callerPeerId, String symbol, BigDecimal price) {
        String oracle = properties.getPriceFeed().getOraclePeerId();
        if (!oracle.equals(callerPeerId)) {
            log.warn("Rejected price submission from {} for {}", callerPeerId, symbol);
            throw BusinessException.forbidden("Only the price oracle may submit prices");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new BusinessException("Symbol cannot be empty");
        }
        if (price == null || price.signum() < 0) {
            throw new BusinessException("Price cannot be negative");
        }

        PriceQuote quote = PriceQuote.builder()
                .symbol(symbol.trim().toUpperCase(Locale.ROOT))
                .price(price)
                .updatedAt(clock.instant())
                .source(callerPeerId)
                .build();
        latestPrices.put(quote.getSymbol(), quote);
        log.debug("Price {} = {} from {}", quote.getSymbol(), price, callerPeerId);
        return quote;
    }

    /** Bulk update from an internal source. Null prices are skipped. */
    public void recordPrices(Map<String, BigDecimal> prices, String source) {
        Instant now = clock.instant();
        prices.forEach((symbol, price) -> {
            if (price != null) {
                latestPrices.put(symbol, PriceQuote.builder()
                        .symbol(symbol)
                        .price(price)
                        .updatedAt(now)
                        .source(source)
                        .build());
            }
        });
    }

    public Optional<PriceQuote> getPrice(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(latestPrices.get(symbol.trim().toUpperCase(Locale.ROOT)));
    }

    public List<PriceQuote> getAllPrices() {
        return latestPrices.values().stream()
                .sorted(Comparator.comparing(PriceQuote::getSymbol))
                .toList();
    }

    @Scheduled(
            fixedRateString = "${streamhub.price-history.snapshot-interval-ms:600000}",
            initialDelayString = "${streamhub.price-history.snapshot-interval-ms:600000}")
    public void scheduledSnapshot() {
        captureSnapshot();
    }

    /**
     * Copies the current feed into the history ring. Skipped while the feed is empty.
     */
    public Optional<PriceSnapshot> captureSnapshot() {
        if (latestPrices.isEmpty()) {
            log.debug("Price feed empty, no snapshot taken");
            return Optional.empty();
        }
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        getAllPrices().forEach(quote -> prices.put(quote.getSymbol(), quote.getPrice()));
        PriceSnapshot snapshot = new PriceSnapshot(clock.instant(), prices);
        priceHistoryRing.record(snapshot);
        log.debug("Captured price snapshot of {} symbols ({} retained)", prices.size(), priceHistoryRing.size());
        return Optional.of(snapshot);
    }

    public List<PriceSnapshot> getPriceHistory() {
        return priceHistoryRing.history();
    }
}
