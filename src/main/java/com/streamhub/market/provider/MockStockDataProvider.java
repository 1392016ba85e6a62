package com.streamhub.market.provider;

import com.streamhub.config.StreamHubProperties;
import com.streamhub.domain.model.Stock;
import com.streamhub.domain.model.StockMetrics;
import com.streamhub.domain.model.StockPrice;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Deterministic generator for development and tests.
 *
 * <p>Prices start from a fixed base per symbol and move at most 2% a day, the move derived
 * from the bar timestamp. Intraday range is 1.5% either side of the close.
 */
@Component
@ConditionalOnProperty(name = "streamhub.provider.type", havingValue = "mock", matchIfMissing = true)
public class MockStockDataProvider implements StockDataProvider {

    private static final Logger log = LoggerFactory.getLogger(MockStockDataProvider.class);

    private static final double DEFAULT_BASE_PRICE = 1000.0;
    private static final double MAX_DAILY_CHANGE = 0.04;
    private static final double INTRADAY_RANGE = 0.015;

    private static final Map<String, Double> BASE_PRICES = Map.of(
            "RELIANCE", 2500.0,
            "TCS", 3200.0,
            "INFY", 1450.0,
            "HDFC", 1680.0,
            "ICICI", 750.0,
            "SBI", 520.0,
            "BHARTI", 820.0,
            "ITC", 420.0,
            "WIPRO", 380.0,
            "TECHM", 1120.0);

    private static final Map<String, String> NAMES = Map.of(
            "RELIANCE", "Reliance Industries Ltd",
            "TCS", "Tata Consultancy Services",
            "INFY", "Infosys Limited",
            "HDFC", "HDFC Bank Limited",
            "ICICI", "ICICI Bank Limited",
            "SBI", "State Bank of India",
            "BHARTI", "Bharti Airtel Limited",
            "ITC", "ITC Limited",
            "WIPRO", "Wipro Limited",
            "TECHM", "Tech Mahindra Limited");

    private final StreamHubProperties properties;
    private final Clock clock;

    public MockStockDataProvider(StreamHubProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Stock fetch(String symbol) {
        Instant now = clock.instant();
        List<StockPrice> history = generateHistory(symbol, now);
        StockMetrics metrics = metricsFor(symbol);
        String name = NAMES.getOrDefault(symbol, symbol);

        log.debug("Generated mock data for {} ({} bars)", symbol, history.size());
        return Stock.builder()
                .symbol(symbol)
                .name(name)
                .currentPrice(history.get(history.size() - 1).getClose())
                .priceHistory(history)
                .metrics(metrics)
                .news(List.of(
                        String.format(
                                "%s reports strong quarterly results with %s%% growth",
                                name, metrics.getBusinessGrowth().toPlainString()),
                        String.format("Analysts upgrade %s target price citing robust fundamentals", name),
                        String.format("%s announces new strategic initiatives for digital transformation", name)))
                .lastUpdated(now)
                .build();
    }

    @Override
    public String getName() {
        return "mock";
    }

    private List<StockPrice> generateHistory(String symbol, Instant now) {
        int days = Math.max(1, properties.getProvider().getHistoryDays());
        double price = BASE_PRICES.getOrDefault(symbol, DEFAULT_BASE_PRICE);
        List<StockPrice> history = new ArrayList<>(days);
        BigDecimal previousClose = null;

        for (int daysAgo = days - 1; daysAgo >= 0; daysAgo--) {
            Instant timestamp = now.minus(Duration.ofDays(daysAgo));
            long millis = timestamp.toEpochMilli();

            double changePercent = ((millis % 1000) / 1000.0 - 0.5) * MAX_DAILY_CHANGE;
            price *= 1.0 + changePercent;
            double range = price * INTRADAY_RANGE;

            BigDecimal close = money(price);
            history.add(StockPrice.builder()
                    .timestamp(timestamp)
                    .open(previousClose != null ? previousClose : close)
                    .high(money(price + range))
                    .low(money(price - range))
                    .close(close)
                    .volume(50_000 + (millis % 100_000))
                    .build());
            previousClose = close;
        }
        return history;
    }

    private static StockMetrics metricsFor(String symbol) {
        return switch (symbol) {
            case "RELIANCE" -> metrics("15000000000000", "12.5", "200.0", "0.45", "8.5", "15.2", 6_000_000_000L, "0.25");
            case "TCS" -> metrics("12000000000000", "28.5", "112.0", "0.15", "12.3", "25.8", 3_750_000_000L, "0.22");
            case "INFY" -> metrics("6000000000000", "22.8", "63.5", "0.12", "15.2", "25.8", 4_150_000_000L, "0.28");
            default -> metrics("2000000000000", "18.5", "54.0", "0.65", "6.8", "20.5", 2_000_000_000L, "0.32");
        };
    }

    private static StockMetrics metrics(
            String marketCap,
            String peRatio,
            String eps,
            String debtEquity,
            String growth,
            String industryPe,
            long shares,
            String volatility) {
        return StockMetrics.builder()
                .marketCap(new BigDecimal(marketCap))
                .peRatio(new BigDecimal(peRatio))
                .eps(new BigDecimal(eps))
                .debtEquityRatio(new BigDecimal(debtEquity))
                .businessGrowth(new BigDecimal(growth))
                .industryAvgPe(new BigDecimal(industryPe))
                .outstandingShares(shares)
                .volatility(new BigDecimal(volatility))
                .build();
    }

    private static BigDecimal money(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }
}
