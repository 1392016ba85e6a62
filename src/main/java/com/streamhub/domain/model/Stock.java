package com.streamhub.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of one stock as returned by a market data provider: latest price, recent daily
 * history (oldest first), fundamentals and headlines.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Stock {

    private String symbol;
    private String name;
    private BigDecimal currentPrice;
    private List<StockPrice> priceHistory;
    private StockMetrics metrics;
    private List<String> news;
    private Instant lastUpdated;
}
