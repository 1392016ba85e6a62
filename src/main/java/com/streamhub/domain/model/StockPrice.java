package com.streamhub.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Daily OHLCV bar for a stock. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockPrice {

    private Instant timestamp;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private long volume;
}
