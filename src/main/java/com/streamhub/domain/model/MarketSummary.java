package com.streamhub.domain.model;

import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate view over all tracked symbols. Replaced wholesale on every successful refresh.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketSummary {

    private Map<String, Stock> stocks;
    private Instant cachedAt;
}
