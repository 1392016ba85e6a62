package com.streamhub.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time copy of the price feed, kept in the price history ring.
 */
public record PriceSnapshot(Instant timestamp, Map<String, BigDecimal> prices) {

    public PriceSnapshot {
        prices = prices == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(prices));
    }
}
