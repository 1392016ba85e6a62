package com.streamhub.domain.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cached stock snapshot with its freshness bookkeeping.
 *
 * <p>An entry is replaced as a whole on every successful fetch. On a cache hit only
 * {@code accessCount} and {@code lastAccess} move.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StockCacheEntry {

    private String symbol;
    private Stock stock;
    private Instant cachedAt;
    private Instant expiryTime;
    private int accessCount;
    private Instant lastAccess;
}
