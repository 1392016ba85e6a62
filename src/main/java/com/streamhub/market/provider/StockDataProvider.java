package com.streamhub.market.provider;

import com.streamhub.domain.model.Stock;

/**
 * Out-of-process source of stock snapshots. Every call may be slow or fail.
 */
public interface StockDataProvider {

    /**
     * @param symbol upper-case ticker
     * @throws com.streamhub.exception.MarketDataException if the provider call fails
     * @throws com.streamhub.exception.ResourceNotFoundException if the provider has no data for the symbol
     */
    Stock fetch(String symbol);

    String getName();
}
