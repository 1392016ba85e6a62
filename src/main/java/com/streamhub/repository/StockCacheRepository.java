package com.streamhub.repository;

import com.streamhub.domain.model.StockCacheEntry;
import java.util.Optional;
import java.util.Set;

/** Storage for cached stock snapshots, keyed by upper-case symbol. */
public interface StockCacheRepository {

    void save(StockCacheEntry entry);

    Optional<StockCacheEntry> findBySymbol(String symbol);

    Set<String> findAllSymbols();

    void delete(String symbol);
}
