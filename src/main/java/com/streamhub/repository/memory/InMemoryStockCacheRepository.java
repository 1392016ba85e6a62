package com.streamhub.repository.memory;

import com.streamhub.domain.model.StockCacheEntry;
import com.streamhub.repository.StockCacheRepository;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "streamhub.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryStockCacheRepository implements StockCacheRepository {

    private final Map<String, StockCacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public void save(StockCacheEntry entry) {
        entries.put(entry.getSymbol(), entry.toBuilder().build());
    }

    @Override
    public Optional<StockCacheEntry> findBySymbol(String symbol) {
        return Optional.ofNullable(entries.get(symbol)).map(entry -> entry.toBuilder().build());
    }

    @Override
    public Set<String> findAllSymbols() {
        return Set.copyOf(entries.keySet());
    }

    @Override
    public void delete(String symbol) {
        entries.remove(symbol);
    }
}
