package com.streamhub.repository.redis;

import com.streamhub.config.RedisConfig;
import com.streamhub.domain.model.StockCacheEntry;
import com.streamhub.repository.StockCacheRepository;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Redis-backed stock cache. Entries carry their own expiry and are kept past it on purpose:
 * a rate-limited entry is still served after expiry, and the stock cache sweep removes the rest.
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "streamhub.store.type", havingValue = "redis")
public class StockCacheRedisRepository implements StockCacheRepository {

    private final RedisTemplate<String, Object> redisTemplate;

    @Override
    public void save(StockCacheEntry entry) {
        String key = RedisConfig.KEY_PREFIX_STOCK_CACHE + entry.getSymbol();
        redisTemplate.opsForValue().set(key, entry);
        redisTemplate.opsForSet().add(RedisConfig.KEY_SET_STOCK_CACHED, entry.getSymbol());
    }

    @Override
    public Optional<StockCacheEntry> findBySymbol(String symbol) {
        Object value = redisTemplate.opsForValue().get(RedisConfig.KEY_PREFIX_STOCK_CACHE + symbol);
        return Optional.ofNullable((StockCacheEntry) value);
    }

    @Override
    public Set<String> findAllSymbols() {
        Set<Object> symbols = redisTemplate.opsForSet().members(RedisConfig.KEY_SET_STOCK_CACHED);
        if (symbols == null) {
            return Collections.emptySet();
        }
        return symbols.stream().map(String::valueOf).collect(Collectors.toSet());
    }

    @Override
    public void delete(String symbol) {
        redisTemplate.delete(RedisConfig.KEY_PREFIX_STOCK_CACHE + symbol);
        redisTemplate.opsForSet().remove(RedisConfig.KEY_SET_STOCK_CACHED, symbol);
    }
}
