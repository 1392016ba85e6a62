package com.streamhub.repository.redis;

import com.streamhub.config.RedisConfig;
import com.streamhub.domain.model.StockSubscription;
import com.streamhub.repository.StockSubscriptionRepository;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "streamhub.store.type", havingValue = "redis")
public class StockSubscriptionRedisRepository implements StockSubscriptionRepository {

    private final RedisTemplate<String, Object> redisTemplate;

    @Override
    public void save(StockSubscription subscription) {
        String key = RedisConfig.KEY_PREFIX_STOCK_SUBSCRIPTION + subscription.getConnectionId();
        redisTemplate.opsForValue().set(key, subscription);
        redisTemplate.opsForSet().add(RedisConfig.KEY_SET_STOCK_SUBSCRIPTIONS, subscription.getConnectionId());
    }

    @Override
    public Optional<StockSubscription> findByConnectionId(String connectionId) {
        Object value = redisTemplate.opsForValue().get(RedisConfig.KEY_PREFIX_STOCK_SUBSCRIPTION + connectionId);
        return Optional.ofNullable((StockSubscription) value);
    }

    @Override
    public List<StockSubscription> findAll() {
        Set<Object> ids = redisTemplate.opsForSet().members(RedisConfig.KEY_SET_STOCK_SUBSCRIPTIONS);
        if (ids == null || ids.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> keys =
                ids.stream().map(id -> RedisConfig.KEY_PREFIX_STOCK_SUBSCRIPTION + id).toList();
        List<Object> values = redisTemplate.opsForValue().multiGet(keys);
        if (values == null) {
            return Collections.emptyList();
        }

        return values.stream().filter(Objects::nonNull).map(v -> (StockSubscription) v).toList();
    }

    @Override
    public void delete(String connectionId) {
        redisTemplate.delete(RedisConfig.KEY_PREFIX_STOCK_SUBSCRIPTION + connectionId);
        redisTemplate.opsForSet().remove(RedisConfig.KEY_SET_STOCK_SUBSCRIPTIONS, connectionId);
    }
}
