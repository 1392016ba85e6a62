package com.streamhub.repository.redis;

import com.streamhub.config.RedisConfig;
import com.streamhub.domain.model.SseConnection;
import com.streamhub.repository.ConnectionRepository;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "streamhub.store.type", havingValue = "redis")
public class ConnectionRedisRepository implements ConnectionRepository {

    private final RedisTemplate<String, Object> redisTemplate;

    @Override
    public void save(SseConnection connection) {
        String key = RedisConfig.KEY_PREFIX_CONNECTION + connection.getConnectionId();
        redisTemplate.opsForValue().set(key, connection);
        redisTemplate.opsForSet().add(RedisConfig.KEY_SET_CONNECTIONS, connection.getConnectionId());
    }

    @Override
    public Optional<SseConnection> findById(String connectionId) {
        Object value = redisTemplate.opsForValue().get(RedisConfig.KEY_PREFIX_CONNECTION + connectionId);
        return Optional.ofNullable((SseConnection) value);
    }

    @Override
    public List<SseConnection> findAll() {
        Set<String> ids = findAllIds();
        if (ids.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> keys =
                ids.stream().map(id -> RedisConfig.KEY_PREFIX_CONNECTION + id).toList();
        List<Object> values = redisTemplate.opsForValue().multiGet(keys);
        if (values == null) {
            return Collections.emptyList();
        }

        return values.stream().filter(Objects::nonNull).map(v -> (SseConnection) v).toList();
    }

    @Override
    public Set<String> findAllIds() {
        Set<Object> ids = redisTemplate.opsForSet().members(RedisConfig.KEY_SET_CONNECTIONS);
        if (ids == null) {
            return Collections.emptySet();
        }
        return ids.stream().map(String::valueOf).collect(Collectors.toSet());
    }

    @Override
    public void delete(String connectionId) {
        redisTemplate.delete(RedisConfig.KEY_PREFIX_CONNECTION + connectionId);
        redisTemplate.opsForSet().remove(RedisConfig.KEY_SET_CONNECTIONS, connectionId);
    }
}
