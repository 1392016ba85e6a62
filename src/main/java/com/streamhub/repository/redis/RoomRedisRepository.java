package com.streamhub.repository.redis;

import com.streamhub.config.RedisConfig;
import com.streamhub.domain.model.SseRoom;
import com.streamhub.repository.RoomRepository;
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

/**
 * Redis-backed room store. A room is one JSON document holding its connection ids and the
 * whole event buffer; the id set lets the cleanup sweep enumerate rooms without SCAN.
 *
 * <p>No TTL: empty idle rooms are deleted by the sweep.
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "streamhub.store.type", havingValue = "redis")
public class RoomRedisRepository implements RoomRepository {

    private final RedisTemplate<String, Object> redisTemplate;

    @Override
    public void save(SseRoom room) {
        String key = RedisConfig.KEY_PREFIX_ROOM + room.getRoomId();
        redisTemplate.opsForValue().set(key, room);
        redisTemplate.opsForSet().add(RedisConfig.KEY_SET_ROOMS, room.getRoomId());
    }

    @Override
    public Optional<SseRoom> findById(String roomId) {
        Object value = redisTemplate.opsForValue().get(RedisConfig.KEY_PREFIX_ROOM + roomId);
        return Optional.ofNullable((SseRoom) value);
    }

    @Override
    public List<SseRoom> findAll() {
        Set<String> ids = findAllIds();
        if (ids.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> keys = ids.stream().map(id -> RedisConfig.KEY_PREFIX_ROOM + id).toList();
        List<Object> values = redisTemplate.opsForValue().multiGet(keys);
        if (values == null) {
            return Collections.emptyList();
        }

        return values.stream().filter(Objects::nonNull).map(v -> (SseRoom) v).toList();
    }

    @Override
    public Set<String> findAllIds() {
        Set<Object> ids = redisTemplate.opsForSet().members(RedisConfig.KEY_SET_ROOMS);
        if (ids == null) {
            return Collections.emptySet();
        }
        return ids.stream().map(String::valueOf).collect(Collectors.toSet());
    }

    @Override
    public void delete(String roomId) {
        redisTemplate.delete(RedisConfig.KEY_PREFIX_ROOM + roomId);
        redisTemplate.opsForSet().remove(RedisConfig.KEY_SET_ROOMS, roomId);
    }
}
