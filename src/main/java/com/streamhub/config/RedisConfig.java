package com.streamhub.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJacksonJsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration with Jackson 3 JSON serialization.
 *
 * <p>Only used when {@code streamhub.store.type=redis}; the in-memory repositories are the
 * default. All keys are prefixed with "streamhub:" because the Redis server may be shared.
 *
 * <p>Key schema:
 * <pre>
 *   streamhub:sse:room:{roomId}                   → SseRoom JSON (connections + event buffer)
 *   streamhub:sse:rooms                           → Set of room ids
 *   streamhub:sse:connection:{connectionId}       → SseConnection JSON
 *   streamhub:sse:connections                     → Set of connection ids
 *   streamhub:stock:cache:{symbol}                → StockCacheEntry JSON
 *   streamhub:stock:cached                        → Set of cached symbols
 *   streamhub:stock:subscription:{connectionId}   → StockSubscription JSON
 *   streamhub:stock:subscriptions                 → Set of subscribed connection ids
 * </pre>
 */
@Configuration
public class RedisConfig {

    public static final String KEY_PREFIX = "streamhub:";

    public static final String KEY_PREFIX_ROOM = KEY_PREFIX + "sse:room:";
    public static final String KEY_PREFIX_CONNECTION = KEY_PREFIX + "sse:connection:";
    public static final String KEY_PREFIX_STOCK_CACHE = KEY_PREFIX + "stock:cache:";
    public static final String KEY_PREFIX_STOCK_SUBSCRIPTION = KEY_PREFIX + "stock:subscription:";

    public static final String KEY_SET_ROOMS = KEY_PREFIX + "sse:rooms";
    public static final String KEY_SET_CONNECTIONS = KEY_PREFIX + "sse:connections";
    public static final String KEY_SET_STOCK_CACHED = KEY_PREFIX + "stock:cached";
    public static final String KEY_SET_STOCK_SUBSCRIPTIONS = KEY_PREFIX + "stock:subscriptions";

    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory redisConnectionFactory) {
        RedisTemplate<String, Object> redisTemplate = new RedisTemplate<>();
        redisTemplate.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer stringRedisSerializer = new StringRedisSerializer();
        GenericJacksonJsonRedisSerializer jsonRedisSerializer =
                GenericJacksonJsonRedisSerializer.builder().build();

        redisTemplate.setKeySerializer(stringRedisSerializer);
        redisTemplate.setValueSerializer(jsonRedisSerializer);
        redisTemplate.setHashKeySerializer(stringRedisSerializer);
        redisTemplate.setHashValueSerializer(jsonRedisSerializer);

        return redisTemplate;
    }
}
