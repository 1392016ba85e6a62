package com.streamhub.market;

import com.streamhub.config.StreamHubProperties;
import com.streamhub.domain.model.StockCacheEntry;
import java.time.Clock;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Decides whether a cached stock snapshot must be fetched again.
 *
 * <p>An expired entry is always refreshed. Before expiry, an entry read more than
 * {@code maxAccessCountPerPeriod} times is served as is while its last read is within the
 * rate-limit interval, and refreshed once that window has elapsed, which resets its access count.
 */
@Component
public class StockCachePolicy {

    private final StreamHubProperties properties;
    private final Clock clock;

    public StockCachePolicy(StreamHubProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public boolean shouldRefresh(StockCacheEntry entry) {
        return shouldRefresh(entry, clock.instant());
    }

    public boolean shouldRefresh(StockCacheEntry entry, Instant now) {
        if (isExpired(entry, now)) {
            return true;
        }
        StreamHubProperties.Cache cache = properties.getCache();
        boolean hot = entry.getAccessCount() > cache.getMaxAccessCountPerPeriod();
        boolean withinRateLimit = entry.getLastAccess() != null
                && now.isBefore(entry.getLastAccess().plus(cache.getRateLimitInterval()));
        return hot && !withinRateLimit;
    }

    public boolean isExpired(StockCacheEntry entry, Instant now) {
        return now.isAfter(entry.getExpiryTime());
    }
}
