package com.streamhub.repository.memory;

import com.streamhub.domain.model.StockSubscription;
import com.streamhub.repository.StockSubscriptionRepository;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "streamhub.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryStockSubscriptionRepository implements StockSubscriptionRepository {

    private final Map<String, StockSubscription> subscriptions = new ConcurrentHashMap<>();

    @Override
    public void save(StockSubscription subscription) {
        subscriptions.put(subscription.getConnectionId(), subscription);
    }

    @Override
    public Optional<StockSubscription> findByConnectionId(String connectionId) {
        return Optional.ofNullable(subscriptions.get(connectionId));
    }

    @Override
    public List<StockSubscription> findAll() {
        return List.copyOf(subscriptions.values());
    }

    @Override
    public void delete(String connectionId) {
        subscriptions.remove(connectionId);
    }
}
