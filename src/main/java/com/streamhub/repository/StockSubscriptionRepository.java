package com.streamhub.repository;

import com.streamhub.domain.model.StockSubscription;
import java.util.List;
import java.util.Optional;

/** One subscription per connection; subscribing again replaces the previous symbol. */
public interface StockSubscriptionRepository {

    void save(StockSubscription subscription);

    Optional<StockSubscription> findByConnectionId(String connectionId);

    List<StockSubscription> findAll();

    void delete(String connectionId);
}
