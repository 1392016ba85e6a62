package com.streamhub.market;

import com.streamhub.config.StreamHubProperties;
import com.streamhub.domain.model.SseEvent;
import com.streamhub.domain.model.StockSubscription;
import com.streamhub.event.ConnectionRemovedEvent;
import com.streamhub.exception.ResourceNotFoundException;
import com.streamhub.repository.StockSubscriptionRepository;
import com.streamhub.sse.ReplayService;
import com.streamhub.sse.RoomRegistry;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Subscribes connections to the dedicated room of a stock symbol.
 *
 * <p>A subscription lives alongside its connection: removing the connection, by request or
 * by the idle sweep, drops the subscription too.
 */
@Service
public class StockSubscriptionService {

    private static final Logger log = LoggerFactory.getLogger(StockSubscriptionService.class);

    private final StockSubscriptionRepository stockSubscriptionRepository;
    private final StockDataService stockDataService;
    private final RoomRegistry roomRegistry;
    private final ReplayService replayService;
    private final StreamHubProperties properties;
    private final Clock clock;

    public StockSubscriptionService(
            StockSubscriptionRepository stockSubscriptionRepository,
            StockDataService stockDataService,
            RoomRegistry roomRegistry,
            ReplayService replayService,
            StreamHubProperties properties,
            Clock clock) {
        this.stockSubscriptionRepository = stockSubscriptionRepository;
        this.stockDataService = stockDataService;
        this.roomRegistry = roomRegistry;
        this.replayService = replayService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Attaches the connection to {@code stock_<SYMBOL>} and records the subscription.
     *
     * @return buffered events of the stock room after {@code lastEventId}
     */
    public List<SseEvent> subscribe(String connectionId, String symbol, String peerId, Long lastEventId) {
        String key = stockDataService.normalizeSymbol(symbol);
        String roomId = stockDataService.stockRoomId(key);

        roomRegistry.ensureRoom(roomId, properties.getStock().getRoomBufferSize());
        roomRegistry.addConnection(roomId, connectionId, peerId, lastEventId);
        stockSubscriptionRepository.save(StockSubscription.builder()
                .connectionId(connectionId)
                .symbol(key)
                .subscribedAt(clock.instant())
                .lastEventId(lastEventId)
                .build());

        log.debug("Connection {} subscribed to {}", connectionId, key);
        return replayService.eventsSince(roomId, lastEventId);
    }

    /**
     * @return false if the connection had no subscription
     */
    public boolean unsubscribe(String connectionId) {
        Optional<StockSubscription> subscription = stockSubscriptionRepository.findByConnectionId(connectionId);
        if (subscription.isEmpty()) {
            return false;
        }
        stockSubscriptionRepository.delete(connectionId);
        try {
            roomRegistry.removeConnection(connectionId);
        } catch (ResourceNotFoundException e) {
            log.debug("Connection {} was already removed", connectionId);
        }
        log.debug("Connection {} unsubscribed from {}", connectionId, subscription.get().getSymbol());
        return true;
    }

    public Optional<StockSubscription> findSubscription(String connectionId) {
        return stockSubscriptionRepository.findByConnectionId(connectionId);
    }

    public List<String> getSubscribers(String symbol) {
        String key = stockDataService.normalizeSymbol(symbol);
        return stockSubscriptionRepository.findAll().stream()
                .filter(subscription -> key.equals(subscription.getSymbol()))
                .map(StockSubscription::getConnectionId)
                .toList();
    }

    @EventListener
    public void onConnectionRemoved(ConnectionRemovedEvent event) {
        stockSubscriptionRepository.findByConnectionId(event.getConnectionId()).ifPresent(subscription -> {
            stockSubscriptionRepository.delete(event.getConnectionId());
            log.debug("Dropped {} subscription of removed connection {}", subscription.getSymbol(), event.getConnectionId());
        });
    }
}
