package com.streamhub.event;

import com.streamhub.domain.model.SseEvent;
import java.util.List;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for the stream events.
 *
 * <p>All methods are non-blocking. Delivery depends on the listener: the stream registry
 * queues broadcasts and writes them on the fan-out executor, subscription cleanup runs inline.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishBroadcast(Object source, String roomId, SseEvent event, List<String> connectionIds) {
        applicationEventPublisher.publishEvent(new SseBroadcastEvent(source, roomId, event, connectionIds));
    }

    public void publishConnectionRemoved(
            Object source, String connectionId, String roomId, ConnectionRemovalReason reason) {
        applicationEventPublisher.publishEvent(new ConnectionRemovedEvent(source, connectionId, roomId, reason));
    }

    public void publishSummaryActivity(Object source, boolean readerActivity) {
        applicationEventPublisher.publishEvent(new MarketSummaryActivityEvent(source, readerActivity));
    }
}
