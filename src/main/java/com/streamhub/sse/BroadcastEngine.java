package com.streamhub.sse;

import com.streamhub.domain.enums.SseEventType;
import com.streamhub.domain.model.SseEvent;
import com.streamhub.domain.model.SseRoom;
import com.streamhub.event.EventPublisherHelper;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Creates events, appends them to the room buffer and hands the fan-out targets to the
 * stream layer via {@link com.streamhub.event.SseBroadcastEvent}.
 *
 * <p>The engine never writes bytes to a client. Broadcasting to an unknown room creates it,
 * so the first event of a room is retained for subscribers that arrive later.
 */
@Service
public class BroadcastEngine {

    private static final Logger log = LoggerFactory.getLogger(BroadcastEngine.class);

    private final EventLog eventLog;
    private final RoomRegistry roomRegistry;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public BroadcastEngine(
            EventLog eventLog, RoomRegistry roomRegistry, EventPublisherHelper eventPublisherHelper, Clock clock) {
        this.eventLog = eventLog;
        this.roomRegistry = roomRegistry;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /**
     * Broadcasts a payload to a room.
     *
     * @param data already-serialized payload, stored and sent as is
     * @return connection ids of the room at the time the event was appended
     */
    public List<String> broadcast(String roomId, SseEventType type, String data) {
        // Id allocation, append and publish share the registry monitor so that ids reach
        // both the buffer and the stream layer in increasing order.
        synchronized (roomRegistry) {
            SseEvent event = SseEvent.builder()
                    .id(eventLog.nextId())
                    .type(type)
                    .data(data)
                    .timestamp(clock.instant())
                    .build();
            List<String> targets = roomRegistry.appendEvent(roomId, event);
            eventPublisherHelper.publishBroadcast(this, roomId, event, targets);
            log.debug("Event {} ({}) appended to room {}, {} targets", event.getId(), type.wireName(), roomId, targets.size());
            return targets;
        }
    }

    /**
     * Continues numbering above anything already buffered, for rooms that outlived a restart
     * in a shared store.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void resumeEventIds() {
        long maxBuffered = roomRegistry.findAllRooms().stream()
                .map(SseRoom::getEventBuffer)
                .flatMap(List::stream)
                .mapToLong(SseEvent::getId)
                .max()
                .orElse(0L);
        if (maxBuffered > 0) {
            eventLog.advanceTo(maxBuffered);
            log.info("Event ids resume after {}", maxBuffered);
        }
    }
}
