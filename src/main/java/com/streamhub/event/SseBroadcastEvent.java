package com.streamhub.event;

import com.streamhub.domain.model.SseEvent;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * Published after an event has been appended to a room's buffer.
 *
 * <p>Carries the fan-out target list computed at append time. The stream layer pushes the
 * formatted event to whichever of those connections still has an open emitter.
 */
public class SseBroadcastEvent extends ApplicationEvent {

    private final String roomId;
    private final SseEvent event;
    private final List<String> connectionIds;

    public SseBroadcastEvent(Object source, String roomId, SseEvent event, List<String> connectionIds) {
        super(source);
        this.roomId = roomId;
        this.event = event;
        this.connectionIds = List.copyOf(connectionIds);
    }

    public String getRoomId() {
        return roomId;
    }

    public SseEvent getEvent() {
        return event;
    }

    public List<String> getConnectionIds() {
        return connectionIds;
    }
}
