package com.streamhub.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published when a connection leaves its room, either on request or through the idle sweep.
 *
 * <p>Listeners close the matching emitter and drop any stock subscription held by the connection.
 */
public class ConnectionRemovedEvent extends ApplicationEvent {

    private final String connectionId;
    private final String roomId;
    private final ConnectionRemovalReason reason;

    public ConnectionRemovedEvent(
            Object source, String connectionId, String roomId, ConnectionRemovalReason reason) {
        super(source);
        this.connectionId = connectionId;
        this.roomId = roomId;
        this.reason = reason;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public String getRoomId() {
        return roomId;
    }

    public ConnectionRemovalReason getReason() {
        return reason;
    }
}
