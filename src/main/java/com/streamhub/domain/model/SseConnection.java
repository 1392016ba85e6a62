package com.streamhub.domain.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One subscriber's registration in a room. The room only references it by id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SseConnection {

    private String connectionId;

    private String roomId;

    private String peerId;

    /** Last event id the subscriber acknowledged when it attached. Null for a fresh subscriber. */
    private Long lastEventId;

    private Instant connectedAt;

    private Instant lastActivity;
}
