package com.streamhub.domain.model;

import com.streamhub.domain.enums.SseEventType;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One event broadcast to a room.
 *
 * <p>The payload is an already-serialized JSON document. Nothing downstream of the broadcast
 * engine interprets it. Events are never modified after creation; they leave a room only through
 * buffer eviction or the age-based sweep.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SseEvent {

    /** Process-wide monotonic id, starting at 1. */
    private long id;

    private SseEventType type;

    private String data;

    private Instant timestamp;
}
