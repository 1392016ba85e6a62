package com.streamhub.sse;

import com.streamhub.domain.model.SseEvent;
import com.streamhub.domain.model.SseRoom;
import com.streamhub.exception.ResourceNotFoundException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Serves buffered events to reconnecting subscribers.
 *
 * <p>Replay is bounded by what the room still retains. A subscriber whose last seen event
 * was already evicted gets everything still buffered: a gap, not an error.
 */
@Service
public class ReplayService {

    private static final Logger log = LoggerFactory.getLogger(ReplayService.class);

    private final RoomRegistry roomRegistry;

    public ReplayService(RoomRegistry roomRegistry) {
        this.roomRegistry = roomRegistry;
    }

    /**
     * Events of the room with an id greater than {@code lastEventId}, oldest first. A null
     * cursor returns the whole buffer.
     *
     * @throws ResourceNotFoundException if the room does not exist
     */
    public List<SseEvent> eventsSince(String roomId, Long lastEventId) {
        SseRoom room = roomRegistry
                .findRoom(roomId)
                .orElseThrow(() -> new ResourceNotFoundException("Room", roomId));

        List<SseEvent> events = lastEventId == null
                ? List.copyOf(room.getEventBuffer())
                : room.getEventBuffer().stream()
                        .filter(event -> event.getId() > lastEventId)
                        .toList();
        log.debug("Replaying {} events from room {} after {}", events.size(), roomId, lastEventId);
        return events;
    }

    /**
     * Parses a Last-Event-ID value. Anything that is not a non-negative integer means
     * "no cursor" and replays the full buffer.
     */
    public static Long parseLastEventId(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            long value = Long.parseLong(raw.trim());
            return value >= 0 ? value : null;
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed Last-Event-ID '{}'", raw);
            return null;
        }
    }
}
