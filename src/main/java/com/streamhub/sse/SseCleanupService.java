package com.streamhub.sse;

import com.streamhub.config.StreamHubProperties;
import com.streamhub.domain.model.SseConnection;
import com.streamhub.domain.model.SseRoom;
import com.streamhub.event.ConnectionRemovalReason;
import com.streamhub.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic maintenance of rooms and connections.
 *
 * <p>Removes idle connections, drops events older than the maximum event age and deletes
 * empty idle rooms. Best effort: a failure on one record is counted and the sweep moves on.
 */
@Service
public class SseCleanupService {

    private static final Logger log = LoggerFactory.getLogger(SseCleanupService.class);

    private final RoomRegistry roomRegistry;
    private final StreamHubProperties properties;
    private final Clock clock;

    private final AtomicLong sweepErrors = new AtomicLong();

    public SseCleanupService(RoomRegistry roomRegistry, StreamHubProperties properties, Clock clock) {
        this.roomRegistry = roomRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(
            fixedRateString = "${streamhub.sse.cleanup-interval-ms:60000}",
            initialDelayString = "${streamhub.sse.cleanup-interval-ms:60000}")
    public void scheduledSweep() {
        sweep();
    }

    /**
     * Runs one sweep.
     *
     * @return number of connections removed
     */
    public int sweep() {
        Instant now = clock.instant();
        Instant idleCutoff = now.minus(properties.getSse().getConnectionTimeout());
        Instant eventCutoff = now.minus(properties.getSse().getMaxEventAge());

        int removedConnections = 0;
        for (SseConnection connection : roomRegistry.findAllConnections()) {
            if (!connection.getLastActivity().isBefore(idleCutoff)) {
                continue;
            }
            try {
                roomRegistry.removeConnection(connection.getConnectionId(), ConnectionRemovalReason.TIMED_OUT);
                removedConnections++;
            } catch (ResourceNotFoundException e) {
                // removed concurrently
                sweepErrors.incrementAndGet();
            } catch (RuntimeException e) {
                sweepErrors.incrementAndGet();
                log.warn("Failed to remove idle connection {}: {}", connection.getConnectionId(), e.getMessage());
            }
        }

        int droppedEvents = 0;
        int deletedRooms = 0;
        for (String roomId : roomRegistry.findAllRooms().stream().map(SseRoom::getRoomId).toList()) {
            try {
                droppedEvents += roomRegistry.pruneEventsBefore(roomId, eventCutoff);
                if (roomRegistry.deleteRoomIfIdle(roomId, idleCutoff)) {
                    deletedRooms++;
                }
            } catch (RuntimeException e) {
                sweepErrors.incrementAndGet();
                log.warn("Failed to sweep room {}: {}", roomId, e.getMessage());
            }
        }

        if (removedConnections > 0 || deletedRooms > 0) {
            log.info(
                    "Cleanup removed {} idle connections, {} expired events, {} empty rooms",
                    removedConnections,
                    droppedEvents,
                    deletedRooms);
        } else {
            log.debug("Cleanup found nothing idle ({} expired events dropped)", droppedEvents);
        }
        return removedConnections;
    }

    /** Per-record failures seen by sweeps since startup. */
    public long getSweepErrors() {
        return sweepErrors.get();
    }
}
