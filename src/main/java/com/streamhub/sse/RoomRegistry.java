package com.streamhub.sse;

import com.streamhub.config.StreamHubProperties;
import com.streamhub.domain.model.SseConnection;
import com.streamhub.domain.model.SseEvent;
import com.streamhub.domain.model.SseRoom;
import com.streamhub.event.ConnectionRemovalReason;
import com.streamhub.event.EventPublisherHelper;
import com.streamhub.exception.AdmissionRejectedException;
import com.streamhub.exception.ResourceNotFoundException;
import com.streamhub.repository.ConnectionRepository;
import com.streamhub.repository.RoomRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns rooms and connections: creation, admission, removal and the event buffer of each room.
 *
 * <p>Every mutation of room or connection records runs on this instance's monitor. The
 * repositories return detached copies, so a read-modify-save outside the monitor would lose
 * concurrent updates. {@link BroadcastEngine} holds the same monitor while it allocates an id
 * and appends, which keeps buffer order equal to id order.
 */
@Service
public class RoomRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final RoomRepository roomRepository;
    private final ConnectionRepository connectionRepository;
    private final StreamHubProperties properties;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public RoomRegistry(
            RoomRepository roomRepository,
            ConnectionRepository connectionRepository,
            StreamHubProperties properties,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.roomRepository = roomRepository;
        this.connectionRepository = connectionRepository;
        this.properties = properties;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ==== Rooms ====

    public synchronized SseRoom ensureRoom(String roomId) {
        return ensureRoom(roomId, properties.getSse().getMaxBufferSizePerRoom());
    }

    /**
     * Returns the room, creating and persisting an empty one if absent. The buffer size only
     * applies to a newly created room.
     */
    public synchronized SseRoom ensureRoom(String roomId, int maxBufferSize) {
        Optional<SseRoom> existing = roomRepository.findById(roomId);
        if (existing.isPresent()) {
            return existing.get();
        }

        Instant now = clock.instant();
        SseRoom room = SseRoom.builder()
                .roomId(roomId)
                .maxBufferSize(maxBufferSize)
                .createdAt(now)
                .lastActivity(now)
                .build();
        roomRepository.save(room);
        log.info("Created room {} (buffer {})", roomId, maxBufferSize);
        return room;
    }

    public Optional<SseRoom> findRoom(String roomId) {
        return roomRepository.findById(roomId);
    }

    public List<SseRoom> findAllRooms() {
        return roomRepository.findAll();
    }

    /**
     * Appends an event to the room's buffer, evicting from the front while the buffer is over
     * its bound. Creates the room if needed. Each target connection counts the delivery as
     * activity, so a subscriber that only listens is not swept while its room is live.
     *
     * @return the room's connection ids at append time
     */
    synchronized List<String> appendEvent(String roomId, SseEvent event) {
        SseRoom room = ensureRoom(roomId);
        List<SseEvent> buffer = room.getEventBuffer();
        buffer.add(event);
        while (buffer.size() > room.getMaxBufferSize()) {
            buffer.remove(0);
        }
        Instant now = clock.instant();
        room.setLastActivity(now);
        roomRepository.save(room);
        for (String connectionId : room.getConnectionIds()) {
            connectionRepository.findById(connectionId).ifPresent(connection -> {
                connection.setLastActivity(now);
                connectionRepository.save(connection);
            });
        }
        return List.copyOf(room.getConnectionIds());
    }

    /**
     * Drops buffered events with a timestamp before {@code cutoff}.
     *
     * @return number of events dropped, 0 if the room no longer exists
     */
    public synchronized int pruneEventsBefore(String roomId, Instant cutoff) {
        Optional<SseRoom> found = roomRepository.findById(roomId);
        if (found.isEmpty()) {
            return 0;
        }
        SseRoom room = found.get();
        int before = room.getEventBuffer().size();
        room.getEventBuffer().removeIf(event -> event.getTimestamp().isBefore(cutoff));
        int dropped = before - room.getEventBuffer().size();
        if (dropped > 0) {
            roomRepository.save(room);
        }
        return dropped;
    }

    /**
     * Deletes the room if it has no connections and no activity since {@code idleCutoff}.
     */
    public synchronized boolean deleteRoomIfIdle(String roomId, Instant idleCutoff) {
        Optional<SseRoom> found = roomRepository.findById(roomId);
        if (found.isEmpty()) {
            return false;
        }
        SseRoom room = found.get();
        if (!room.getConnectionIds().isEmpty() || !room.getLastActivity().isBefore(idleCutoff)) {
            return false;
        }
        roomRepository.delete(roomId);
        log.info("Deleted idle room {}", roomId);
        return true;
    }

    // ==== Connections ====

    /**
     * Admits a connection into a room.
     *
     * <p>The room is created if absent. A connection id already attached to this room is
     * re-attached in place and does not count against the limit again. A connection id
     * attached to another room is moved. Nothing is persisted when admission is rejected.
     *
     * @throws AdmissionRejectedException if the room already holds the maximum number of connections
     */
    public synchronized SseConnection addConnection(String roomId, String connectionId, String peerId, Long lastEventId) {
        SseRoom room = ensureRoom(roomId);
        Instant now = clock.instant();
        Optional<SseConnection> existing = connectionRepository.findById(connectionId);
        boolean reattach = existing.isPresent()
                && roomId.equals(existing.get().getRoomId())
                && room.getConnectionIds().contains(connectionId);

        int maxConnections = properties.getSse().getMaxConnectionsPerRoom();
        if (!reattach && room.getConnectionIds().size() >= maxConnections) {
            log.warn("Rejected connection {} for room {}: room full ({})", connectionId, roomId, maxConnections);
            throw new AdmissionRejectedException(
                    roomId, maxConnections, Duration.ofMillis(properties.getSse().getRetryHintMs()));
        }

        if (existing.isPresent() && !reattach) {
            detachFromRoom(existing.get());
        }

        SseConnection connection = SseConnection.builder()
                .connectionId(connectionId)
                .roomId(roomId)
                .peerId(peerId)
                .lastEventId(lastEventId)
                .connectedAt(reattach ? existing.get().getConnectedAt() : now)
                .lastActivity(now)
                .build();
        connectionRepository.save(connection);

        if (!reattach) {
            room.getConnectionIds().add(connectionId);
        }
        room.setLastActivity(now);
        roomRepository.save(room);

        log.debug("Connection {} (peer {}) attached to room {}", connectionId, peerId, roomId);
        return connection;
    }

    /**
     * @throws ResourceNotFoundException if the connection is unknown; callers usually treat this as already gone
     */
    public synchronized SseConnection removeConnection(String connectionId) {
        return removeConnection(connectionId, ConnectionRemovalReason.UNSUBSCRIBED);
    }

    public synchronized SseConnection removeConnection(String connectionId, ConnectionRemovalReason reason) {
        SseConnection connection = connectionRepository
                .findById(connectionId)
                .orElseThrow(() -> new ResourceNotFoundException("Connection", connectionId));

        detachFromRoom(connection);
        connectionRepository.delete(connectionId);
        log.debug("Connection {} removed from room {} ({})", connectionId, connection.getRoomId(), reason);

        eventPublisherHelper.publishConnectionRemoved(this, connectionId, connection.getRoomId(), reason);
        return connection;
    }

    /**
     * Refreshes the connection's last activity so the idle sweep keeps it.
     *
     * @throws ResourceNotFoundException if the connection is unknown
     */
    public synchronized SseConnection touchConnection(String connectionId) {
        SseConnection connection = connectionRepository
                .findById(connectionId)
                .orElseThrow(() -> new ResourceNotFoundException("Connection", connectionId));
        connection.setLastActivity(clock.instant());
        connectionRepository.save(connection);
        return connection;
    }

    public Optional<SseConnection> findConnection(String connectionId) {
        return connectionRepository.findById(connectionId);
    }

    public List<SseConnection> findAllConnections() {
        return connectionRepository.findAll();
    }

    /** Peer ids of the room's connections, in attach order. */
    public List<String> getPeerIds(String roomId) {
        SseRoom room = roomRepository
                .findById(roomId)
                .orElseThrow(() -> new ResourceNotFoundException("Room", roomId));
        return room.getConnectionIds().stream()
                .map(connectionRepository::findById)
                .flatMap(Optional::stream)
                .map(SseConnection::getPeerId)
                .distinct()
                .toList();
    }

    // ==== Stats ====

    public RoomStats getRoomStats(String roomId) {
        SseRoom room = roomRepository
                .findById(roomId)
                .orElseThrow(() -> new ResourceNotFoundException("Room", roomId));
        return new RoomStats(roomId, room.getConnectionIds().size(), room.getEventBuffer().size());
    }

    public StreamStats getStreamStats() {
        List<SseRoom> rooms = roomRepository.findAll();
        int connections = rooms.stream().mapToInt(room -> room.getConnectionIds().size()).sum();
        long buffered = rooms.stream().mapToLong(room -> room.getEventBuffer().size()).sum();
        return new StreamStats(rooms.size(), connections, buffered);
    }

    private void detachFromRoom(SseConnection connection) {
        roomRepository.findById(connection.getRoomId()).ifPresent(room -> {
            room.getConnectionIds().remove(connection.getConnectionId());
            room.setLastActivity(clock.instant());
            roomRepository.save(room);
        });
    }
}
