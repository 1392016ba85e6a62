package com.streamhub.sse;

import com.streamhub.domain.enums.SseEventType;
import com.streamhub.domain.model.SseConnection;
import com.streamhub.domain.model.SseEvent;
import com.streamhub.exception.BusinessException;
import com.streamhub.exception.ResourceNotFoundException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Peer-to-peer signaling on top of the room broker: join and leave announcements, relayed
 * session descriptions and candidates, and room state snapshots.
 */
@Service
public class SignalingService {

    private static final Logger log = LoggerFactory.getLogger(SignalingService.class);

    private final RoomRegistry roomRegistry;
    private final BroadcastEngine broadcastEngine;
    private final ReplayService replayService;
    private final SignalingPayloads signalingPayloads;

    public SignalingService(
            RoomRegistry roomRegistry,
            BroadcastEngine broadcastEngine,
            ReplayService replayService,
            SignalingPayloads signalingPayloads) {
        this.roomRegistry = roomRegistry;
        this.broadcastEngine = broadcastEngine;
        this.replayService = replayService;
        this.signalingPayloads = signalingPayloads;
    }

    /**
     * Admits the peer, collects what it missed and announces it to the room.
     *
     * @return buffered events after {@code lastEventId}, captured before the join announcement
     */
    public List<SseEvent> join(
            String roomId, String connectionId, String peerId, Long lastEventId, Map<String, String> meta) {
        roomRegistry.addConnection(roomId, connectionId, peerId, lastEventId);
        List<SseEvent> missed = replayService.eventsSince(roomId, lastEventId);
        broadcastEngine.broadcast(roomId, SseEventType.PEER_JOINED, signalingPayloads.peerJoined(peerId, meta));
        log.info("Peer {} joined room {} ({} events replayed)", peerId, roomId, missed.size());
        return missed;
    }

    /**
     * Removes the connection and announces the departure.
     *
     * @return false if the connection was already gone
     */
    public boolean leave(String connectionId) {
        SseConnection removed;
        try {
            removed = roomRegistry.removeConnection(connectionId);
        } catch (ResourceNotFoundException e) {
            log.debug("Connection {} already gone", connectionId);
            return false;
        }
        broadcastEngine.broadcast(
                removed.getRoomId(), SseEventType.PEER_LEFT, signalingPayloads.peerLeft(removed.getPeerId()));
        log.info("Peer {} left room {}", removed.getPeerId(), removed.getRoomId());
        return true;
    }

    /**
     * Relays an offer, answer or ICE candidate from one peer of the room to another. The
     * event goes to the whole room; clients filter on {@code to}.
     */
    public long relay(
            String roomId,
            String fromPeerId,
            SseEventType type,
            String toPeerId,
            String sdp,
            Map<String, String> candidate) {
        if (!type.isSignal()) {
            throw new BusinessException("Event type " + type.wireName() + " cannot be relayed");
        }
        if (!roomRegistry.getPeerIds(roomId).contains(fromPeerId)) {
            throw BusinessException.forbidden("Peer " + fromPeerId + " is not connected to room " + roomId);
        }

        String payload;
        if (type == SseEventType.ICE_CANDIDATE) {
            payload = signalingPayloads.iceCandidate(fromPeerId, toPeerId, candidate);
        } else {
            if (sdp == null || sdp.isBlank()) {
                throw new BusinessException("sdp is required for " + type.wireName());
            }
            payload = signalingPayloads.sessionDescription(fromPeerId, toPeerId, sdp);
        }
        List<String> targets = broadcastEngine.broadcast(roomId, type, payload);
        log.debug("Relayed {} from {} to {} in room {}", type.wireName(), fromPeerId, toPeerId, roomId);
        return targets.size();
    }

    /** Broadcasts the current peer list of the room. */
    public List<String> publishRoomState(String roomId, Map<String, String> meta) {
        List<String> peers = roomRegistry.getPeerIds(roomId);
        broadcastEngine.broadcast(roomId, SseEventType.ROOM_STATE, signalingPayloads.roomState(peers, meta));
        return peers;
    }
}
