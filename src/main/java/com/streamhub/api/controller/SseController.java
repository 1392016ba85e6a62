package com.streamhub.api.controller;

import com.streamhub.api.dto.request.RoomStateRequest;
import com.streamhub.api.dto.request.SignalRequest;
import com.streamhub.api.dto.response.RoomStatsResponse;
import com.streamhub.api.dto.response.SseEventResponse;
import com.streamhub.api.dto.response.StreamStatsResponse;
import com.streamhub.api.stream.SseStreamRegistry;
import com.streamhub.auth.PeerIdentityService;
import com.streamhub.domain.enums.SseEventType;
import com.streamhub.domain.model.SseConnection;
import com.streamhub.exception.BusinessException;
import com.streamhub.exception.ErrorCode;
import com.streamhub.exception.UnauthorizedException;
import com.streamhub.mapper.SseEventMapper;
import com.streamhub.sse.ReplayService;
import com.streamhub.sse.RoomRegistry;
import com.streamhub.sse.SignalingService;
import com.streamhub.sse.StreamStats;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

/**
 * REST endpoints for rooms: event streams, signaling relay, replay and statistics.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/sse/rooms/{roomId}/stream -- text/event-stream: retry hint, missed events, then live</li>
 *   <li>POST /api/sse/rooms/{roomId}/signals -- relay an offer, answer or ICE candidate</li>
 *   <li>POST /api/sse/rooms/{roomId}/state -- broadcast the current peer list</li>
 *   <li>GET /api/sse/rooms/{roomId}/events -- buffered events after {@code since}, as JSON</li>
 *   <li>GET /api/sse/rooms/{roomId}/stats -- connection and buffer counts of one room</li>
 *   <li>GET /api/sse/stats -- totals across all rooms</li>
 *   <li>POST /api/sse/connections/{connectionId}/heartbeat -- keep a connection from timing out</li>
 *   <li>DELETE /api/sse/connections/{connectionId} -- leave the room</li>
 * </ul>
 *
 * <p>Replay is best effort: events evicted from the room buffer before a client reconnects
 * are not delivered, the client simply receives what is still buffered.
 */
@RestController
@RequestMapping("/api/sse")
public class SseController {

    static final String LAST_EVENT_ID_HEADER = "Last-Event-ID";

    private final SseStreamRegistry sseStreamRegistry;
    private final SignalingService signalingService;
    private final ReplayService replayService;
    private final RoomRegistry roomRegistry;
    private final PeerIdentityService peerIdentityService;
    private final SseEventMapper sseEventMapper;

    public SseController(
            SseStreamRegistry sseStreamRegistry,
            SignalingService signalingService,
            ReplayService replayService,
            RoomRegistry roomRegistry,
            PeerIdentityService peerIdentityService,
            SseEventMapper sseEventMapper) {
        this.sseStreamRegistry = sseStreamRegistry;
        this.signalingService = signalingService;
        this.replayService = replayService;
        this.roomRegistry = roomRegistry;
        this.peerIdentityService = peerIdentityService;
        this.sseEventMapper = sseEventMapper;
    }

    /**
     * Opens the event stream of a room. The connection id is echoed in the
     * {@code X-Connection-Id} header; pass it back on reconnect together with Last-Event-ID.
     */
    @GetMapping("/rooms/{roomId}/stream")
    public ResponseEntity<ResponseBodyEmitter> stream(
            @PathVariable String roomId,
            @RequestParam(required = false) String connectionId,
            @RequestParam(required = false) String lastEventId,
            @RequestParam(required = false) String token,
            @RequestHeader(value = LAST_EVENT_ID_HEADER, required = false) String lastEventIdHeader,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String peerId =
                peerIdentityService.resolvePeerId(roomId, PeerIdentityService.extractCredential(authorization, token));
        String id = StreamResponses.connectionIdOrNew(connectionId);
        Long cursor = ReplayService.parseLastEventId(lastEventIdHeader != null ? lastEventIdHeader : lastEventId);

        ResponseBodyEmitter emitter =
                sseStreamRegistry.open(id, () -> signalingService.join(roomId, id, peerId, cursor, Map.of()));
        return StreamResponses.eventStream(emitter, id, peerId);
    }

    /**
     * Relays a signaling message. The sender is the token holder, or the peer owning
     * {@code connectionId} in anonymous rooms.
     */
    @PostMapping("/rooms/{roomId}/signals")
    public ResponseEntity<Map<String, Object>> relaySignal(
            @PathVariable String roomId,
            @Valid @RequestBody SignalRequest request,
            @RequestParam(required = false) String connectionId,
            @RequestParam(required = false) String token,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String fromPeerId = resolveSender(roomId, connectionId, authorization, token);
        SseEventType type = SseEventType.fromWireName(request.getType())
                .orElseThrow(() -> new BusinessException(
                        ErrorCode.VALIDATION_ERROR, "Unknown signal type: " + request.getType()));

        long delivered = signalingService.relay(
                roomId, fromPeerId, type, request.getTo(), request.getSdp(), request.getCandidate());
        return ResponseEntity.ok(Map.of("event", type.wireName(), "from", fromPeerId, "deliveredTo", delivered));
    }

    @PostMapping("/rooms/{roomId}/state")
    public ResponseEntity<Map<String, Object>> publishRoomState(
            @PathVariable String roomId, @RequestBody(required = false) RoomStateRequest request) {
        Map<String, String> meta = request != null && request.getMeta() != null ? request.getMeta() : Map.of();
        List<String> peers = signalingService.publishRoomState(roomId, meta);
        return ResponseEntity.ok(Map.of("roomId", roomId, "peers", peers));
    }

    /**
     * Buffered events with id greater than {@code since}; all of them when {@code since} is
     * absent or not a valid id.
     */
    @GetMapping("/rooms/{roomId}/events")
    public ResponseEntity<List<SseEventResponse>> getEvents(
            @PathVariable String roomId, @RequestParam(required = false) String since) {
        return ResponseEntity.ok(sseEventMapper.toResponseList(
                replayService.eventsSince(roomId, ReplayService.parseLastEventId(since))));
    }

    @GetMapping("/rooms/{roomId}/stats")
    public ResponseEntity<RoomStatsResponse> getRoomStats(@PathVariable String roomId) {
        return ResponseEntity.ok(sseEventMapper.toResponse(roomRegistry.getRoomStats(roomId)));
    }

    @GetMapping("/stats")
    public ResponseEntity<StreamStatsResponse> getStats() {
        StreamStats stats = roomRegistry.getStreamStats();
        return ResponseEntity.ok(StreamStatsResponse.builder()
                .rooms(stats.rooms())
                .connections(stats.connections())
                .totalBufferedEvents(stats.totalBufferedEvents())
                .openStreams(sseStreamRegistry.getOpenStreamCount())
                .build());
    }

    @PostMapping("/connections/{connectionId}/heartbeat")
    public ResponseEntity<Map<String, Object>> heartbeat(@PathVariable String connectionId) {
        SseConnection connection = roomRegistry.touchConnection(connectionId);
        return ResponseEntity.ok(Map.of(
                "connectionId", connectionId,
                "roomId", connection.getRoomId(),
                "lastActivity", connection.getLastActivity()));
    }

    @DeleteMapping("/connections/{connectionId}")
    public ResponseEntity<Void> disconnect(@PathVariable String connectionId) {
        signalingService.leave(connectionId);
        return ResponseEntity.noContent().build();
    }

    private String resolveSender(String roomId, String connectionId, String authorization, String token) {
        String credential = PeerIdentityService.extractCredential(authorization, token);
        if (credential != null && !credential.isBlank()) {
            String peerId = peerIdentityService.requirePeerId(credential);
            if (connectionId != null) {
                roomRegistry.findConnection(connectionId).ifPresent(c -> roomRegistry.touchConnection(connectionId));
            }
            return peerId;
        }
        if (connectionId == null || !peerIdentityService.allowsAnonymous(roomId)) {
            throw UnauthorizedException.tokenRequired(roomId);
        }
        SseConnection connection = roomRegistry.findConnection(connectionId)
                .filter(c -> roomId.equals(c.getRoomId()))
                .orElseThrow(() -> new UnauthorizedException("Connection " + connectionId + " is not in room " + roomId));
        roomRegistry.touchConnection(connectionId);
        return connection.getPeerId();
    }
}
