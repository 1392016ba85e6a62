package com.streamhub.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.streamhub.api.controller.SseController;
import com.streamhub.api.stream.SseStreamRegistry;
import com.streamhub.auth.PeerIdentityService;
import com.streamhub.config.ApiResponseAdvice;
import com.streamhub.domain.enums.SseEventType;
import com.streamhub.domain.model.SseConnection;
import com.streamhub.domain.model.SseEvent;
import com.streamhub.exception.AdmissionRejectedException;
import com.streamhub.exception.GlobalExceptionHandler;
import com.streamhub.exception.ResourceNotFoundException;
import com.streamhub.exception.UnauthorizedException;
import com.streamhub.mapper.SseEventMapper;
import com.streamhub.sse.ReplayService;
import com.streamhub.sse.RoomRegistry;
import com.streamhub.sse.RoomStats;
import com.streamhub.sse.SignalingService;
import com.streamhub.sse.StreamStats;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

@ExtendWith(MockitoExtension.class)
class SseControllerTest {

    private MockMvc mockMvc;

    @Mock
    private SseStreamRegistry sseStreamRegistry;

    @Mock
    private SignalingService signalingService;

    @Mock
    private ReplayService replayService;

    @Mock
    private RoomRegistry roomRegistry;

    @Mock
    private PeerIdentityService peerIdentityService;

    @BeforeEach
    void setUp() {
        SseController controller = new SseController(
                sseStreamRegistry,
                signalingService,
                replayService,
                roomRegistry,
                peerIdentityService,
                Mappers.getMapper(SseEventMapper.class));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    // ==== Stream ====

    @Nested
    @DisplayName("GET /api/sse/rooms/{roomId}/stream")
    class Stream {

        @Test
        @DisplayName("opens a stream and joins with the Last-Event-ID cursor")
        @SuppressWarnings("unchecked")
        void opensStream() throws Exception {
            when(peerIdentityService.resolvePeerId("call-1", "tok")).thenReturn("alice");
            when(sseStreamRegistry.open(eq("c1"), any())).thenReturn(new ResponseBodyEmitter());

            mockMvc.perform(get("/api/sse/rooms/call-1/stream")
                            .param("connectionId", "c1")
                            .param("token", "tok")
                            .header("Last-Event-ID", "5"))
                    .andExpect(request().asyncStarted())
                    .andExpect(header().string("X-Connection-Id", "c1"))
                    .andExpect(header().string("X-Peer-Id", "alice"));

            ArgumentCaptor<Supplier<List<SseEvent>>> admission = ArgumentCaptor.forClass(Supplier.class);
            verify(sseStreamRegistry).open(eq("c1"), admission.capture());
            admission.getValue().get();
            verify(signalingService).join("call-1", "c1", "alice", 5L, Map.of());
        }

        @Test
        @DisplayName("a malformed cursor replays everything")
        @SuppressWarnings("unchecked")
        void malformedCursor() throws Exception {
            when(peerIdentityService.resolvePeerId("market_global", null)).thenReturn("anon-1");
            when(sseStreamRegistry.open(any(), any())).thenReturn(new ResponseBodyEmitter());

            mockMvc.perform(get("/api/sse/rooms/market_global/stream").param("lastEventId", "abc"))
                    .andExpect(request().asyncStarted());

            ArgumentCaptor<Supplier<List<SseEvent>>> admission = ArgumentCaptor.forClass(Supplier.class);
            ArgumentCaptor<String> connectionId = ArgumentCaptor.forClass(String.class);
            verify(sseStreamRegistry).open(connectionId.capture(), admission.capture());
            admission.getValue().get();
            assertThat(connectionId.getValue()).isNotBlank();
            verify(signalingService).join(eq("market_global"), eq(connectionId.getValue()), eq("anon-1"), isNull(), eq(Map.of()));
        }

        @Test
        @DisplayName("returns 401 when the room needs a token")
        void unauthorized() throws Exception {
            when(peerIdentityService.resolvePeerId("call-1", null))
                    .thenThrow(new UnauthorizedException("Room call-1 requires a token"));

            mockMvc.perform(get("/api/sse/rooms/call-1/stream"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(header().string("WWW-Authenticate", "Bearer"))
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.retryable").value(false))
                    .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"));
        }

        @Test
        @DisplayName("returns 429 when the room is full")
        void roomFull() throws Exception {
            when(peerIdentityService.resolvePeerId("call-1", "tok")).thenReturn("alice");
            when(sseStreamRegistry.open(any(), any()))
                    .thenThrow(new AdmissionRejectedException("call-1", 100, Duration.ofMillis(2500)));

            mockMvc.perform(get("/api/sse/rooms/call-1/stream").header("Authorization", "Bearer tok"))
                    .andExpect(status().isTooManyRequests())
                    .andExpect(header().string("Retry-After", "3"))
                    .andExpect(jsonPath("$.error.code").value("ADMISSION_REJECTED"))
                    .andExpect(jsonPath("$.error.retryable").value(true))
                    .andExpect(jsonPath("$.error.retryAfterMs").value(2500))
                    .andExpect(jsonPath("$.error.details.maxConnections").value(100));
        }
    }

    // ==== Signals ====

    @Nested
    @DisplayName("POST /api/sse/rooms/{roomId}/signals")
    class Signals {

        @Test
        @DisplayName("relays an offer from the token holder")
        void relaysOffer() throws Exception {
            when(peerIdentityService.requirePeerId("tok")).thenReturn("alice");
            when(signalingService.relay("call-1", "alice", SseEventType.OFFER, "bob", "v=0", null))
                    .thenReturn(2L);

            mockMvc.perform(post("/api/sse/rooms/call-1/signals")
                            .header("Authorization", "Bearer tok")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"type":"offer","to":"bob","sdp":"v=0"}
                            """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.event").value("offer"))
                    .andExpect(jsonPath("$.data.from").value("alice"))
                    .andExpect(jsonPath("$.data.deliveredTo").value(2));
        }

        @Test
        @DisplayName("anonymous rooms identify the sender by its connection")
        void anonymousSender() throws Exception {
            when(peerIdentityService.allowsAnonymous("stock_TCS")).thenReturn(true);
            when(roomRegistry.findConnection("c9")).thenReturn(Optional.of(SseConnection.builder()
                    .connectionId("c9")
                    .roomId("stock_TCS")
                    .peerId("anon-9")
                    .build()));
            when(signalingService.relay(
                            "stock_TCS", "anon-9", SseEventType.ICE_CANDIDATE, "anon-1", null, Map.of("candidate", "x")))
                    .thenReturn(1L);

            mockMvc.perform(post("/api/sse/rooms/stock_TCS/signals")
                            .param("connectionId", "c9")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"type":"ice-candidate","to":"anon-1","candidate":{"candidate":"x"}}
                            """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.from").value("anon-9"));
            verify(roomRegistry).touchConnection("c9");
        }

        @Test
        @DisplayName("rejects unknown signal types")
        void unknownType() throws Exception {
            when(peerIdentityService.requirePeerId("tok")).thenReturn("alice");

            mockMvc.perform(post("/api/sse/rooms/call-1/signals")
                            .param("token", "tok")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"type":"hello","to":"bob"}
                            """))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
        }

        @Test
        @DisplayName("requires a recipient")
        void missingRecipient() throws Exception {
            mockMvc.perform(post("/api/sse/rooms/call-1/signals")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"type":"offer","sdp":"v=0"}
                            """))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.details.to").value("to is required"));
        }

        @Test
        @DisplayName("private rooms require a token")
        void privateRoomWithoutToken() throws Exception {
            mockMvc.perform(post("/api/sse/rooms/call-1/signals")
                            .param("connectionId", "c1")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"type":"offer","to":"bob","sdp":"v=0"}
                            """))
                    .andExpect(status().isUnauthorized());
        }
    }

    // ==== Replay and stats ====

    @Test
    @DisplayName("GET /events returns buffered events after the cursor")
    void events() throws Exception {
        when(replayService.eventsSince("call-1", 5L)).thenReturn(List.of(SseEvent.builder()
                .id(6)
                .type(SseEventType.PEER_JOINED)
                .data("{\"peerId\":\"bob\"}")
                .timestamp(Instant.ofEpochMilli(1_700_000_000_000L))
                .build()));

        mockMvc.perform(get("/api/sse/rooms/call-1/events").param("since", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].id").value(6))
                .andExpect(jsonPath("$.data[0].event").value("peer-joined"))
                .andExpect(jsonPath("$.data[0].data").value("{\"peerId\":\"bob\"}"))
                .andExpect(jsonPath("$.data[0].timestamp").value(1_700_000_000_000L));
    }

    @Test
    @DisplayName("GET /events with an invalid cursor returns the whole buffer")
    void eventsInvalidCursor() throws Exception {
        when(replayService.eventsSince("call-1", null)).thenReturn(List.of());

        mockMvc.perform(get("/api/sse/rooms/call-1/events").param("since", "-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(0));
    }

    @Test
    void roomStats() throws Exception {
        when(roomRegistry.getRoomStats("call-1")).thenReturn(new RoomStats("call-1", 2, 14));

        mockMvc.perform(get("/api/sse/rooms/call-1/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.roomId").value("call-1"))
                .andExpect(jsonPath("$.data.connections").value(2))
                .andExpect(jsonPath("$.data.bufferedEvents").value(14));
    }

    @Test
    void roomStatsUnknownRoom() throws Exception {
        when(roomRegistry.getRoomStats("nope")).thenThrow(new ResourceNotFoundException("Room", "nope"));

        mockMvc.perform(get("/api/sse/rooms/nope/stats"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.message").value("Room not found with identifier: nope"))
                .andExpect(jsonPath("$.error.details.resource").value("Room"));
    }

    @Test
    void globalStats() throws Exception {
        when(roomRegistry.getStreamStats()).thenReturn(new StreamStats(3, 5, 40));
        when(sseStreamRegistry.getOpenStreamCount()).thenReturn(4);

        mockMvc.perform(get("/api/sse/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.rooms").value(3))
                .andExpect(jsonPath("$.data.connections").value(5))
                .andExpect(jsonPath("$.data.totalBufferedEvents").value(40))
                .andExpect(jsonPath("$.data.openStreams").value(4));
    }

    // ==== Connections ====

    @Test
    void heartbeat() throws Exception {
        when(roomRegistry.touchConnection("c1")).thenReturn(SseConnection.builder()
                .connectionId("c1")
                .roomId("call-1")
                .peerId("alice")
                .lastActivity(Instant.parse("2025-03-01T10:00:00Z"))
                .build());

        mockMvc.perform(post("/api/sse/connections/c1/heartbeat"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.roomId").value("call-1"));
    }

    @Test
    void heartbeatUnknownConnection() throws Exception {
        when(roomRegistry.touchConnection("ghost")).thenThrow(new ResourceNotFoundException("Connection", "ghost"));

        mockMvc.perform(post("/api/sse/connections/ghost/heartbeat")).andExpect(status().isNotFound());
    }

    @Test
    void disconnect() throws Exception {
        mockMvc.perform(delete("/api/sse/connections/c1")).andExpect(status().isNoContent());

        verify(signalingService).leave("c1");
    }
}
