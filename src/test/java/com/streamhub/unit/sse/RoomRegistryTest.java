package com.streamhub.unit.sse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.streamhub.config.StreamHubProperties;
import com.streamhub.domain.model.SseConnection;
import com.streamhub.domain.model.SseRoom;
import com.streamhub.event.ConnectionRemovalReason;
import com.streamhub.event.EventPublisherHelper;
import com.streamhub.exception.AdmissionRejectedException;
import com.streamhub.exception.ErrorCode;
import com.streamhub.exception.ResourceNotFoundException;
import com.streamhub.repository.memory.InMemoryConnectionRepository;
import com.streamhub.repository.memory.InMemoryRoomRepository;
import com.streamhub.sse.RoomRegistry;
import com.streamhub.sse.RoomStats;
import com.streamhub.sse.StreamStats;
import com.streamhub.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RoomRegistryTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private MutableClock clock;
    private StreamHubProperties properties;
    private InMemoryConnectionRepository connectionRepository;
    private RoomRegistry roomRegistry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        properties = new StreamHubProperties();
        properties.getSse().setMaxConnectionsPerRoom(3);
        connectionRepository = new InMemoryConnectionRepository();
        roomRegistry = new RoomRegistry(
                new InMemoryRoomRepository(), connectionRepository, properties, eventPublisherHelper, clock);
    }

    // ==== Rooms ====

    @Nested
    @DisplayName("ensureRoom")
    class EnsureRoom {

        @Test
        @DisplayName("creates an empty room with the configured buffer size")
        void createsRoom() {
            SseRoom room = roomRegistry.ensureRoom("call-1");

            assertThat(room.getRoomId()).isEqualTo("call-1");
            assertThat(room.getConnectionIds()).isEmpty();
            assertThat(room.getEventBuffer()).isEmpty();
            assertThat(room.getMaxBufferSize()).isEqualTo(1000);
            assertThat(room.getCreatedAt()).isEqualTo(T0);
            assertThat(roomRegistry.findRoom("call-1")).isPresent();
        }

        @Test
        @DisplayName("is idempotent and keeps the original buffer size")
        void idempotent() {
            roomRegistry.ensureRoom("stock_AAPL", 100);
            clock.advance(Duration.ofMinutes(1));

            SseRoom again = roomRegistry.ensureRoom("stock_AAPL", 500);

            assertThat(again.getMaxBufferSize()).isEqualTo(100);
            assertThat(again.getCreatedAt()).isEqualTo(T0);
            assertThat(roomRegistry.findAllRooms()).hasSize(1);
        }
    }

    // ==== Admission ====

    @Nested
    @DisplayName("addConnection")
    class AddConnection {

        @Test
        @DisplayName("creates the room if absent and attaches the connection")
        void createsRoomAndAttaches() {
            SseConnection connection = roomRegistry.addConnection("call-1", "c1", "alice", 7L);

            assertThat(connection.getRoomId()).isEqualTo("call-1");
            assertThat(connection.getPeerId()).isEqualTo("alice");
            assertThat(connection.getLastEventId()).isEqualTo(7L);
            assertThat(connection.getConnectedAt()).isEqualTo(T0);
            assertThat(roomRegistry.findRoom("call-1").orElseThrow().getConnectionIds()).containsExactly("c1");
        }

        @Test
        @DisplayName("rejects the connection beyond the limit and leaves the room at the limit")
        void rejectsBeyondLimit() {
            roomRegistry.addConnection("call-1", "c1", "alice", null);
            roomRegistry.addConnection("call-1", "c2", "bob", null);
            roomRegistry.addConnection("call-1", "c3", "carol", null);

            assertThatThrownBy(() -> roomRegistry.addConnection("call-1", "c4", "dave", null))
                    .isInstanceOf(AdmissionRejectedException.class)
                    .satisfies(e -> {
                        AdmissionRejectedException rejected = (AdmissionRejectedException) e;
                        assertThat(rejected.getErrorCode()).isEqualTo(ErrorCode.ADMISSION_REJECTED);
                        assertThat(rejected.getRetryAfter()).contains(Duration.ofMillis(3000));
                    });

            assertThat(roomRegistry.findRoom("call-1").orElseThrow().getConnectionIds())
                    .containsExactly("c1", "c2", "c3");
            assertThat(roomRegistry.findConnection("c4")).isEmpty();
        }

        @Test
        @DisplayName("re-attaching the same connection id does not count twice")
        void reattachDoesNotCount() {
            roomRegistry.addConnection("call-1", "c1", "alice", null);
            roomRegistry.addConnection("call-1", "c2", "bob", null);
            roomRegistry.addConnection("call-1", "c3", "carol", null);
            clock.advance(Duration.ofSeconds(30));

            SseConnection again = roomRegistry.addConnection("call-1", "c1", "alice", 12L);

            assertThat(again.getConnectedAt()).isEqualTo(T0);
            assertThat(again.getLastActivity()).isEqualTo(T0.plusSeconds(30));
            assertThat(again.getLastEventId()).isEqualTo(12L);
            assertThat(roomRegistry.findRoom("call-1").orElseThrow().getConnectionIds())
                    .containsExactly("c1", "c2", "c3");
        }

        @Test
        @DisplayName("a connection joining another room is moved out of the first")
        void movesBetweenRooms() {
            roomRegistry.addConnection("call-1", "c1", "alice", null);

            roomRegistry.addConnection("call-2", "c1", "alice", null);

            assertThat(roomRegistry.findRoom("call-1").orElseThrow().getConnectionIds()).isEmpty();
            assertThat(roomRegistry.findRoom("call-2").orElseThrow().getConnectionIds()).containsExactly("c1");
            assertThat(roomRegistry.findConnection("c1").orElseThrow().getRoomId()).isEqualTo("call-2");
            verify(eventPublisherHelper, never()).publishConnectionRemoved(any(), anyString(), anyString(), any());
        }
    }

    // ==== Removal ====

    @Nested
    @DisplayName("removeConnection")
    class RemoveConnection {

        @Test
        @DisplayName("detaches from the room, deletes the record and announces the removal")
        void removes() {
            roomRegistry.addConnection("call-1", "c1", "alice", null);
            clock.advance(Duration.ofSeconds(5));

            SseConnection removed = roomRegistry.removeConnection("c1");

            assertThat(removed.getPeerId()).isEqualTo("alice");
            assertThat(roomRegistry.findConnection("c1")).isEmpty();
            SseRoom room = roomRegistry.findRoom("call-1").orElseThrow();
            assertThat(room.getConnectionIds()).isEmpty();
            assertThat(room.getLastActivity()).isEqualTo(T0.plusSeconds(5));
            verify(eventPublisherHelper)
                    .publishConnectionRemoved(
                            any(), eq("c1"), eq("call-1"), eq(ConnectionRemovalReason.UNSUBSCRIBED));
        }

        @Test
        @DisplayName("unknown connection fails with not found")
        void unknown() {
            assertThatThrownBy(() -> roomRegistry.removeConnection("ghost"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("removing twice fails the second time")
        void twice() {
            roomRegistry.addConnection("call-1", "c1", "alice", null);
            roomRegistry.removeConnection("c1");

            assertThatThrownBy(() -> roomRegistry.removeConnection("c1"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Test
    @DisplayName("touchConnection refreshes last activity")
    void touch() {
        roomRegistry.addConnection("call-1", "c1", "alice", null);
        clock.advance(Duration.ofMinutes(2));

        roomRegistry.touchConnection("c1");

        assertThat(roomRegistry.findConnection("c1").orElseThrow().getLastActivity()).isEqualTo(T0.plusSeconds(120));
        assertThatThrownBy(() -> roomRegistry.touchConnection("ghost")).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("getPeerIds lists peers in attach order")
    void peerIds() {
        roomRegistry.addConnection("call-1", "c1", "alice", null);
        roomRegistry.addConnection("call-1", "c2", "bob", null);

        assertThat(roomRegistry.getPeerIds("call-1")).containsExactly("alice", "bob");
        assertThatThrownBy(() -> roomRegistry.getPeerIds("nope")).isInstanceOf(ResourceNotFoundException.class);
    }

    // ==== Maintenance ====

    @Test
    @DisplayName("deleteRoomIfIdle only deletes empty rooms idle since the cutoff")
    void deleteRoomIfIdle() {
        roomRegistry.addConnection("busy", "c1", "alice", null);
        roomRegistry.ensureRoom("quiet");
        clock.advance(Duration.ofMinutes(10));
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(5));

        assertThat(roomRegistry.deleteRoomIfIdle("busy", cutoff)).isFalse();
        assertThat(roomRegistry.deleteRoomIfIdle("quiet", cutoff)).isTrue();
        assertThat(roomRegistry.deleteRoomIfIdle("quiet", cutoff)).isFalse();
        assertThat(roomRegistry.findRoom("quiet")).isEmpty();
    }

    @Test
    @DisplayName("stats count connections and buffered events")
    void stats() {
        roomRegistry.addConnection("a", "c1", "alice", null);
        roomRegistry.addConnection("a", "c2", "bob", null);
        roomRegistry.addConnection("b", "c3", "carol", null);

        RoomStats roomStats = roomRegistry.getRoomStats("a");
        StreamStats streamStats = roomRegistry.getStreamStats();

        assertThat(roomStats.connections()).isEqualTo(2);
        assertThat(roomStats.bufferedEvents()).isZero();
        assertThat(streamStats.rooms()).isEqualTo(2);
        assertThat(streamStats.connections()).isEqualTo(3);
        assertThatThrownBy(() -> roomRegistry.getRoomStats("nope")).isInstanceOf(ResourceNotFoundException.class);
    }
}
