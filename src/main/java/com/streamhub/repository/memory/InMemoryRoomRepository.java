package com.streamhub.repository.memory;

import com.streamhub.domain.model.SseRoom;
import com.streamhub.repository.RoomRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * Process-local room store. Rooms are copied on the way in and out, so stored state only
 * changes through {@link #save}, same as with the Redis store.
 */
@Repository
@ConditionalOnProperty(name = "streamhub.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryRoomRepository implements RoomRepository {

    private final Map<String, SseRoom> rooms = new ConcurrentHashMap<>();

    @Override
    public void save(SseRoom room) {
        rooms.put(room.getRoomId(), copy(room));
    }

    @Override
    public Optional<SseRoom> findById(String roomId) {
        return Optional.ofNullable(rooms.get(roomId)).map(InMemoryRoomRepository::copy);
    }

    @Override
    public List<SseRoom> findAll() {
        return rooms.values().stream().map(InMemoryRoomRepository::copy).toList();
    }

    @Override
    public Set<String> findAllIds() {
        return Set.copyOf(rooms.keySet());
    }

    @Override
    public void delete(String roomId) {
        rooms.remove(roomId);
    }

    private static SseRoom copy(SseRoom room) {
        return SseRoom.builder()
                .roomId(room.getRoomId())
                .connectionIds(new ArrayList<>(room.getConnectionIds()))
                .eventBuffer(new ArrayList<>(room.getEventBuffer()))
                .maxBufferSize(room.getMaxBufferSize())
                .createdAt(room.getCreatedAt())
                .lastActivity(room.getLastActivity())
                .build();
    }
}
