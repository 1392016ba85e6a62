package com.streamhub.repository.memory;

import com.streamhub.domain.model.SseConnection;
import com.streamhub.repository.ConnectionRepository;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "streamhub.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryConnectionRepository implements ConnectionRepository {

    private final Map<String, SseConnection> connections = new ConcurrentHashMap<>();

    @Override
    public void save(SseConnection connection) {
        connections.put(connection.getConnectionId(), copy(connection));
    }

    @Override
    public Optional<SseConnection> findById(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId)).map(InMemoryConnectionRepository::copy);
    }

    @Override
    public List<SseConnection> findAll() {
        return connections.values().stream().map(InMemoryConnectionRepository::copy).toList();
    }

    @Override
    public Set<String> findAllIds() {
        return Set.copyOf(connections.keySet());
    }

    @Override
    public void delete(String connectionId) {
        connections.remove(connectionId);
    }

    private static SseConnection copy(SseConnection connection) {
        return SseConnection.builder()
                .connectionId(connection.getConnectionId())
                .roomId(connection.getRoomId())
                .peerId(connection.getPeerId())
                .lastEventId(connection.getLastEventId())
                .connectedAt(connection.getConnectedAt())
                .lastActivity(connection.getLastActivity())
                .build();
    }
}
