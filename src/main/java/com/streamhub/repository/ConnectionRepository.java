package com.streamhub.repository;

import com.streamhub.domain.model.SseConnection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface ConnectionRepository {

    void save(SseConnection connection);

    Optional<SseConnection> findById(String connectionId);

    List<SseConnection> findAll();

    Set<String> findAllIds();

    void delete(String connectionId);
}
