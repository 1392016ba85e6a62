package com.streamhub.repository;

import com.streamhub.domain.model.SseRoom;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage for rooms, including their connection id lists and event buffers.
 *
 * <p>Implementations hand out detached copies: a caller mutating a returned room changes
 * nothing until it calls {@link #save}.
 */
public interface RoomRepository {

    void save(SseRoom room);

    Optional<SseRoom> findById(String roomId);

    List<SseRoom> findAll();

    Set<String> findAllIds();

    void delete(String roomId);
}
