package com.streamhub.mapper;

import com.streamhub.api.dto.response.RoomStatsResponse;
import com.streamhub.api.dto.response.SseEventResponse;
import com.streamhub.domain.enums.SseEventType;
import com.streamhub.domain.model.SseEvent;
import com.streamhub.sse.RoomStats;
import java.time.Instant;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper from broker records to API responses.
 */
@Mapper
public interface SseEventMapper {

    @Mapping(source = "type", target = "event", qualifiedByName = "wireName")
    @Mapping(source = "timestamp", target = "timestamp", qualifiedByName = "toEpochMillis")
    SseEventResponse toResponse(SseEvent event);

    List<SseEventResponse> toResponseList(List<SseEvent> events);

    RoomStatsResponse toResponse(RoomStats stats);

    @Named("wireName")
    default String wireName(SseEventType type) {
        return type != null ? type.wireName() : null;
    }

    @Named("toEpochMillis")
    default long toEpochMillis(Instant instant) {
        return instant != null ? instant.toEpochMilli() : 0L;
    }
}
