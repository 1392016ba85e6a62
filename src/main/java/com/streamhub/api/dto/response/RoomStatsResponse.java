package com.streamhub.api.dto.response;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RoomStatsResponse {

    private String roomId;
    private int connections;
    private int bufferedEvents;
}
