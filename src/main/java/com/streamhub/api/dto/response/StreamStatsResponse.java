package com.streamhub.api.dto.response;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class StreamStatsResponse {

    private int rooms;
    private int connections;
    private long totalBufferedEvents;

    /** Streams open on this instance. Can differ from connections when the store is shared. */
    private int openStreams;
}
