package com.streamhub.api.dto.response;

import lombok.Builder;
import lombok.Data;

/**
 * A buffered event as returned by the JSON replay endpoint. {@code data} is the raw payload
 * text, exactly what the stream would carry.
 */
@Data
@Builder
public class SseEventResponse {

    private long id;

    /** Wire name, e.g. "peer-joined". */
    private String event;

    private String data;

    /** Epoch millis. */
    private long timestamp;
}
