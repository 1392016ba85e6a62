package com.streamhub.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collection;
import lombok.Getter;

/**
 * Success envelope for JSON endpoints. Collection payloads also carry their size, so a client
 * polling {@code /events?since=} can tell an empty replay apart without inspecting the body.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Integer count;
    private final Instant timestamp;

    private ApiResponse(T data, Integer count, Instant timestamp) {
        this.data = data;
        this.count = count;
        this.timestamp = timestamp;
    }

    public static <T> ApiResponse<T> of(T data) {
        Integer count = data instanceof Collection<?> collection ? collection.size() : null;
        return new ApiResponse<>(data, count, Instant.now());
    }
}
