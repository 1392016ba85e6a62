package com.streamhub.exception;

import java.time.Duration;
import java.util.Map;

/**
 * Raised when a room already holds its maximum number of connections.
 *
 * <p>Surfaced as HTTP 429: the subscriber may retry once other connections leave or time out.
 */
public class AdmissionRejectedException extends BaseException {

    public AdmissionRejectedException(String roomId, int maxConnections) {
        this(roomId, maxConnections, null);
    }

    public AdmissionRejectedException(String roomId, int maxConnections, Duration retryAfter) {
        super(
                ErrorCode.ADMISSION_REJECTED,
                String.format("Room %s is full (%d connections)", roomId, maxConnections),
                Map.of("roomId", roomId, "maxConnections", maxConnections),
                retryAfter,
                null);
    }
}
