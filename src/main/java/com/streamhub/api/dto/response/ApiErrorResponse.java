package com.streamhub.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.streamhub.exception.ErrorCode;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope. {@code retryable} mirrors the error code; {@code retryAfterMs} is present
 * when the server suggests a back-off, and matches the {@code Retry-After} header.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return of(errorCode, message, details, path, null);
    }

    public static ApiErrorResponse of(
            ErrorCode errorCode, String message, Map<String, Object> details, String path, Duration retryAfter) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .retryable(errorCode.isRetryable())
                .retryAfterMs(retryAfter != null ? retryAfter.toMillis() : null)
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        private final String code;
        private final String message;
        private final Map<String, Object> details;
        private final boolean retryable;
        private final Long retryAfterMs;
        private final Instant timestamp;
        private final String path;
    }
}
