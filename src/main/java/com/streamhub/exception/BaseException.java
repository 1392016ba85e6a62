package com.streamhub.exception;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;

/**
 * Root of the service's unchecked exceptions. The error code decides the HTTP status; the
 * details end up in the {@code error.details} object of the response.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    /** Suggested client back-off, sent as {@code Retry-After}. Only set for retryable codes. */
    @Getter(lombok.AccessLevel.NONE)
    private final Duration retryAfter;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, null, cause);
    }

    protected BaseException(
            ErrorCode errorCode, String message, Map<String, Object> details, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.retryAfter = errorCode.isRetryable() ? retryAfter : null;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
