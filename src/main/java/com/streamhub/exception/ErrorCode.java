package com.streamhub.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes of the API envelope. A retryable code tells the client the same request may
 * succeed later without any change on its side.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    UNAUTHORIZED("UNAUTHORIZED", 401, false),
    FORBIDDEN("FORBIDDEN", 403, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    ADMISSION_REJECTED("ADMISSION_REJECTED", 429, true),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false),
    PROVIDER_ERROR("PROVIDER_ERROR", 502, true);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
