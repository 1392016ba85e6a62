package com.streamhub.exception;

/**
 * A missing, invalid or expired peer token. Answered with 401 and a {@code Bearer} challenge.
 */
public class UnauthorizedException extends BaseException {

    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(ErrorCode.UNAUTHORIZED, message, cause);
    }

    public static UnauthorizedException tokenRequired(String roomId) {
        return new UnauthorizedException("Room " + roomId + " requires a token");
    }
}
