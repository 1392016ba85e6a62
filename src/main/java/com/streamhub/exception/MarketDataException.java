package com.streamhub.exception;

public class MarketDataException extends BaseException {

    public MarketDataException(String message) {
        super(ErrorCode.PROVIDER_ERROR, message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(ErrorCode.PROVIDER_ERROR, message, cause);
    }
}
