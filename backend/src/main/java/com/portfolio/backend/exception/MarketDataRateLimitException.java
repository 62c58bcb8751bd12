package com.portfolio.backend.exception;

public class MarketDataRateLimitException extends MarketDataException {
    public MarketDataRateLimitException(String message) {
        super(message, 429, true, null);
    }

    public MarketDataRateLimitException(String message, Throwable cause) {
        super(message, 429, true, cause);
    }
}
