package com.portfolio.backend.exception;

/**
 * Failure talking to the market-data provider. When {@code fallbackEligible} is set the
 * ingestion job may replace the provider data with synthetic prices.
 */
public class MarketDataException extends RuntimeException {
    private final int statusCode;
    private final boolean fallbackEligible;

    public MarketDataException(String message) {
        this(message, -1, false, null);
    }

    public MarketDataException(String message, Throwable cause) {
        this(message, -1, false, cause);
    }

    public MarketDataException(String message, int statusCode, boolean fallbackEligible, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.fallbackEligible = fallbackEligible;
    }

    public static MarketDataException unusableResponse(String message, Throwable cause) {
        return new MarketDataException(message, -1, true, cause);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isFallbackEligible() {
        return fallbackEligible;
    }
}
