package com.portfolio.backend.service.marketdata;

import java.time.LocalDate;

public interface MarketDataClient {

    /**
     * Daily bars for {@code symbol} between {@code from} and {@code to}, both inclusive.
     *
     * @throws com.portfolio.backend.exception.MarketDataRateLimitException when the provider throttles us
     * @throws com.portfolio.backend.exception.MarketDataException on any other provider failure
     */
    MarketHistory fetchHistory(String symbol, LocalDate from, LocalDate to);
}
