package com.portfolio.backend.service.marketdata;

/**
 * Descriptive data for a symbol. Either field may be null when the provider omits it.
 */
public record TickerProfile(
        String name,
        String sector
) {}
