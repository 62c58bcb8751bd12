package com.portfolio.backend.service.marketdata;

import java.util.List;

public record MarketHistory(
        String symbol,
        TickerProfile profile,
        List<DailyBar> bars
) {}
