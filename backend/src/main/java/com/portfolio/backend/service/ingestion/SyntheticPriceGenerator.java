package com.portfolio.backend.service.ingestion;

import com.portfolio.backend.service.marketdata.DailyBar;
import com.portfolio.backend.util.MoneyUtils;
import com.portfolio.backend.util.TradingDays;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Random-walk daily bars for symbols the provider cannot serve.
 */
@Component
public class SyntheticPriceGenerator {

    static final double BASE_JITTER = 0.05;
    static final double DAILY_MOVE = 0.03;
    static final long MIN_VOLUME = 50_000_000L;
    static final long MAX_VOLUME = 150_000_000L;

    /**
     * Walks the window oldest first. Weekends and dates in {@code existingDates} are skipped,
     * and the price only moves on days that produce a bar.
     */
    public List<DailyBar> generate(BigDecimal basePrice, List<LocalDate> window, Set<LocalDate> existingDates,
                                   Random random) {
        double price = basePrice.doubleValue() * uniform(random, 1 - BASE_JITTER, 1 + BASE_JITTER);
        List<DailyBar> bars = new ArrayList<>();
        for (LocalDate date : window) {
            if (TradingDays.isWeekend(date) || existingDates.contains(date)) {
                continue;
            }
            price = price * (1 + uniform(random, -DAILY_MOVE, DAILY_MOVE));
            double close = price;
            double open = close * uniform(random, 0.99, 1.01);
            double high = Math.max(open, close) * uniform(random, 1.0, 1.02);
            double low = Math.min(open, close) * uniform(random, 0.98, 1.0);
            long volume = MIN_VOLUME + (long) (random.nextDouble() * (MAX_VOLUME - MIN_VOLUME));
            bars.add(new DailyBar(
                    date,
                    MoneyUtils.bd(open),
                    MoneyUtils.bd(high),
                    MoneyUtils.bd(low),
                    MoneyUtils.bd(close),
                    volume
            ));
        }
        return bars;
    }

    private double uniform(Random random, double min, double max) {
        return min + (max - min) * random.nextDouble();
    }
}
