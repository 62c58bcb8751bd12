package com.portfolio.backend.service.ingestion;

import com.portfolio.backend.model.PricePoint;
import com.portfolio.backend.model.Ticker;
import com.portfolio.backend.repository.PricePointRepository;
import com.portfolio.backend.repository.TickerRepository;
import com.portfolio.backend.service.marketdata.DailyBar;
import com.portfolio.backend.service.marketdata.TickerProfile;
import com.portfolio.backend.util.TradingDays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Transactional writes for the ingestion job. Tickers are upserted; prices are insert-only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketDataStore {

    private final TickerRepository tickerRepository;
    private final PricePointRepository pricePointRepository;

    /**
     * Creates the ticker or refreshes its descriptive fields from the provider.
     */
    @Transactional
    public Ticker upsertTicker(String symbol, TickerProfile profile) {
        return tickerRepository.findBySymbol(symbol)
                .map(existing -> {
                    existing.setName(firstNonBlank(profile.name(), existing.getName(), symbol));
                    existing.setSector(firstNonBlank(profile.sector(), existing.getSector(), SyntheticTickerCatalog.UNKNOWN_SECTOR));
                    existing.setUpdatedAt(LocalDateTime.now());
                    Ticker saved = tickerRepository.save(existing);
                    log.info("Updated ticker: {}", symbol);
                    return saved;
                })
                .orElseGet(() -> {
                    Ticker created = tickerRepository.save(Ticker.builder()
                            .symbol(symbol)
                            .name(firstNonBlank(profile.name(), symbol))
                            .sector(firstNonBlank(profile.sector(), SyntheticTickerCatalog.UNKNOWN_SECTOR))
                            .build());
                    log.info("Created ticker: {} - {}", symbol, created.getName());
                    return created;
                });
    }

    /**
     * Returns the stored ticker untouched, or creates it from the given reference data.
     */
    @Transactional
    public Ticker findOrCreateTicker(String symbol, String name, String sector) {
        return tickerRepository.findBySymbol(symbol)
                .orElseGet(() -> {
                    Ticker created = tickerRepository.save(Ticker.builder()
                            .symbol(symbol)
                            .name(name)
                            .sector(sector)
                            .build());
                    log.info("Created ticker with synthetic data: {} - {}", symbol, name);
                    return created;
                });
    }

    @Transactional(readOnly = true)
    public Set<LocalDate> existingDates(Long tickerId) {
        return new HashSet<>(pricePointRepository.findDatesByTickerId(tickerId));
    }

    /**
     * Inserts bars whose date is a weekday not yet stored for the ticker.
     *
     * @return number of rows written
     */
    @Transactional
    public int insertMissing(Ticker ticker, List<DailyBar> bars) {
        Set<LocalDate> seen = new HashSet<>(pricePointRepository.findDatesByTickerId(ticker.getId()));
        List<PricePoint> toInsert = bars.stream()
                .filter(bar -> !TradingDays.isWeekend(bar.date()))
                .filter(bar -> seen.add(bar.date()))
                .map(bar -> PricePoint.builder()
                        .ticker(ticker)
                        .date(bar.date())
                        .open(bar.open())
                        .high(bar.high())
                        .low(bar.low())
                        .close(bar.close())
                        .volume(bar.volume())
                        .build())
                .toList();
        if (!toInsert.isEmpty()) {
            pricePointRepository.saveAll(toInsert);
        }
        return toInsert.size();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
