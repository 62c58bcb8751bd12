package com.portfolio.backend.service.ingestion;

import com.portfolio.backend.config.IngestionProperties;
import com.portfolio.backend.exception.MarketDataException;
import com.portfolio.backend.model.Ticker;
import com.portfolio.backend.service.ingestion.SymbolIngestionResult.Source;
import com.portfolio.backend.service.marketdata.DailyBar;
import com.portfolio.backend.service.marketdata.MarketDataClient;
import com.portfolio.backend.service.marketdata.MarketHistory;
import com.portfolio.backend.service.marketdata.TickerProfile;
import com.portfolio.backend.util.TradingDays;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Backfills the trailing price window for a list of symbols.
 *
 * <p>Symbols run concurrently on the ingestion executor, each one started {@code stagger * index}
 * after the run begins. A failing symbol never cancels the others; every outcome ends up in the
 * returned {@link IngestionReport}. When the provider throttles or returns unusable data, the rest
 * of the run switches to synthetic prices.
 */
@Slf4j
@Service
public class PriceIngestionService {

    private final MarketDataClient marketDataClient;
    private final MarketDataStore marketDataStore;
    private final SyntheticPriceGenerator syntheticPriceGenerator;
    private final SyntheticTickerCatalog syntheticTickerCatalog;
    private final IngestionProperties properties;
    private final Executor ingestionExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public PriceIngestionService(MarketDataClient marketDataClient,
                                 MarketDataStore marketDataStore,
                                 SyntheticPriceGenerator syntheticPriceGenerator,
                                 SyntheticTickerCatalog syntheticTickerCatalog,
                                 IngestionProperties properties,
                                 @Qualifier("ingestionExecutor") Executor ingestionExecutor,
                                 MeterRegistry meterRegistry,
                                 Clock clock) {
        this.marketDataClient = marketDataClient;
        this.marketDataStore = marketDataStore;
        this.syntheticPriceGenerator = syntheticPriceGenerator;
        this.syntheticTickerCatalog = syntheticTickerCatalog;
        this.properties = properties;
        this.ingestionExecutor = ingestionExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public IngestionReport runConfigured() {
        return runIngestion(properties.normalizedTickers());
    }

    public IngestionReport runIngestion(List<String> symbols) {
        Instant startedAt = clock.instant();
        Timer.Sample sample = Timer.start(meterRegistry);
        LocalDate today = LocalDate.now(clock);
        AtomicBoolean synthetic = new AtomicBoolean(properties.isUseSyntheticData());
        long staggerMs = Math.max(0L, properties.getStagger().toMillis());

        log.info("Starting price ingestion for {} tickers: {}", symbols.size(), symbols);

        long timeoutMs = properties.getRunTimeout().toMillis();
        List<CompletableFuture<SymbolIngestionResult>> futures = new ArrayList<>();
        for (int idx = 0; idx < symbols.size(); idx++) {
            String symbol = symbols.get(idx);
            futures.add(startAfter(staggerMs * idx, symbol, synthetic, today)
                    .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> SymbolIngestionResult.failed(symbol,
                            synthetic.get() ? Source.SYNTHETIC : Source.PROVIDER, unwrap(ex))));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<SymbolIngestionResult> results = futures.stream().map(CompletableFuture::join).toList();
        IngestionReport report = new IngestionReport(startedAt, clock.instant(), synthetic.get(), results);
        sample.stop(Timer.builder("ingestion_run_duration")
                .tag("mode", report.endedInSyntheticMode() ? "synthetic" : "provider")
                .register(meterRegistry));
        log.info("Price ingestion completed: {} successful, {} errors, {} rows inserted",
                report.successCount(), report.errorCount(), report.insertedCount());
        return report;
    }

    /**
     * Runs {@code symbol} on the ingestion executor once {@code delayMs} has passed. A rejected
     * hand-off completes the returned future exceptionally instead of leaving it pending.
     */
    private CompletableFuture<SymbolIngestionResult> startAfter(long delayMs, String symbol,
                                                               AtomicBoolean synthetic, LocalDate today) {
        CompletableFuture<SymbolIngestionResult> future = new CompletableFuture<>();
        Executor handOff = task -> {
            try {
                ingestionExecutor.execute(task);
            } catch (RejectedExecutionException | IllegalStateException e) {
                log.error("Ingestion executor rejected ticker {}: {}", symbol, e.getMessage());
                future.completeExceptionally(e);
            }
        };
        CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS, handOff).execute(() -> {
            try {
                future.complete(ingestSymbol(symbol, synthetic, today));
            } catch (Throwable t) {
                future.completeExceptionally(t);
                throw t;
            }
        });
        return future;
    }

    SymbolIngestionResult ingestSymbol(String symbol, AtomicBoolean synthetic, LocalDate today) {
        SymbolIngestionResult result;
        try {
            result = synthetic.get()
                    ? synthesize(symbol, today)
                    : fetchAndStore(symbol, today);
        } catch (MarketDataException e) {
            log.error("Error processing ticker {}: {}", symbol, e.getMessage());
            if (!e.isFallbackEligible()) {
                result = SymbolIngestionResult.failed(symbol, Source.PROVIDER, e);
            } else {
                if (synthetic.compareAndSet(false, true)) {
                    log.warn("Market data unavailable for {}. Switching the rest of this run to synthetic data.", symbol);
                }
                result = synthesizeQuietly(symbol, today);
            }
        } catch (RuntimeException e) {
            log.error("Error processing ticker {}", symbol, e);
            result = SymbolIngestionResult.failed(symbol, synthetic.get() ? Source.SYNTHETIC : Source.PROVIDER, e);
        }
        meterRegistry.counter("ingestion_symbols_total",
                "source", result.source().name().toLowerCase(),
                "outcome", result.success() ? "success" : "error").increment();
        return result;
    }

    private SymbolIngestionResult fetchAndStore(String symbol, LocalDate today) {
        log.info("Processing ticker: {}", symbol);
        MarketHistory history = marketDataClient.fetchHistory(symbol, today.minusDays(properties.getWindowDays()), today);
        Ticker ticker = marketDataStore.upsertTicker(symbol, withCatalogSector(symbol, history.profile()));
        int inserted = marketDataStore.insertMissing(ticker, history.bars());
        log.info("Stored {} price records for {}", inserted, symbol);
        return SymbolIngestionResult.succeeded(symbol, Source.PROVIDER, inserted);
    }

    /**
     * The chart endpoint carries no sector, so known symbols take theirs from the catalog.
     */
    private TickerProfile withCatalogSector(String symbol, TickerProfile profile) {
        if (profile.sector() != null && !profile.sector().isBlank()) {
            return profile;
        }
        return syntheticTickerCatalog.find(symbol)
                .map(entry -> new TickerProfile(profile.name(), entry.sector()))
                .orElse(profile);
    }

    private SymbolIngestionResult synthesizeQuietly(String symbol, LocalDate today) {
        try {
            return synthesize(symbol, today);
        } catch (RuntimeException e) {
            log.error("Failed to create synthetic data for {}", symbol, e);
            return SymbolIngestionResult.failed(symbol, Source.SYNTHETIC, e);
        }
    }

    private SymbolIngestionResult synthesize(String symbol, LocalDate today) {
        log.info("Creating synthetic data for ticker: {}", symbol);
        SyntheticTickerCatalog.Entry entry = syntheticTickerCatalog.lookup(symbol);
        Ticker ticker = marketDataStore.findOrCreateTicker(symbol, entry.name(), entry.sector());
        Set<LocalDate> existing = marketDataStore.existingDates(ticker.getId());
        List<DailyBar> bars = syntheticPriceGenerator.generate(
                entry.basePrice(),
                TradingDays.window(today, properties.getWindowDays()),
                existing,
                ThreadLocalRandom.current());
        int inserted = marketDataStore.insertMissing(ticker, bars);
        log.info("Created {} synthetic price records for {}", inserted, symbol);
        return SymbolIngestionResult.succeeded(symbol, Source.SYNTHETIC, inserted);
    }

    private static Throwable unwrap(Throwable ex) {
        if (ex instanceof CompletionException && ex.getCause() != null) {
            return ex.getCause();
        }
        return ex;
    }
}
