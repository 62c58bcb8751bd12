package com.portfolio.backend.service.ingestion;

import com.portfolio.backend.util.MoneyUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Reference names, sectors and starting prices used when prices are synthesized.
 */
@Component
public class SyntheticTickerCatalog {

    static final BigDecimal DEFAULT_BASE_PRICE = MoneyUtils.bd(100.0);
    static final String UNKNOWN_SECTOR = "Unknown";

    private static final Map<String, Entry> ENTRIES = Map.of(
            "AAPL", new Entry("Apple Inc.", "Technology", MoneyUtils.bd(192.50)),
            "GOOGL", new Entry("Alphabet Inc.", "Technology", MoneyUtils.bd(141.80)),
            "MSFT", new Entry("Microsoft Corporation", "Technology", MoneyUtils.bd(378.91)),
            "TSLA", new Entry("Tesla, Inc.", "Automotive", MoneyUtils.bd(242.84)),
            "NVDA", new Entry("NVIDIA Corporation", "Technology", MoneyUtils.bd(140.15)),
            "AMZN", new Entry("Amazon.com, Inc.", "Consumer Cyclical", MoneyUtils.bd(197.50)),
            "META", new Entry("Meta Platforms, Inc.", "Technology", MoneyUtils.bd(352.00)),
            "JPM", new Entry("JPMorgan Chase & Co.", "Financial Services", MoneyUtils.bd(225.00)),
            "V", new Entry("Visa Inc.", "Financial Services", MoneyUtils.bd(295.00)),
            "WMT", new Entry("Walmart Inc.", "Consumer Defensive", MoneyUtils.bd(85.00))
    );

    public Entry lookup(String symbol) {
        return find(symbol).orElseGet(() -> new Entry(symbol + " Inc.", UNKNOWN_SECTOR, DEFAULT_BASE_PRICE));
    }

    public Optional<Entry> find(String symbol) {
        return Optional.ofNullable(ENTRIES.get(symbol));
    }

    public record Entry(String name, String sector, BigDecimal basePrice) {
    }
}
