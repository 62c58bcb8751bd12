package com.portfolio.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "portfolio.ingestion")
@Data
public class IngestionProperties {

    private List<String> tickers = new ArrayList<>(List.of("AAPL", "GOOGL", "MSFT", "TSLA", "NVDA"));

    /** Start every run in synthetic mode instead of calling the provider. */
    private boolean useSyntheticData = false;

    private boolean runOnStartup = true;

    private int windowDays = 30;

    /** Delay between consecutive symbol starts. */
    private Duration stagger = Duration.ofMillis(500);

    /** Upper bound on how long a run waits for any one symbol. */
    private Duration runTimeout = Duration.ofMinutes(15);

    private Schedule schedule = new Schedule();

    public List<String> normalizedTickers() {
        return tickers.stream()
                .filter(symbol -> symbol != null && !symbol.isBlank())
                .map(symbol -> symbol.trim().toUpperCase())
                .distinct()
                .toList();
    }

    @Data
    public static class Schedule {
        private boolean enabled = false;
        private String cron = "0 0 */6 * * *";
    }
}
