package com.portfolio.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "portfolio.market-data")
@Data
public class MarketDataProperties {
    private String baseUrl = "https://query1.finance.yahoo.com";
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(10);
    private String userAgent = "Mozilla/5.0 (compatible; portfolio-backend/1.0)";
}
