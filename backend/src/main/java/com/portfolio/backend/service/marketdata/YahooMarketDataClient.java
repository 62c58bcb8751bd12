package com.portfolio.backend.service.marketdata;

import com.portfolio.backend.config.MarketDataProperties;
import com.portfolio.backend.exception.MarketDataException;
import com.portfolio.backend.exception.MarketDataRateLimitException;
import com.portfolio.backend.util.MoneyUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Daily history from the Yahoo Finance chart endpoint.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class YahooMarketDataClient implements MarketDataClient {

    private static final String CHART_PATH = "/v8/finance/chart/{symbol}";

    private final RestTemplate marketDataRestTemplate;
    private final MarketDataProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public MarketHistory fetchHistory(String symbol, LocalDate from, LocalDate to) {
        String url = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .path(CHART_PATH)
                .queryParam("period1", from.atStartOfDay(ZoneOffset.UTC).toEpochSecond())
                .queryParam("period2", to.plusDays(1).atStartOfDay(ZoneOffset.UTC).toEpochSecond())
                .queryParam("interval", "1d")
                .buildAndExpand(symbol)
                .toUriString();
        String body = get(url, symbol);
        return parse(symbol, body, from, to);
    }

    private String get(String url, String symbol) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.USER_AGENT, properties.getUserAgent());
        try {
            ResponseEntity<String> response = marketDataRestTemplate.exchange(
                    url, HttpMethod.GET, new HttpEntity<>(headers), String.class);
            return response.getBody();
        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Market data rate limit 429 for {}", symbol);
            throw new MarketDataRateLimitException("Too Many Requests for " + symbol, e);
        } catch (HttpClientErrorException e) {
            if (mentionsTooManyRequests(e.getResponseBodyAsString())) {
                throw new MarketDataRateLimitException("Too Many Requests for " + symbol, e);
            }
            throw new MarketDataException("Market data error (" + e.getStatusCode().value() + ") for " + symbol,
                    e.getStatusCode().value(), false, e);
        } catch (HttpServerErrorException e) {
            throw new MarketDataException("Market data server error (" + e.getStatusCode().value() + ") for " + symbol,
                    e.getStatusCode().value(), false, e);
        } catch (ResourceAccessException e) {
            throw new MarketDataException("Market data network error for " + symbol + ": " + e.getMessage(), e);
        }
    }

    MarketHistory parse(String symbol, String body, LocalDate from, LocalDate to) {
        if (body == null || body.isBlank()) {
            throw MarketDataException.unusableResponse("Empty response for " + symbol, null);
        }
        if (mentionsTooManyRequests(body)) {
            throw new MarketDataRateLimitException("Too Many Requests for " + symbol);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw MarketDataException.unusableResponse("Malformed response for " + symbol, e);
        }
        JsonNode result = root.path("chart").path("result");
        if (!result.isArray() || result.isEmpty()) {
            String description = root.path("chart").path("error").path("description").asText("no result");
            throw MarketDataException.unusableResponse("No chart data for " + symbol + ": " + description, null);
        }
        JsonNode chart = result.get(0);
        JsonNode meta = chart.path("meta");
        ZoneOffset offset = ZoneOffset.ofTotalSeconds(meta.path("gmtoffset").asInt(0));

        JsonNode timestamps = chart.path("timestamp");
        JsonNode quote = chart.path("indicators").path("quote").path(0);
        List<DailyBar> bars = new ArrayList<>();
        for (int i = 0; i < timestamps.size(); i++) {
            JsonNode close = quote.path("close").path(i);
            if (close.isMissingNode() || close.isNull()) {
                continue;
            }
            LocalDate date = Instant.ofEpochSecond(timestamps.get(i).asLong())
                    .atOffset(offset)
                    .toLocalDate();
            if (date.isBefore(from) || date.isAfter(to)) {
                continue;
            }
            bars.add(new DailyBar(
                    date,
                    decimal(quote.path("open").path(i)),
                    decimal(quote.path("high").path(i)),
                    decimal(quote.path("low").path(i)),
                    MoneyUtils.bd(close.asDouble()),
                    quote.path("volume").path(i).asLong(0L)
            ));
        }
        if (bars.isEmpty()) {
            throw MarketDataException.unusableResponse("No historical data available for " + symbol, null);
        }
        TickerProfile profile = new TickerProfile(
                textOrNull(meta, "longName", "shortName"),
                textOrNull(meta, "sector")
        );
        log.debug("Fetched {} bars for {}", bars.size(), symbol);
        return new MarketHistory(symbol, profile, bars);
    }

    private BigDecimal decimal(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return MoneyUtils.bd(node.asDouble());
    }

    private String textOrNull(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = node.path(field).asText(null);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private boolean mentionsTooManyRequests(String body) {
        return body != null && body.toLowerCase(Locale.ROOT).contains("too many requests");
    }
}
