package com.portfolio.backend.service.marketdata;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.portfolio.backend.config.MarketDataHttpConfig;
import com.portfolio.backend.config.MarketDataProperties;
import com.portfolio.backend.exception.MarketDataException;
import com.portfolio.backend.exception.MarketDataRateLimitException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YahooMarketDataClientTest {

    private static final LocalDate FROM = LocalDate.of(2024, 3, 8);
    private static final LocalDate TO = LocalDate.of(2024, 3, 15);

    private static final String CHART = """
            {"chart":{"result":[{
              "meta":{"symbol":"AAPL","longName":"Apple Inc.","shortName":"Apple","gmtoffset":-14400},
              "timestamp":[1710336600,1710423000,1710509400],
              "indicators":{"quote":[{
                "open":[171.06,null,171.0],
                "high":[173.19,null,172.62],
                "low":[170.76,null,170.29],
                "close":[171.13,null,172.62],
                "volume":[51948900,null,121664700]
              }]}
            }],"error":null}}
            """;

    private static final WireMockServer wireMock = new WireMockServer(0);

    private YahooMarketDataClient client;

    @BeforeAll
    static void startWireMock() {
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() {
        wireMock.stop();
    }

    @BeforeEach
    void setUp() {
        wireMock.resetAll();
        MarketDataProperties properties = new MarketDataProperties();
        properties.setBaseUrl("http://localhost:" + wireMock.port());
        properties.setReadTimeout(Duration.ofSeconds(2));
        client = new YahooMarketDataClient(
                new MarketDataHttpConfig().marketDataRestTemplate(properties),
                properties,
                new ObjectMapper());
    }

    @Test
    void parsesDailyBarsAndProfile() {
        wireMock.stubFor(get(urlPathEqualTo("/v8/finance/chart/AAPL"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Type", "application/json").withBody(CHART)));

        MarketHistory history = client.fetchHistory("AAPL", FROM, TO);

        assertThat(history.profile().name()).isEqualTo("Apple Inc.");
        assertThat(history.profile().sector()).isNull();
        assertThat(history.bars()).extracting(DailyBar::date)
                .containsExactly(LocalDate.of(2024, 3, 13), LocalDate.of(2024, 3, 15));
        DailyBar first = history.bars().get(0);
        assertThat(first.close()).isEqualByComparingTo("171.13");
        assertThat(first.open()).isEqualByComparingTo("171.06");
        assertThat(first.volume()).isEqualTo(51_948_900L);

        wireMock.verify(getRequestedFor(urlPathEqualTo("/v8/finance/chart/AAPL"))
                .withQueryParam("period1", equalTo("1709856000"))
                .withQueryParam("period2", equalTo("1710547200"))
                .withQueryParam("interval", equalTo("1d")));
    }

    @Test
    void http429IsRateLimit() {
        wireMock.stubFor(get(urlPathEqualTo("/v8/finance/chart/AAPL"))
                .willReturn(aResponse().withStatus(429).withBody("Too Many Requests")));

        assertThatThrownBy(() -> client.fetchHistory("AAPL", FROM, TO))
                .isInstanceOf(MarketDataRateLimitException.class)
                .satisfies(ex -> assertThat(((MarketDataException) ex).isFallbackEligible()).isTrue());
    }

    @Test
    void tooManyRequestsBodyIsRateLimitEvenWithOkStatus() {
        wireMock.stubFor(get(urlPathEqualTo("/v8/finance/chart/AAPL"))
                .willReturn(aResponse().withStatus(200).withBody("Edge: Too Many Requests")));

        assertThatThrownBy(() -> client.fetchHistory("AAPL", FROM, TO))
                .isInstanceOf(MarketDataRateLimitException.class);
    }

    @Test
    void malformedBodyIsFallbackEligible() {
        wireMock.stubFor(get(urlPathEqualTo("/v8/finance/chart/AAPL"))
                .willReturn(aResponse().withStatus(200).withBody("<html>oops</html>")));

        assertThatThrownBy(() -> client.fetchHistory("AAPL", FROM, TO))
                .isInstanceOf(MarketDataException.class)
                .isNotInstanceOf(MarketDataRateLimitException.class)
                .satisfies(ex -> assertThat(((MarketDataException) ex).isFallbackEligible()).isTrue());
    }

    @Test
    void emptyResultIsFallbackEligible() {
        wireMock.stubFor(get(urlPathEqualTo("/v8/finance/chart/ZZZZ"))
                .willReturn(aResponse().withStatus(200).withBody(
                        "{\"chart\":{\"result\":null,\"error\":{\"code\":\"Not Found\",\"description\":\"No data found\"}}}")));

        assertThatThrownBy(() -> client.fetchHistory("ZZZZ", FROM, TO))
                .isInstanceOf(MarketDataException.class)
                .hasMessageContaining("No data found")
                .satisfies(ex -> assertThat(((MarketDataException) ex).isFallbackEligible()).isTrue());
    }

    @Test
    void serverErrorIsNotFallbackEligible() {
        wireMock.stubFor(get(urlPathEqualTo("/v8/finance/chart/AAPL"))
                .willReturn(aResponse().withStatus(503).withBody("unavailable")));

        assertThatThrownBy(() -> client.fetchHistory("AAPL", FROM, TO))
                .isInstanceOf(MarketDataException.class)
                .satisfies(ex -> {
                    MarketDataException error = (MarketDataException) ex;
                    assertThat(error.isFallbackEligible()).isFalse();
                    assertThat(error.getStatusCode()).isEqualTo(503);
                });
    }
}
