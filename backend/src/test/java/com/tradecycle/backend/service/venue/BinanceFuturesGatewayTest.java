package com.tradecycle.backend.service.venue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.tradecycle.backend.config.VenueProperties;
import com.tradecycle.backend.config.VenueResilienceConfig;
import com.tradecycle.backend.exception.VenueException;
import com.tradecycle.backend.service.MetricsService;
import com.tradecycle.backend.trading.model.OrderRecord;
import com.tradecycle.backend.trading.model.OrderSide;
import com.tradecycle.backend.trading.model.OrderStatus;
import com.tradecycle.backend.trading.model.OrderType;
import com.tradecycle.backend.trading.model.PositionRecord;
import com.tradecycle.backend.trading.model.PositionSide;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.matching;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class BinanceFuturesGatewayTest {

    private static final Instant NOW = Instant.parse("2026-03-10T15:30:00Z");

    private final WireMockServer wireMock = new WireMockServer(options().dynamicPort());
    private MetricsService metricsService;
    private BinanceFuturesGateway gateway;

    @BeforeEach
    void setUp() {
        wireMock.start();
        VenueProperties properties = new VenueProperties();
        properties.setBaseUrl("http://localhost:" + wireMock.port());
        properties.setApiKey("test-key");
        properties.setApiSecret("test-secret");
        properties.setKlineLimit(50);

        metricsService = mock(MetricsService.class);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        VenueHttpClient httpClient = new VenueHttpClient(new RestTemplate(),
                new VenueResilienceConfig().venueRateLimiter(100, 1000),
                new BinanceRequestSigner(properties), properties, metricsService, new ObjectMapper(), clock);
        gateway = new BinanceFuturesGateway(httpClient, properties, clock);
    }

    @AfterEach
    void tearDown() {
        wireMock.stop();
    }

    @Test
    void readsBalanceWithSignedRequest() {
        wireMock.stubFor(get(urlPathEqualTo("/fapi/v2/account")).willReturn(okJson("""
                {"totalWalletBalance": "1523.40", "availableBalance": "1200.10",
                 "totalInitialMargin": "300.00", "totalUnrealizedProfit": "-12.5"}
                """)));

        VenueBalance balance = gateway.getBalance();

        assertThat(balance.walletBalance()).isEqualByComparingTo("1523.40");
        assertThat(balance.availableBalance()).isEqualByComparingTo("1200.10");
        assertThat(balance.unrealizedPnl()).isEqualByComparingTo("-12.5");
        wireMock.verify(getRequestedFor(urlPathEqualTo("/fapi/v2/account"))
                .withHeader("X-MBX-APIKEY", equalTo("test-key"))
                .withQueryParam("timestamp", equalTo(String.valueOf(NOW.toEpochMilli())))
                .withQueryParam("recvWindow", equalTo("5000"))
                .withQueryParam("signature", matching("[0-9a-f]{64}")));
    }

    @Test
    void countsTodaysRealizedPnlEntries() {
        wireMock.stubFor(get(urlPathEqualTo("/fapi/v1/income")).willReturn(okJson("""
                [{"income": "12.5"}, {"income": "-4.0"}, {"income": "0"}, {"income": "3.1"}]
                """)));

        DailyPerformance performance = gateway.getDailyPerformance();

        assertThat(performance.realizedPnl()).isEqualByComparingTo("11.6");
        assertThat(performance.winningTrades()).isEqualTo(2);
        assertThat(performance.losingTrades()).isEqualTo(2);
        wireMock.verify(getRequestedFor(urlPathEqualTo("/fapi/v1/income"))
                .withQueryParam("incomeType", equalTo("REALIZED_PNL"))
                .withQueryParam("startTime", equalTo(String.valueOf(Instant.parse("2026-03-10T00:00:00Z").toEpochMilli()))));
    }

    @Test
    void mapsPositionsAndSkipsFlatOnes() {
        wireMock.stubFor(get(urlPathEqualTo("/fapi/v2/positionRisk")).willReturn(okJson("""
                [
                  {"symbol": "BTCUSDT", "positionAmt": "0.010", "entryPrice": "50000", "markPrice": "50500",
                   "leverage": "5", "unRealizedProfit": "5"},
                  {"symbol": "ETHUSDT", "positionAmt": "-0.5", "entryPrice": "3000", "markPrice": "2950",
                   "leverage": "3", "unRealizedProfit": "25"},
                  {"symbol": "BNBUSDT", "positionAmt": "0", "entryPrice": "0", "markPrice": "600",
                   "leverage": "10", "unRealizedProfit": "0"}
                ]
                """)));

        List<PositionRecord> positions = gateway.getPositions();

        assertThat(positions).extracting(PositionRecord::instrument).containsExactly("BTC", "ETH");
        assertThat(positions.get(1).side()).isEqualTo(PositionSide.SHORT);
        assertThat(positions.get(1).quantity()).isEqualByComparingTo("0.5");
        assertThat(positions.get(0).leverage()).isEqualTo(5);
    }

    @Test
    void loadsIndicatorFeedAndToleratesMissingOpenInterest() {
        wireMock.stubFor(get(urlPathEqualTo("/fapi/v1/ticker/price"))
                .willReturn(okJson("{\"symbol\": \"BTCUSDT\", \"price\": \"50123.5\"}")));
        wireMock.stubFor(get(urlPathEqualTo("/fapi/v1/klines"))
                .withQueryParam("interval", equalTo("1h"))
                .willReturn(okJson(klines(3))));
        wireMock.stubFor(get(urlPathEqualTo("/fapi/v1/klines"))
                .withQueryParam("interval", equalTo("1d"))
                .willReturn(okJson(klines(2))));
        wireMock.stubFor(get(urlPathEqualTo("/futures/data/openInterestHist"))
                .willReturn(aResponse().withStatus(503)));
        wireMock.stubFor(get(urlPathEqualTo("/fapi/v1/fundingRate"))
                .willReturn(okJson("[{\"symbol\": \"BTCUSDT\", \"fundingRate\": \"0.0001\"}]")));

        IndicatorFeed feed = gateway.getIndicators("BTC");

        assertThat(feed.price()).isEqualByComparingTo("50123.5");
        assertThat(feed.hourlyCandles()).hasSize(3);
        assertThat(feed.dailyCandles()).hasSize(2);
        assertThat(feed.hourlyCandles().get(2).getClose()).isEqualTo(102.0);
        assertThat(feed.openInterestLatest()).isNull();
        assertThat(feed.openInterestAverage()).isNull();
        assertThat(feed.fundingRatePct()).isCloseTo(0.01, within(1e-9));
        wireMock.verify(getRequestedFor(urlPathEqualTo("/fapi/v1/ticker/price"))
                .withQueryParam("symbol", equalTo("BTCUSDT"))
                .withHeader("X-MBX-APIKEY", absent()));
    }

    @Test
    void placesProtectiveOrderAgainstMarkPrice() {
        wireMock.stubFor(post(urlPathEqualTo("/fapi/v1/order")).willReturn(okJson("""
                {"orderId": 8812, "clientOrderId": "tcabc-BTC-SL1", "symbol": "BTCUSDT", "side": "SELL",
                 "type": "STOP_MARKET", "origQty": "0.010", "executedQty": "0", "stopPrice": "49000",
                 "reduceOnly": true, "status": "NEW"}
                """)));

        OrderRecord order = gateway.placeOrder(OrderRequest.builder()
                .instrument("BTC")
                .side(OrderSide.SELL)
                .type(OrderType.STOP_MARKET)
                .quantity(new BigDecimal("0.010"))
                .stopPrice(new BigDecimal("49000.00"))
                .reduceOnly(true)
                .clientOrderId("tcabc-BTC-SL1")
                .build());

        assertThat(order.orderId()).isEqualTo("8812");
        assertThat(order.type()).isEqualTo(OrderType.STOP_MARKET);
        assertThat(order.status()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.reduceOnly()).isTrue();
        wireMock.verify(postRequestedFor(urlPathEqualTo("/fapi/v1/order"))
                .withQueryParam("symbol", equalTo("BTCUSDT"))
                .withQueryParam("quantity", equalTo("0.01"))
                .withQueryParam("stopPrice", equalTo("49000"))
                .withQueryParam("workingType", equalTo("MARK_PRICE"))
                .withQueryParam("reduceOnly", equalTo("true"))
                .withQueryParam("newClientOrderId", equalTo("tcabc-BTC-SL1")));
    }

    @Test
    void duplicateClientOrderIdReturnsTheOrderAlreadyAccepted() {
        wireMock.stubFor(post(urlPathEqualTo("/fapi/v1/order")).willReturn(aResponse()
                .withStatus(400)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"code\": -4116, \"msg\": \"ClientOrderId is duplicated.\"}")));
        wireMock.stubFor(get(urlPathEqualTo("/fapi/v1/order")).willReturn(okJson("""
                {"orderId": 8812, "clientOrderId": "tcabc-BTC-SL", "symbol": "BTCUSDT", "side": "SELL",
                 "type": "STOP_MARKET", "origQty": "0.010", "executedQty": "0", "stopPrice": "49000",
                 "reduceOnly": true, "status": "NEW"}
                """)));

        OrderRecord order = gateway.placeOrder(OrderRequest.builder()
                .instrument("BTC")
                .side(OrderSide.SELL)
                .type(OrderType.STOP_MARKET)
                .quantity(new BigDecimal("0.010"))
                .stopPrice(new BigDecimal("49000"))
                .reduceOnly(true)
                .clientOrderId("tcabc-BTC-SL")
                .build());

        assertThat(order.orderId()).isEqualTo("8812");
        wireMock.verify(getRequestedFor(urlPathEqualTo("/fapi/v1/order"))
                .withQueryParam("symbol", equalTo("BTCUSDT"))
                .withQueryParam("origClientOrderId", equalTo("tcabc-BTC-SL"))
                .withQueryParam("signature", matching("[0-9a-f]{64}")));
    }

    @Test
    void unknownClientOrderIdIsEmpty() {
        wireMock.stubFor(get(urlPathEqualTo("/fapi/v1/order")).willReturn(aResponse()
                .withStatus(400)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"code\": -2013, \"msg\": \"Order does not exist.\"}")));

        assertThat(gateway.findOrder("ETH", "tcabc-ETH-E")).isEmpty();
    }

    @Test
    void orderLookupOutageIsRaised() {
        wireMock.stubFor(get(urlPathEqualTo("/fapi/v1/order")).willReturn(aResponse().withStatus(502)));

        assertThatThrownBy(() -> gateway.findOrder("ETH", "tcabc-ETH-E"))
                .isInstanceOfSatisfying(VenueException.class, e -> assertThat(e.getKind()).isEqualTo(VenueException.Kind.TRANSIENT));
    }

    @Test
    void venueRejectionKeepsErrorCode() {
        wireMock.stubFor(post(urlPathEqualTo("/fapi/v1/order")).willReturn(aResponse()
                .withStatus(400)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"code\": -2019, \"msg\": \"Margin is insufficient.\"}")));

        assertThatThrownBy(() -> gateway.placeOrder(OrderRequest.builder()
                .instrument("BTC").side(OrderSide.BUY).type(OrderType.MARKET).quantity(BigDecimal.ONE).build()))
                .isInstanceOfSatisfying(VenueException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(VenueException.Kind.REJECTED);
                    assertThat(e.getVenueCode()).isEqualTo(-2019);
                    assertThat(e.getMessage()).contains("Margin is insufficient.");
                });
        verify(metricsService, atLeastOnce()).incrementVenueFailures();
    }

    @Test
    void invalidKeyIsAnAuthFailure() {
        wireMock.stubFor(get(urlPathEqualTo("/fapi/v2/account")).willReturn(aResponse()
                .withStatus(400)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"code\": -2015, \"msg\": \"Invalid API-key, IP, or permissions for action.\"}")));

        assertThatThrownBy(() -> gateway.getBalance())
                .isInstanceOfSatisfying(VenueException.class, e -> assertThat(e.getKind()).isEqualTo(VenueException.Kind.AUTH));
    }

    @Test
    void serverErrorIsTransient() {
        wireMock.stubFor(get(urlPathEqualTo("/fapi/v1/openOrders")).willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> gateway.getOpenOrders())
                .isInstanceOfSatisfying(VenueException.class, e -> assertThat(e.isRetryable()).isTrue());
    }

    @Test
    void malformedPayloadIsUnknown() {
        wireMock.stubFor(get(urlPathEqualTo("/fapi/v1/openOrders")).willReturn(okJson("{\"not\": \"an array\"}")));

        assertThatThrownBy(() -> gateway.getOpenOrders())
                .isInstanceOfSatisfying(VenueException.class, e -> assertThat(e.getKind()).isEqualTo(VenueException.Kind.UNKNOWN));
    }

    private static String klines(int count) {
        StringBuilder json = new StringBuilder("[");
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                json.append(',');
            }
            long openTime = NOW.toEpochMilli() - (count - i) * 3_600_000L;
            double close = 100.0 + i;
            json.append("[%d,\"%s\",\"%s\",\"%s\",\"%s\",\"1000\",0,\"0\",0,\"0\",\"0\",\"0\"]"
                    .formatted(openTime, close - 1, close + 1, close - 2, close));
        }
        return json.append(']').toString();
    }
}
