package com.tradecycle.backend.service.decision;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.tradecycle.backend.config.DecisionProperties;
import com.tradecycle.backend.exception.DecisionIntegrityException;
import com.tradecycle.backend.exception.DecisionServiceException;
import com.tradecycle.backend.trading.model.Decision;
import com.tradecycle.backend.trading.model.DecisionAction;
import com.tradecycle.backend.trading.model.MarketSnapshot;
import com.tradecycle.backend.trading.model.PositionSide;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static com.tradecycle.backend.util.TestSnapshots.defaultLimits;
import static com.tradecycle.backend.util.TestSnapshots.failedInstrument;
import static com.tradecycle.backend.util.TestSnapshots.instrument;
import static com.tradecycle.backend.util.TestSnapshots.position;
import static com.tradecycle.backend.util.TestSnapshots.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpDecisionServiceTest {

    private static final String PATH = "/v1/decisions";

    private final WireMockServer wireMock = new WireMockServer(options().dynamicPort());
    private HttpDecisionService service;
    private DecisionRequest request;

    @BeforeEach
    void setUp() {
        wireMock.start();
        DecisionProperties properties = new DecisionProperties();
        properties.setEndpoint("http://localhost:" + wireMock.port() + PATH);
        properties.setApiKey("decision-key");
        service = new HttpDecisionService(new RestTemplate(), properties, new DecisionSchemaValidator(),
                new ObjectMapper().findAndRegisterModules());

        MarketSnapshot snapshot = snapshot("5000",
                List.of(instrument("BTC", "50000"), failedInstrument("ETH")),
                List.of(position("BTC", PositionSide.LONG, "0.01")));
        request = new DecisionRequest("cycle-1", snapshot, defaultLimits().summary(), "stay flat until funding normalizes");
    }

    @AfterEach
    void tearDown() {
        wireMock.stop();
    }

    @Test
    void postsSnapshotAndParsesDecision() {
        wireMock.stubFor(post(urlEqualTo(PATH)).willReturn(okJson("""
                {
                  "items": [
                    {"instrument": "btc", "action": "close", "confidence": 0.8, "rationale": "momentum faded"},
                    {"instrument": "SOL", "action": "open_short", "quantity": "2.5", "leverage": 3,
                     "stop_loss": 160, "take_profit": 140, "confidence": 0.75}
                  ],
                  "rationale": "rotate out of BTC",
                  "strategy_for_next_cycle": "watch SOL breakdown"
                }
                """)));

        Decision decision = service.propose(request);

        assertThat(decision.items()).hasSize(2);
        assertThat(decision.items().get(0).instrument()).isEqualTo("BTC");
        assertThat(decision.items().get(0).action()).isEqualTo(DecisionAction.CLOSE);
        assertThat(decision.items().get(1).quantity()).isEqualByComparingTo("2.5");
        assertThat(decision.items().get(1).leverage()).isEqualTo(3);
        assertThat(decision.items().get(1).stopLoss()).isEqualByComparingTo("160");
        assertThat(decision.strategyForNextCycle()).isEqualTo("watch SOL breakdown");

        wireMock.verify(postRequestedFor(urlEqualTo(PATH))
                .withHeader("Authorization", equalTo("Bearer decision-key"))
                .withRequestBody(matchingJsonPath("$.cycle_id", equalTo("cycle-1")))
                .withRequestBody(matchingJsonPath("$.account.wallet_balance", equalTo("5000")))
                .withRequestBody(matchingJsonPath("$.instruments[0].indicators.rsi_14"))
                .withRequestBody(matchingJsonPath("$.instruments[1].status", equalTo("FAILED")))
                .withRequestBody(matchingJsonPath("$.instruments[1].reason", equalTo("timeout")))
                .withRequestBody(matchingJsonPath("$.positions[0].has_stop_loss", equalTo("false")))
                .withRequestBody(matchingJsonPath("$.risk_limits.max_leverage", equalTo("10")))
                .withRequestBody(matchingJsonPath("$.previous_strategy", equalTo("stay flat until funding normalizes"))));
    }

    @Test
    void emptyItemsIsAValidDecision() {
        wireMock.stubFor(post(urlEqualTo(PATH)).willReturn(okJson("{\"items\": [], \"rationale\": \"no edge\"}")));

        Decision decision = service.propose(request);

        assertThat(decision.items()).isEmpty();
        assertThat(decision.rationale()).isEqualTo("no edge");
    }

    @Test
    void serverErrorBecomesServiceException() {
        wireMock.stubFor(post(urlEqualTo(PATH)).willReturn(aResponse().withStatus(502)));

        assertThatThrownBy(() -> service.propose(request))
                .isInstanceOf(DecisionServiceException.class)
                .hasMessageContaining("502");
    }

    @Test
    void nonJsonReplyIsMalformed() {
        wireMock.stubFor(post(urlEqualTo(PATH)).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "application/json")
                .withBody("I think you should buy")));

        assertThatThrownBy(() -> service.propose(request)).isInstanceOf(DecisionIntegrityException.class);
    }

    @Test
    void replyWithoutItemsIsMalformed() {
        wireMock.stubFor(post(urlEqualTo(PATH)).willReturn(okJson("{\"rationale\": \"forgot the items\"}")));

        assertThatThrownBy(() -> service.propose(request))
                .isInstanceOf(DecisionIntegrityException.class)
                .hasMessageContaining("items");
    }

    @Test
    void unknownActionIsMalformed() {
        wireMock.stubFor(post(urlEqualTo(PATH)).willReturn(okJson(
                "{\"items\": [{\"instrument\": \"BTC\", \"action\": \"moon\", \"confidence\": 0.9}]}")));

        assertThatThrownBy(() -> service.propose(request))
                .isInstanceOf(DecisionIntegrityException.class)
                .hasMessageContaining("moon");
    }
}
