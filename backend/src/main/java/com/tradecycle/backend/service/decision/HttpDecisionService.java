package com.tradecycle.backend.service.decision;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tradecycle.backend.config.DecisionProperties;
import com.tradecycle.backend.exception.DecisionIntegrityException;
import com.tradecycle.backend.exception.DecisionServiceException;
import com.tradecycle.backend.trading.model.AccountState;
import com.tradecycle.backend.trading.model.Decision;
import com.tradecycle.backend.trading.model.InstrumentSnapshot;
import com.tradecycle.backend.trading.model.MarketSnapshot;
import com.tradecycle.backend.trading.model.OrderRecord;
import com.tradecycle.backend.trading.model.PositionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;

/**
 * Posts the snapshot to the external reasoning service and validates the reply.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HttpDecisionService implements DecisionService {

    @Qualifier("decisionRestTemplate")
    private final RestTemplate decisionRestTemplate;
    private final DecisionProperties decisionProperties;
    private final DecisionSchemaValidator schemaValidator;
    private final ObjectMapper objectMapper;

    @Override
    public Decision propose(DecisionRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        String apiKey = decisionProperties.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(toPayload(request));
        } catch (JsonProcessingException e) {
            throw new DecisionServiceException("Unable to serialize decision request", e);
        }

        String response;
        try {
            ResponseEntity<String> entity = decisionRestTemplate.exchange(
                    URI.create(decisionProperties.getEndpoint()), HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
            response = entity.getBody();
        } catch (HttpStatusCodeException e) {
            throw new DecisionServiceException("Decision service returned HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new DecisionServiceException("Decision service unreachable: " + e.getMessage(), e);
        }

        if (response == null || response.isBlank()) {
            throw new DecisionIntegrityException("Decision service returned an empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new DecisionIntegrityException("Decision service returned invalid JSON", e);
        }
        Decision decision = schemaValidator.validate(schemaValidator.parse(root));
        log.info("Decision received cycleId={} items={}", request.cycleId(), decision.items().size());
        return decision;
    }

    ObjectNode toPayload(DecisionRequest request) {
        MarketSnapshot snapshot = request.snapshot();
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("cycle_id", request.cycleId());
        payload.put("timestamp", snapshot.timestamp() == null ? null : snapshot.timestamp().toString());

        AccountState account = snapshot.account();
        ObjectNode accountNode = payload.putObject("account");
        if (account != null) {
            accountNode.put("wallet_balance", account.walletBalance());
            accountNode.put("available_balance", account.availableBalance());
            accountNode.put("margin_used", account.marginUsed());
            accountNode.put("unrealized_pnl", account.unrealizedPnl());
            accountNode.put("realized_daily_pnl", account.realizedDailyPnl());
            accountNode.put("winning_trades", account.winningTrades());
            accountNode.put("losing_trades", account.losingTrades());
            accountNode.put("win_rate_pct", account.winRatePct());
        }

        ArrayNode instruments = payload.putArray("instruments");
        for (InstrumentSnapshot instrument : snapshot.instruments()) {
            ObjectNode node = instruments.addObject();
            node.put("instrument", instrument.instrument());
            node.put("status", instrument.status().state().name());
            if (instrument.status().succeeded()) {
                node.put("price", instrument.price());
                ObjectNode indicators = node.putObject("indicators");
                instrument.indicators().forEach(indicators::put);
            } else {
                node.put("reason", instrument.status().reason());
            }
        }

        ArrayNode positions = payload.putArray("positions");
        for (PositionRecord position : snapshot.positions()) {
            ObjectNode node = positions.addObject();
            node.put("instrument", position.instrument());
            node.put("side", position.side().name());
            node.put("quantity", position.quantity());
            node.put("entry_price", position.entryPrice());
            node.put("mark_price", position.markPrice());
            node.put("leverage", position.leverage());
            node.put("unrealized_pnl", position.unrealizedPnl());
            node.put("has_stop_loss", !position.stopLossOrderIds().isEmpty());
            node.put("has_take_profit", !position.takeProfitOrderIds().isEmpty());
            node.put("tradable", position.tradable());
        }

        ArrayNode orders = payload.putArray("open_orders");
        for (OrderRecord order : snapshot.openOrders()) {
            ObjectNode node = orders.addObject();
            node.put("order_id", order.orderId());
            node.put("instrument", order.instrument());
            node.put("side", order.side() == null ? null : order.side().name());
            node.put("type", order.type() == null ? null : order.type().name());
            node.put("quantity", order.quantity());
            node.put("stop_price", order.stopPrice());
            node.put("reduce_only", order.reduceOnly());
        }

        payload.set("risk_limits", objectMapper.valueToTree(request.riskLimits()));
        payload.put("previous_strategy", request.previousStrategy());
        return payload;
    }
}
