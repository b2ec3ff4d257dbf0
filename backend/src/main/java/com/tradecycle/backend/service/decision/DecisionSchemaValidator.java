package com.tradecycle.backend.service.decision;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradecycle.backend.exception.DecisionIntegrityException;
import com.tradecycle.backend.trading.model.Decision;
import com.tradecycle.backend.trading.model.DecisionAction;
import com.tradecycle.backend.trading.model.DecisionItem;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Boundary check for decision payloads. Anything that does not fit the schema is rejected
 * as a whole; partial decisions are never executed.
 */
@Component
public class DecisionSchemaValidator {

    public Decision parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new DecisionIntegrityException("Decision payload must be a JSON object");
        }
        JsonNode items = root.get("items");
        if (items == null || !items.isArray()) {
            throw new DecisionIntegrityException("Decision payload has no items array");
        }
        List<DecisionItem> parsed = new ArrayList<>();
        int index = 0;
        for (JsonNode node : items) {
            parsed.add(parseItem(node, index++));
        }
        return new Decision(parsed, optionalText(root, "rationale"), optionalText(root, "strategy_for_next_cycle"));
    }

    public Decision validate(Decision decision) {
        if (decision == null) {
            throw new DecisionIntegrityException("Decision is missing");
        }
        Set<String> seen = new HashSet<>();
        for (DecisionItem item : decision.items()) {
            String where = "item " + item.instrument();
            if (item.instrument() == null || item.instrument().isBlank()) {
                throw new DecisionIntegrityException("Decision item without instrument");
            }
            if (item.action() == null) {
                throw new DecisionIntegrityException(where + " has no action");
            }
            if (Double.isNaN(item.confidence()) || item.confidence() < 0.0 || item.confidence() > 1.0) {
                throw new DecisionIntegrityException(where + " confidence out of range: " + item.confidence());
            }
            if (item.quantity() != null && item.quantity().signum() < 0) {
                throw new DecisionIntegrityException(where + " has negative quantity");
            }
            if (item.stopLoss() != null && item.stopLoss().signum() <= 0) {
                throw new DecisionIntegrityException(where + " has non-positive stop_loss");
            }
            if (item.takeProfit() != null && item.takeProfit().signum() <= 0) {
                throw new DecisionIntegrityException(where + " has non-positive take_profit");
            }
            if (!seen.add(item.instrument().toUpperCase(Locale.ROOT) + ":" + item.action())) {
                throw new DecisionIntegrityException(where + " repeats action " + item.action());
            }
        }
        return decision;
    }

    private DecisionItem parseItem(JsonNode node, int index) {
        if (node == null || !node.isObject()) {
            throw new DecisionIntegrityException("Decision item " + index + " is not an object");
        }
        String instrument = optionalText(node, "instrument");
        if (instrument == null || instrument.isBlank()) {
            throw new DecisionIntegrityException("Decision item " + index + " has no instrument");
        }
        DecisionAction action;
        try {
            action = DecisionAction.fromWire(optionalText(node, "action"));
        } catch (IllegalArgumentException e) {
            throw new DecisionIntegrityException("Decision item " + index + ": " + e.getMessage(), e);
        }
        JsonNode confidence = node.get("confidence");
        if (confidence == null || !confidence.isNumber()) {
            throw new DecisionIntegrityException("Decision item " + index + " has no numeric confidence");
        }
        Integer leverage = null;
        JsonNode leverageNode = node.get("leverage");
        if (leverageNode != null && !leverageNode.isNull()) {
            boolean integral = leverageNode.isIntegralNumber() && leverageNode.canConvertToInt();
            if (!integral && !leverageNode.isTextual()) {
                throw new DecisionIntegrityException("Decision item " + index + " leverage is not an integer");
            }
            leverage = leverageNode.isTextual() ? parseInt(leverageNode.asText(), index) : leverageNode.asInt();
        }
        return DecisionItem.builder()
                .instrument(instrument.trim().toUpperCase(Locale.ROOT))
                .action(action)
                .quantity(decimal(node, "quantity", index))
                .leverage(leverage)
                .stopLoss(decimal(node, "stop_loss", index))
                .takeProfit(decimal(node, "take_profit", index))
                .confidence(confidence.asDouble())
                .rationale(optionalText(node, "rationale"))
                .build();
    }

    private static BigDecimal decimal(JsonNode parent, String field, int index) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new DecisionIntegrityException("Decision item " + index + " " + field + " is not numeric", e);
            }
        }
        throw new DecisionIntegrityException("Decision item " + index + " " + field + " is not numeric");
    }

    private static Integer parseInt(String value, int index) {
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new DecisionIntegrityException("Decision item " + index + " leverage is not an integer", e);
        }
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }
}
