package com.tradecycle.backend.trading.pipeline;

import com.tradecycle.backend.trading.model.Decision;
import com.tradecycle.backend.trading.model.DecisionAction;
import com.tradecycle.backend.trading.model.DecisionItem;
import com.tradecycle.backend.trading.model.InstrumentSnapshot;
import com.tradecycle.backend.trading.model.MarketSnapshot;
import com.tradecycle.backend.trading.model.PositionRecord;
import com.tradecycle.backend.trading.model.RiskLimits;
import com.tradecycle.backend.trading.model.RiskVerdict;
import com.tradecycle.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Stateless risk checks against a per-cycle {@link RiskLimits} copy.
 */
@Slf4j
@Service
public class DefaultRiskGate implements RiskGate {

    public static final String LOW_CONFIDENCE = "low_confidence";
    public static final String MISSING_PROTECTIVE_ORDERS = "missing_protective_orders";
    public static final String INSTRUMENT_UNAVAILABLE = "instrument_unavailable";
    public static final String POSITION_ALREADY_OPEN = "position_already_open";
    public static final String MAX_OPEN_POSITIONS = "max_open_positions";
    public static final String INVALID_QUANTITY = "invalid_quantity";
    public static final String INVALID_PROTECTIVE_LEVELS = "invalid_protective_levels";
    public static final String BELOW_MIN_NOTIONAL = "below_min_notional";
    public static final String RISK_PER_TRADE_EXCEEDED = "risk_per_trade_exceeded";
    public static final String NO_OPEN_POSITION = "no_open_position";
    public static final String SIZE_CLAMPED = "size_clamped";
    public static final String LEVERAGE_CLAMPED = "leverage_clamped";

    @Override
    public List<RiskVerdict> evaluate(Decision decision, MarketSnapshot snapshot, RiskLimits limits) {
        List<RiskVerdict> verdicts = new ArrayList<>();
        Set<String> approvedOpens = new HashSet<>();
        for (DecisionItem item : decision.items()) {
            RiskVerdict verdict = switch (item.action()) {
                case OPEN_LONG, OPEN_SHORT -> evaluateOpen(item, snapshot, limits, approvedOpens);
                case CLOSE -> evaluateClose(item, snapshot, limits);
                case HOLD -> RiskVerdict.approved(item);
            };
            if (verdict.outcome() == RiskVerdict.Outcome.REJECTED) {
                log.info("Risk gate rejected instrument={} action={} reason={}", item.instrument(), item.action(), verdict.reason());
            } else if (verdict.outcome() == RiskVerdict.Outcome.CLAMPED) {
                log.info("Risk gate clamped instrument={} action={} fields={}", item.instrument(), item.action(), verdict.adjustedFields());
            }
            verdicts.add(verdict);
        }
        return verdicts;
    }

    private RiskVerdict evaluateOpen(DecisionItem item, MarketSnapshot snapshot, RiskLimits limits, Set<String> approvedOpens) {
        if (item.confidence() < limits.minConfidence()) {
            return RiskVerdict.rejected(item, LOW_CONFIDENCE);
        }
        if (item.stopLoss() == null || item.takeProfit() == null) {
            return RiskVerdict.rejected(item, MISSING_PROTECTIVE_ORDERS);
        }
        Optional<InstrumentSnapshot> instrument = snapshot.instrument(item.instrument());
        if (instrument.isEmpty() || !instrument.get().usable()) {
            return RiskVerdict.rejected(item, INSTRUMENT_UNAVAILABLE);
        }
        String key = item.instrument().toUpperCase(Locale.ROOT);
        if (snapshot.position(item.instrument()).isPresent() || approvedOpens.contains(key)) {
            return RiskVerdict.rejected(item, POSITION_ALREADY_OPEN);
        }
        if (snapshot.openPositionCount() + approvedOpens.size() >= limits.maxOpenPositions()) {
            return RiskVerdict.rejected(item, MAX_OPEN_POSITIONS);
        }

        BigDecimal price = instrument.get().price();
        if (!MoneyUtils.isPositive(item.quantity())) {
            return RiskVerdict.rejected(item, INVALID_QUANTITY);
        }
        if (!protectiveLevelsValid(item, price)) {
            return RiskVerdict.rejected(item, INVALID_PROTECTIVE_LEVELS);
        }

        BigDecimal quantity = item.quantity();
        BigDecimal adjustedQuantity = null;
        BigDecimal notional = MoneyUtils.notional(quantity, price);
        if (notional.compareTo(limits.maxPositionSizeUsd()) > 0) {
            adjustedQuantity = limits.maxPositionSizeUsd()
                    .divide(price, limits.quantityScale(), RoundingMode.DOWN);
            quantity = adjustedQuantity;
            notional = MoneyUtils.notional(quantity, price);
        }
        if (notional.compareTo(limits.minNotionalUsd()) < 0) {
            return RiskVerdict.rejected(item, BELOW_MIN_NOTIONAL);
        }

        Integer adjustedLeverage = null;
        Integer leverage = item.leverage();
        if (leverage != null && leverage > limits.maxLeverage()) {
            adjustedLeverage = limits.maxLeverage();
        } else if (leverage != null && leverage < 1) {
            adjustedLeverage = 1;
        }

        BigDecimal impliedLoss = quantity.multiply(price.subtract(item.stopLoss()).abs());
        BigDecimal riskBudget = MoneyUtils.percentOf(snapshot.account().availableBalance(), limits.riskPerTradePct());
        if (impliedLoss.compareTo(riskBudget) > 0) {
            return RiskVerdict.rejected(item, RISK_PER_TRADE_EXCEEDED);
        }

        approvedOpens.add(key);
        if (adjustedQuantity == null && adjustedLeverage == null) {
            return RiskVerdict.approved(item);
        }
        return RiskVerdict.clamped(item, clampReason(adjustedQuantity, adjustedLeverage), adjustedQuantity, adjustedLeverage);
    }

    private RiskVerdict evaluateClose(DecisionItem item, MarketSnapshot snapshot, RiskLimits limits) {
        if (item.confidence() < limits.minConfidence()) {
            return RiskVerdict.rejected(item, LOW_CONFIDENCE);
        }
        Optional<PositionRecord> position = snapshot.position(item.instrument());
        if (position.isEmpty()) {
            return RiskVerdict.rejected(item, NO_OPEN_POSITION);
        }
        if (!position.get().tradable() || !snapshot.isTradable(item.instrument())) {
            return RiskVerdict.rejected(item, INSTRUMENT_UNAVAILABLE);
        }
        return RiskVerdict.approved(item);
    }

    private static boolean protectiveLevelsValid(DecisionItem item, BigDecimal price) {
        BigDecimal stop = item.stopLoss();
        BigDecimal target = item.takeProfit();
        if (item.action() == DecisionAction.OPEN_LONG) {
            return stop.compareTo(price) < 0 && target.compareTo(price) > 0;
        }
        return target.compareTo(price) < 0 && stop.compareTo(price) > 0;
    }

    private static String clampReason(BigDecimal adjustedQuantity, Integer adjustedLeverage) {
        if (adjustedQuantity != null && adjustedLeverage != null) {
            return SIZE_CLAMPED + "," + LEVERAGE_CLAMPED;
        }
        return adjustedQuantity != null ? SIZE_CLAMPED : LEVERAGE_CLAMPED;
    }
}
