package com.tradecycle.backend.trading.pipeline;

import com.tradecycle.backend.config.ExecutionProperties;
import com.tradecycle.backend.exception.VenueException;
import com.tradecycle.backend.service.MetricsService;
import com.tradecycle.backend.service.ledger.ExecutionLedger;
import com.tradecycle.backend.service.venue.OrderRequest;
import com.tradecycle.backend.service.venue.VenueGateway;
import com.tradecycle.backend.trading.model.DecisionItem;
import com.tradecycle.backend.trading.model.ExecutionContext;
import com.tradecycle.backend.trading.model.ExecutionResult;
import com.tradecycle.backend.trading.model.OrderRecord;
import com.tradecycle.backend.trading.model.OrderSide;
import com.tradecycle.backend.trading.model.OrderStatus;
import com.tradecycle.backend.trading.model.OrderType;
import com.tradecycle.backend.trading.model.PositionRecord;
import com.tradecycle.backend.trading.model.PositionSide;
import com.tradecycle.backend.trading.model.RiskVerdict;
import com.tradecycle.backend.util.MoneyUtils;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Places entry, stop-loss and take-profit orders for approved items and closes positions.
 * An entry is never reported as a success unless both protective orders are resting on the venue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultTradeExecutor implements TradeExecutor {

    public static final String NOT_APPROVED = "not_approved";
    public static final String VERDICT_MISMATCH = "verdict_mismatch";
    public static final String MISSING_PROTECTIVE_ORDERS = "missing_protective_orders";
    public static final String NO_OPEN_POSITION = "no_open_position";
    public static final String DUPLICATE_IN_PROGRESS = "duplicate_execution_in_progress";
    public static final String UNPROTECTED_CLOSED = "unprotected_position_closed";
    public static final String UNPROTECTED_CLOSE_FAILED = "unprotected_position_close_failed";
    public static final String ENTRY_NOT_PLACED = "entry_not_placed";

    private static final int MAX_CLIENT_ORDER_ID_LENGTH = 36;

    private final VenueGateway venueGateway;
    private final ExecutionLedger executionLedger;
    @Qualifier("protectiveOrderRetry")
    private final Retry protectiveOrderRetry;
    private final MetricsService metricsService;
    private final ExecutionProperties executionProperties;

    private final ConcurrentHashMap<String, ReentrantLock> instrumentLocks = new ConcurrentHashMap<>();

    @Override
    public ExecutionResult execute(ExecutionContext context, DecisionItem item, RiskVerdict verdict) {
        if (verdict == null || !verdict.executable()) {
            return ExecutionResult.failed(item.instrument(), item.action(), NOT_APPROVED);
        }
        if (!verdict.item().equals(item)) {
            return ExecutionResult.failed(item.instrument(), item.action(), VERDICT_MISMATCH);
        }
        DecisionItem effective = verdict.effectiveItem();
        if (effective.action().isOpen() && (effective.stopLoss() == null || effective.takeProfit() == null)) {
            return ExecutionResult.failed(effective.instrument(), effective.action(), MISSING_PROTECTIVE_ORDERS);
        }

        String instrument = effective.instrument().toUpperCase(Locale.ROOT);
        String key = ExecutionLedger.key(context.cycleId(), instrument, effective.action());
        ReentrantLock lock = instrumentLocks.computeIfAbsent(instrument, ignored -> new ReentrantLock());
        lock.lock();
        try {
            try {
                Optional<ExecutionResult> previous = executionLedger.findCompleted(key);
                if (previous.isPresent()) {
                    log.info("Replaying completed execution key={}", key);
                    return previous.get().toBuilder().replayed(true).build();
                }
                if (!executionLedger.begin(key, context.cycleId(), instrument, effective.action())) {
                    return executionLedger.findCompleted(key)
                            .map(result -> result.toBuilder().replayed(true).build())
                            .orElseGet(() -> ExecutionResult.failed(instrument, effective.action(), DUPLICATE_IN_PROGRESS));
                }
            } catch (RuntimeException e) {
                log.error("Execution ledger unavailable key={}", key, e);
                return ExecutionResult.failed(instrument, effective.action(), "ledger_unavailable: " + e.getMessage());
            }

            ExecutionResult result;
            try {
                result = effective.action().isOpen()
                        ? open(context, effective, instrument)
                        : close(context, effective, instrument);
            } catch (RuntimeException e) {
                log.error("Unexpected execution failure instrument={} action={}", instrument, effective.action(), e);
                result = ExecutionResult.failed(instrument, effective.action(), "executor_error: " + e.getMessage());
            }
            return record(key, result);
        } finally {
            lock.unlock();
        }
    }

    private ExecutionResult open(ExecutionContext context, DecisionItem item, String instrument) {
        PositionSide side = item.action().positionSide();
        List<OrderRecord> orders = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (item.leverage() != null) {
            try {
                venueGateway.setLeverage(instrument, item.leverage());
            } catch (VenueException e) {
                return ExecutionResult.failed(instrument, item.action(), "leverage_rejected: " + e.describe());
            }
        }

        String entryClientId = clientOrderId(context.cycleId(), instrument, "E");
        OrderRecord entry;
        try {
            entry = venueGateway.placeOrder(OrderRequest.builder()
                    .instrument(instrument)
                    .side(side.entrySide())
                    .type(OrderType.MARKET)
                    .quantity(item.quantity())
                    .clientOrderId(entryClientId)
                    .build());
        } catch (VenueException e) {
            if (e.getKind() == VenueException.Kind.REJECTED || e.getKind() == VenueException.Kind.AUTH) {
                return ExecutionResult.failed(instrument, item.action(), "venue_rejected: " + e.describe());
            }
            // the venue may have filled the entry even though the response was lost
            Optional<OrderRecord> found;
            try {
                found = Retry.decorateSupplier(protectiveOrderRetry,
                        () -> venueGateway.findOrder(instrument, entryClientId)).get();
            } catch (RuntimeException lookupError) {
                return entryStateUnknown(context, item, instrument, e, lookupError);
            }
            if (found.isEmpty()) {
                log.warn("Entry not accepted by venue instrument={} clientOrderId={} reason={}",
                        instrument, entryClientId, e.describe());
                return ExecutionResult.failed(instrument, item.action(), ENTRY_NOT_PLACED + ": " + e.describe());
            }
            entry = found.get();
            warnings.add("entry_reconciled: " + e.describe());
            log.warn("Entry response lost, reconciled from venue instrument={} orderId={} status={}",
                    instrument, entry.orderId(), entry.status());
        }
        orders.add(entry);
        if (entry.status() != null && entry.status().isDead() && !MoneyUtils.isPositive(entry.executedQuantity())) {
            return ExecutionResult.builder()
                    .instrument(instrument)
                    .action(item.action())
                    .status(ExecutionResult.Status.FAILED)
                    .entryOrderId(entry.orderId())
                    .orders(orders)
                    .warnings(warnings)
                    .failureReason("venue_rejected: entry " + entry.status().name().toLowerCase(Locale.ROOT))
                    .build();
        }
        metricsService.incrementOrdersPlaced();

        BigDecimal filled = entry.filledOrRequested();
        if (filled.compareTo(item.quantity()) < 0) {
            warnings.add("partial_fill: " + filled.toPlainString() + " of " + item.quantity().toPlainString());
        }
        log.info("Entry placed instrument={} side={} orderId={} filled={}", instrument, side, entry.orderId(), filled);

        OrderRecord stopLoss;
        try {
            stopLoss = placeProtective(context, instrument, side.closingSide(), OrderType.STOP_MARKET,
                    filled, item.stopLoss(), "SL");
        } catch (RuntimeException e) {
            return unprotected(context, item, instrument, side, filled, entry, null, orders, warnings, "SL", e);
        }
        orders.add(stopLoss);

        OrderRecord takeProfit;
        try {
            takeProfit = placeProtective(context, instrument, side.closingSide(), OrderType.TAKE_PROFIT_MARKET,
                    filled, item.takeProfit(), "TP");
        } catch (RuntimeException e) {
            return unprotected(context, item, instrument, side, filled, entry, stopLoss, orders, warnings, "TP", e);
        }
        orders.add(takeProfit);

        return ExecutionResult.builder()
                .instrument(instrument)
                .action(item.action())
                .status(ExecutionResult.Status.SUCCESS)
                .entryOrderId(entry.orderId())
                .stopLossOrderId(stopLoss.orderId())
                .takeProfitOrderId(takeProfit.orderId())
                .executedQuantity(filled)
                .orders(orders)
                .warnings(warnings)
                .build();
    }

    private OrderRecord placeProtective(ExecutionContext context, String instrument, OrderSide side, OrderType type,
                                        BigDecimal quantity, BigDecimal stopPrice, String leg) {
        // same id on every attempt so an order accepted behind a lost response is not duplicated
        OrderRequest request = OrderRequest.builder()
                .instrument(instrument)
                .side(side)
                .type(type)
                .quantity(quantity)
                .stopPrice(stopPrice)
                .reduceOnly(true)
                .clientOrderId(clientOrderId(context.cycleId(), instrument, leg))
                .build();
        Supplier<OrderRecord> submit = () -> {
            OrderRecord order = venueGateway.placeOrder(request);
            requireAccepted(order, leg);
            return order;
        };
        OrderRecord placed = Retry.decorateSupplier(protectiveOrderRetry, submit).get();
        metricsService.incrementOrdersPlaced();
        return placed;
    }

    private ExecutionResult unprotected(ExecutionContext context, DecisionItem item, String instrument, PositionSide side,
                                        BigDecimal filled, OrderRecord entry, OrderRecord placedProtective,
                                        List<OrderRecord> orders, List<String> warnings, String leg, RuntimeException cause) {
        String reason = cause instanceof VenueException venue ? venue.describe() : cause.getMessage();
        log.error("Protective {} order failed instrument={} cycleId={} entryOrderId={} reason={}",
                leg, instrument, context.cycleId(), entry.orderId(), reason);
        metricsService.recordUnprotectedPosition(instrument);
        warnings.add(leg + "_failed: " + reason);

        if (placedProtective != null) {
            cancelQuietly(instrument, placedProtective.orderId(), warnings);
        }
        // the failed leg may still be resting if its last response was lost
        String failedLegId = clientOrderId(context.cycleId(), instrument, leg);
        try {
            venueGateway.findOrder(instrument, failedLegId)
                    .filter(order -> order.status() == null || !order.status().isDead())
                    .ifPresent(order -> cancelQuietly(instrument, order.orderId(), warnings));
        } catch (RuntimeException e) {
            warnings.add("lookup_failed: " + failedLegId);
            log.warn("Could not look up protective order instrument={} clientOrderId={}", instrument, failedLegId, e);
        }

        ExecutionResult.ExecutionResultBuilder result = ExecutionResult.builder()
                .instrument(instrument)
                .action(item.action())
                .status(ExecutionResult.Status.FAILED)
                .entryOrderId(entry.orderId())
                .executedQuantity(filled);

        OrderRequest closeRequest = OrderRequest.builder()
                .instrument(instrument)
                .side(side.closingSide())
                .type(OrderType.MARKET)
                .quantity(filled)
                .reduceOnly(true)
                .clientOrderId(clientOrderId(context.cycleId(), instrument, "X"))
                .build();
        Supplier<OrderRecord> closeCall = () -> {
            OrderRecord order = venueGateway.placeOrder(closeRequest);
            requireAccepted(order, "close");
            return order;
        };
        try {
            OrderRecord close = Retry.decorateSupplier(protectiveOrderRetry, closeCall).get();
            metricsService.incrementOrdersPlaced();
            orders.add(close);
            log.warn("Unprotected position closed instrument={} closeOrderId={}", instrument, close.orderId());
            return result.closeOrderId(close.orderId())
                    .orders(orders)
                    .warnings(warnings)
                    .failureReason(UNPROTECTED_CLOSED)
                    .build();
        } catch (RuntimeException e) {
            log.error("Emergency close failed, position left without protection instrument={} cycleId={} quantity={}",
                    instrument, context.cycleId(), filled, e);
            metricsService.recordUnprotectedPosition(instrument);
            warnings.add("close_failed: " + e.getMessage());
            return result.orders(orders)
                    .warnings(warnings)
                    .failureReason(UNPROTECTED_CLOSE_FAILED)
                    .build();
        }
    }

    private ExecutionResult entryStateUnknown(ExecutionContext context, DecisionItem item, String instrument,
                                              VenueException entryError, RuntimeException lookupError) {
        log.error("Entry outcome unknown, position may be open without protection instrument={} cycleId={} quantity={} entryError={}",
                instrument, context.cycleId(), item.quantity(), entryError.describe(), lookupError);
        metricsService.recordUnprotectedPosition(instrument);
        List<String> warnings = new ArrayList<>();
        warnings.add("entry_unconfirmed: " + entryError.describe());
        warnings.add("lookup_failed: " + lookupError.getMessage());
        return ExecutionResult.builder()
                .instrument(instrument)
                .action(item.action())
                .status(ExecutionResult.Status.FAILED)
                .warnings(warnings)
                .failureReason(UNPROTECTED_CLOSE_FAILED)
                .build();
    }

    private void cancelQuietly(String instrument, String orderId, List<String> warnings) {
        try {
            venueGateway.cancelOrder(instrument, orderId);
        } catch (RuntimeException e) {
            warnings.add("cancel_failed: " + orderId);
            log.warn("Could not cancel protective order instrument={} orderId={}", instrument, orderId, e);
        }
    }

    private ExecutionResult close(ExecutionContext context, DecisionItem item, String instrument) {
        Optional<PositionRecord> current = context.snapshot().position(instrument);
        if (current.isEmpty()) {
            return ExecutionResult.failed(instrument, item.action(), NO_OPEN_POSITION);
        }
        PositionRecord position = current.get();
        List<OrderRecord> orders = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        OrderRecord close;
        try {
            close = venueGateway.placeOrder(OrderRequest.builder()
                    .instrument(instrument)
                    .side(position.side().closingSide())
                    .type(OrderType.MARKET)
                    .quantity(position.quantity())
                    .reduceOnly(true)
                    .clientOrderId(clientOrderId(context.cycleId(), instrument, "C"))
                    .build());
        } catch (VenueException e) {
            return ExecutionResult.failed(instrument, item.action(), "venue_rejected: " + e.describe());
        }
        orders.add(close);
        if (close.status() != null && close.status().isDead() && !MoneyUtils.isPositive(close.executedQuantity())) {
            return ExecutionResult.builder()
                    .instrument(instrument)
                    .action(item.action())
                    .status(ExecutionResult.Status.FAILED)
                    .closeOrderId(close.orderId())
                    .orders(orders)
                    .failureReason("venue_rejected: close " + close.status().name().toLowerCase(Locale.ROOT))
                    .build();
        }
        metricsService.incrementOrdersPlaced();

        List<String> protective = new ArrayList<>(position.stopLossOrderIds());
        protective.addAll(position.takeProfitOrderIds());
        for (String orderId : protective) {
            try {
                venueGateway.cancelOrder(instrument, orderId);
            } catch (VenueException e) {
                warnings.add("cancel_failed: " + orderId + " " + e.describe());
                log.warn("Protective order cancel failed instrument={} orderId={} reason={}", instrument, orderId, e.describe());
            }
        }
        log.info("Position closed instrument={} side={} quantity={} orderId={}",
                instrument, position.side(), position.quantity(), close.orderId());

        return ExecutionResult.builder()
                .instrument(instrument)
                .action(item.action())
                .status(ExecutionResult.Status.SUCCESS)
                .closeOrderId(close.orderId())
                .executedQuantity(close.filledOrRequested())
                .orders(orders)
                .warnings(warnings)
                .build();
    }

    private ExecutionResult record(String key, ExecutionResult result) {
        try {
            executionLedger.complete(key, result);
            return result;
        } catch (RuntimeException e) {
            log.error("Failed to record execution result key={}", key, e);
            List<String> warnings = new ArrayList<>(result.warnings());
            warnings.add("ledger_write_failed");
            return result.toBuilder().warnings(warnings).build();
        }
    }

    /**
     * {@code <prefix><12 hex of cycle id>-<instrument>-<leg>}, capped at the venue's 36 characters.
     * Stable across retries of the same leg.
     */
    String clientOrderId(String cycleId, String instrument, String leg) {
        String compact = cycleId.replace("-", "");
        String cyclePart = compact.length() > 12 ? compact.substring(0, 12) : compact;
        String head = executionProperties.getClientOrderPrefix() + cyclePart + "-";
        String tail = "-" + leg;
        // trim the instrument, never the leg, so legs of one cycle stay distinct
        int room = Math.max(0, MAX_CLIENT_ORDER_ID_LENGTH - head.length() - tail.length());
        String instrumentPart = instrument.length() > room ? instrument.substring(0, room) : instrument;
        return head + instrumentPart + tail;
    }

    private static void requireAccepted(OrderRecord order, String leg) {
        if (order == null || order.orderId() == null) {
            throw new VenueException(VenueException.Kind.UNKNOWN, leg + " order returned no id");
        }
        if (order.status() == OrderStatus.REJECTED || order.status() == OrderStatus.CANCELED) {
            throw new VenueException(VenueException.Kind.REJECTED,
                    leg + " order " + order.orderId() + " came back " + order.status());
        }
    }
}
