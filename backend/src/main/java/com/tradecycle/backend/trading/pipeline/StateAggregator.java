package com.tradecycle.backend.trading.pipeline;

import com.tradecycle.backend.config.CycleProperties;
import com.tradecycle.backend.exception.SnapshotAggregationException;
import com.tradecycle.backend.exception.VenueException;
import com.tradecycle.backend.service.venue.VenueBalance;
import com.tradecycle.backend.service.venue.VenueGateway;
import com.tradecycle.backend.trading.model.AccountState;
import com.tradecycle.backend.trading.model.InstrumentSnapshot;
import com.tradecycle.backend.trading.model.MarketSnapshot;
import com.tradecycle.backend.trading.model.OrderRecord;
import com.tradecycle.backend.trading.model.OrderType;
import com.tradecycle.backend.trading.model.PositionRecord;
import com.tradecycle.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Joins per-instrument snapshots with account state into one immutable {@link MarketSnapshot}.
 * Account state is all-or-nothing: any missing piece aborts the cycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StateAggregator {

    private final VenueGateway venueGateway;
    private final CycleProperties cycleProperties;
    @Qualifier("cycleIoExecutor")
    private final AsyncTaskExecutor cycleIoExecutor;
    private final Clock clock;

    /**
     * Starts the account reads so they overlap with instrument collection.
     */
    public CompletableFuture<VenueState> prefetch() {
        CompletableFuture<VenueBalance> balance = CompletableFuture.supplyAsync(venueGateway::getBalance, cycleIoExecutor);
        var performance = CompletableFuture.supplyAsync(venueGateway::getDailyPerformance, cycleIoExecutor);
        var positions = CompletableFuture.supplyAsync(venueGateway::getPositions, cycleIoExecutor);
        var orders = CompletableFuture.supplyAsync(venueGateway::getOpenOrders, cycleIoExecutor);
        return CompletableFuture.allOf(balance, performance, positions, orders)
                .thenApply(ignored -> new VenueState(balance.join(), performance.join(), positions.join(), orders.join()));
    }

    public MarketSnapshot aggregate(Map<String, InstrumentSnapshot> instruments) {
        return aggregate(instruments, prefetch());
    }

    public MarketSnapshot aggregate(Map<String, InstrumentSnapshot> instruments, CompletableFuture<VenueState> pending) {
        VenueState state = await(pending);
        if (state == null || state.balance() == null || state.balance().walletBalance() == null
                || state.balance().availableBalance() == null) {
            throw new SnapshotAggregationException("Account balance missing from venue state");
        }

        Set<String> configured = cycleProperties.getInstruments().stream()
                .map(value -> value.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<OrderRecord> openOrders = state.openOrders() == null ? List.of() : state.openOrders();
        List<PositionRecord> positions = new ArrayList<>();
        for (PositionRecord position : state.positions() == null ? List.<PositionRecord>of() : state.positions()) {
            String instrument = position.instrument().toUpperCase(Locale.ROOT);
            boolean tradable = configured.contains(instrument);
            if (!tradable) {
                log.info("Position outside configured instruments kept read-only instrument={}", instrument);
            }
            positions.add(position.toBuilder()
                    .instrument(instrument)
                    .tradable(tradable)
                    .stopLossOrderIds(protectiveIds(openOrders, instrument, OrderType.STOP_MARKET))
                    .takeProfitOrderIds(protectiveIds(openOrders, instrument, OrderType.TAKE_PROFIT_MARKET))
                    .build());
        }

        var performance = state.performance();
        AccountState account = new AccountState(
                state.balance().walletBalance(),
                state.balance().availableBalance(),
                MoneyUtils.orZero(state.balance().marginUsed()),
                MoneyUtils.orZero(state.balance().unrealizedPnl()),
                performance == null ? BigDecimal.ZERO : MoneyUtils.orZero(performance.realizedPnl()),
                performance == null ? 0 : performance.winningTrades(),
                performance == null ? 0 : performance.losingTrades());

        return new MarketSnapshot(clock.instant(), new ArrayList<>(instruments.values()), account, positions, openOrders);
    }

    private VenueState await(CompletableFuture<VenueState> pending) {
        long timeoutMs = cycleProperties.getAggregationTimeoutMs();
        try {
            return pending.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new SnapshotAggregationException("Account state not available within " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String reason = cause instanceof VenueException venue ? venue.describe() : String.valueOf(cause.getMessage());
            throw new SnapshotAggregationException("Account state unavailable: " + reason, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SnapshotAggregationException("Interrupted while loading account state", e);
        }
    }

    private static List<String> protectiveIds(List<OrderRecord> orders, String instrument, OrderType type) {
        return orders.stream()
                .filter(order -> order.type() == type)
                .filter(order -> instrument.equalsIgnoreCase(order.instrument()))
                .map(OrderRecord::orderId)
                .toList();
    }
}
