package com.tradecycle.backend.trading.pipeline;

import com.tradecycle.backend.config.CycleProperties;
import com.tradecycle.backend.config.RiskProperties;
import com.tradecycle.backend.exception.DecisionIntegrityException;
import com.tradecycle.backend.exception.DecisionServiceException;
import com.tradecycle.backend.exception.SnapshotAggregationException;
import com.tradecycle.backend.service.MetricsService;
import com.tradecycle.backend.service.decision.DecisionRequest;
import com.tradecycle.backend.service.decision.DecisionSchemaValidator;
import com.tradecycle.backend.service.decision.DecisionService;
import com.tradecycle.backend.service.lock.CycleLock;
import com.tradecycle.backend.service.recorder.ExecutionRecorder;
import com.tradecycle.backend.trading.model.CycleRecord;
import com.tradecycle.backend.trading.model.CycleStatus;
import com.tradecycle.backend.trading.model.Decision;
import com.tradecycle.backend.trading.model.ExecutionContext;
import com.tradecycle.backend.trading.model.ExecutionResult;
import com.tradecycle.backend.trading.model.InstrumentSnapshot;
import com.tradecycle.backend.trading.model.MarketSnapshot;
import com.tradecycle.backend.trading.model.RiskLimits;
import com.tradecycle.backend.trading.model.RiskVerdict;
import com.tradecycle.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one trading cycle end to end: snapshot, decision, risk gate, execution, record.
 * At most one cycle runs at a time; a trigger that finds the lock held is skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CycleOrchestrator {

    static final String MDC_CYCLE_ID = "cycleId";

    private final CycleLock cycleLock;
    private final MarketDataCollector marketDataCollector;
    private final StateAggregator stateAggregator;
    private final DecisionService decisionService;
    private final DecisionSchemaValidator decisionSchemaValidator;
    private final RiskGate riskGate;
    private final TradeExecutor tradeExecutor;
    private final ExecutionRecorder executionRecorder;
    private final MetricsService metricsService;
    private final CycleProperties cycleProperties;
    private final RiskProperties riskProperties;
    @Qualifier("cycleIoExecutor")
    private final AsyncTaskExecutor cycleIoExecutor;
    @Qualifier("orderExecutor")
    private final Executor orderExecutor;
    private final Clock clock;

    public CycleRecord runCycle() {
        String cycleId = UUID.randomUUID().toString();
        String resourceId = cycleProperties.getLock().getResourceId();
        Instant startedAt = clock.instant();

        boolean acquired;
        try {
            acquired = cycleLock.tryAcquire(resourceId, cycleId);
        } catch (RuntimeException e) {
            log.error("Cycle lock unavailable resource={}", resourceId, e);
            CycleRecord aborted = CycleRecord.builder()
                    .cycleId(cycleId)
                    .startedAt(startedAt)
                    .finishedAt(clock.instant())
                    .status(CycleStatus.ABORTED)
                    .abortReason("lock_unavailable: " + e.getMessage())
                    .build();
            metricsService.recordCycle(aborted.status(), aborted.duration());
            return aborted;
        }
        if (!acquired) {
            log.info("Cycle skipped, another cycle holds resource={}", resourceId);
            CycleRecord skipped = CycleRecord.skipped(cycleId, startedAt, "cycle_in_progress");
            metricsService.recordCycle(skipped.status(), skipped.duration());
            return skipped;
        }

        MDC.put(MDC_CYCLE_ID, cycleId);
        try {
            CycleRecord record = persist(run(cycleId, startedAt));
            metricsService.recordCycle(record.status(), record.duration());
            log.info("Cycle finished status={} executions={} durationMs={} abortReason={}",
                    record.status(), record.executions().size(), record.duration().toMillis(), record.abortReason());
            return record;
        } finally {
            try {
                cycleLock.release(resourceId, cycleId);
            } catch (RuntimeException e) {
                log.error("Failed to release cycle lock resource={}", resourceId, e);
            }
            MDC.remove(MDC_CYCLE_ID);
        }
    }

    private CycleRecord run(String cycleId, Instant startedAt) {
        CycleRecord.CycleRecordBuilder record = CycleRecord.builder().cycleId(cycleId).startedAt(startedAt);
        List<String> errors = new ArrayList<>();
        RiskLimits limits = riskProperties.toLimits();
        List<String> instruments = List.copyOf(cycleProperties.getInstruments());
        log.info("Cycle started instruments={}", instruments);

        MarketSnapshot snapshot;
        try {
            CompletableFuture<VenueState> accountState = stateAggregator.prefetch();
            Map<String, InstrumentSnapshot> collected = marketDataCollector.collect(instruments);
            for (InstrumentSnapshot instrument : collected.values()) {
                if (!instrument.status().succeeded()) {
                    errors.add("instrument_unavailable: " + instrument.instrument() + " (" + instrument.status().reason() + ")");
                }
            }
            snapshot = stateAggregator.aggregate(collected, accountState);
        } catch (SnapshotAggregationException e) {
            log.error("Snapshot aggregation failed: {}", e.getMessage());
            return aborted(record, errors, e.toReason());
        } catch (RuntimeException e) {
            log.error("Snapshot build failed", e);
            return aborted(record, errors, "data_integrity: " + e.getMessage());
        }
        record.snapshot(snapshot);
        log.info("Snapshot built usableInstruments={} positions={} availableBalance={}",
                snapshot.usableInstrumentCount(), snapshot.openPositionCount(), snapshot.account().availableBalance());

        if (cycleProperties.isRequirePositiveBalance() && !MoneyUtils.isPositive(snapshot.account().walletBalance())) {
            log.warn("Futures wallet is empty, no decision requested");
            return aborted(record, errors, "no_balance");
        }

        DecisionRequest request = new DecisionRequest(cycleId, snapshot, limits.summary(), previousStrategy());
        Decision decision;
        try {
            decision = decisionSchemaValidator.validate(requestDecision(request));
        } catch (DecisionIntegrityException e) {
            log.error("Decision rejected as malformed: {}", e.getMessage());
            return aborted(record, errors, e.toReason());
        } catch (DecisionTimeout e) {
            log.error("Decision service timed out after {}ms", cycleProperties.getDecisionTimeoutMs());
            return aborted(record, errors, "decision_timeout");
        } catch (DecisionServiceException e) {
            log.error("Decision service failed: {}", e.getMessage());
            return aborted(record, errors, e.toReason());
        } catch (RuntimeException e) {
            log.error("Decision service failed: {}", e.getMessage());
            return aborted(record, errors, "decision_failed: " + e.getMessage());
        }
        record.decision(decision);

        List<RiskVerdict> verdicts = riskGate.evaluate(decision, snapshot, limits);
        verdicts.forEach(metricsService::recordVerdict);
        record.verdicts(verdicts);

        List<ExecutionResult> executions = executeApproved(new ExecutionContext(cycleId, snapshot), verdicts);
        boolean anyFailed = executions.stream().anyMatch(result -> !result.succeeded());
        return record.executions(executions)
                .errors(errors)
                .status(anyFailed ? CycleStatus.COMPLETED_WITH_ERRORS : CycleStatus.COMPLETED)
                .finishedAt(clock.instant())
                .build();
    }

    private Decision requestDecision(DecisionRequest request) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        Future<Decision> future;
        try {
            future = cycleIoExecutor.submit(() -> withMdc(context, () -> decisionService.propose(request)));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("decision call rejected by executor", e);
        }
        try {
            return future.get(cycleProperties.getDecisionTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DecisionTimeout();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new IllegalStateException("interrupted while waiting for decision", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(String.valueOf(e.getCause()), e.getCause());
        }
    }

    /**
     * Instruments run in parallel on the order executor; items for one instrument run in input order.
     * Results come back in verdict order.
     */
    private List<ExecutionResult> executeApproved(ExecutionContext context, List<RiskVerdict> verdicts) {
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < verdicts.size(); i++) {
            RiskVerdict verdict = verdicts.get(i);
            if (verdict.executable()) {
                groups.computeIfAbsent(verdict.item().instrument().toUpperCase(Locale.ROOT), ignored -> new ArrayList<>()).add(i);
            }
        }
        if (groups.isEmpty()) {
            return List.of();
        }

        ExecutionResult[] results = new ExecutionResult[verdicts.size()];
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<CompletableFuture<Void>> pending = new ArrayList<>();
        for (List<Integer> group : groups.values()) {
            Runnable task = () -> withMdc(mdc, () -> {
                for (int index : group) {
                    results[index] = executeOne(context, verdicts.get(index));
                }
                return null;
            });
            try {
                pending.add(CompletableFuture.runAsync(task, orderExecutor));
            } catch (RejectedExecutionException e) {
                log.error("Order executor rejected instrument group, running inline");
                task.run();
            }
        }
        CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).join();

        List<ExecutionResult> executions = new ArrayList<>();
        for (ExecutionResult result : results) {
            if (result != null) {
                executions.add(result);
            }
        }
        return executions;
    }

    private ExecutionResult executeOne(ExecutionContext context, RiskVerdict verdict) {
        try {
            ExecutionResult result = tradeExecutor.execute(context, verdict.item(), verdict);
            return Objects.requireNonNull(result, "executor returned no result");
        } catch (RuntimeException e) {
            log.error("Execution failed instrument={} action={}", verdict.item().instrument(), verdict.item().action(), e);
            return ExecutionResult.failed(verdict.item().instrument(), verdict.item().action(), "executor_error: " + e.getMessage());
        }
    }

    private String previousStrategy() {
        try {
            return executionRecorder.findLatestCompleted()
                    .map(CycleRecord::decision)
                    .map(Decision::strategyForNextCycle)
                    .orElse(null);
        } catch (RuntimeException e) {
            log.warn("Previous strategy notes unavailable: {}", e.getMessage());
            return null;
        }
    }

    private CycleRecord persist(CycleRecord record) {
        try {
            executionRecorder.append(record);
            return record;
        } catch (RuntimeException e) {
            log.error("Failed to record cycle status={}", record.status(), e);
            metricsService.incrementRecorderFailures();
            List<String> errors = new ArrayList<>(record.errors());
            errors.add("recorder_failed: " + e.getMessage());
            return record.toBuilder().errors(errors).build();
        }
    }

    private CycleRecord aborted(CycleRecord.CycleRecordBuilder record, List<String> errors, String reason) {
        return record.status(CycleStatus.ABORTED)
                .abortReason(reason)
                .errors(errors)
                .finishedAt(clock.instant())
                .build();
    }

    private static <T> T withMdc(Map<String, String> context, Supplier<T> body) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (context != null) {
            MDC.setContextMap(context);
        }
        try {
            return body.get();
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }

    private static final class DecisionTimeout extends RuntimeException {
        DecisionTimeout() {
            super("decision_timeout");
        }
    }
}
