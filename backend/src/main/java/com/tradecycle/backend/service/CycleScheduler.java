package com.tradecycle.backend.service;

import com.tradecycle.backend.trading.model.CycleRecord;
import com.tradecycle.backend.trading.pipeline.CycleOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "cycle.scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class CycleScheduler {

    private final CycleOrchestrator cycleOrchestrator;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(fixedDelayString = "${cycle.interval-seconds:300}000", initialDelayString = "${cycle.initial-delay-seconds:10}000")
    public void runCycle() {
        scheduledTaskGuard.run("trading-cycle", cycleOrchestrator::runCycle);
    }

    /**
     * Runs a cycle on the caller's thread, outside the schedule. Returns {@code null} if the run failed.
     */
    public CycleRecord triggerNow() {
        AtomicReference<CycleRecord> result = new AtomicReference<>();
        scheduledTaskGuard.run("trading-cycle-manual", () -> result.set(cycleOrchestrator.runCycle()));
        return result.get();
    }
}
