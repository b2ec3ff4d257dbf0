package com.tradecycle.backend.service;

import com.tradecycle.backend.trading.model.CycleRecord;
import com.tradecycle.backend.trading.pipeline.CycleOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * {@code --run-cycle} on the command line runs one cycle right after startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CycleCommandRunner implements ApplicationRunner {

    static final String RUN_CYCLE_OPTION = "run-cycle";

    private final CycleOrchestrator cycleOrchestrator;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(RUN_CYCLE_OPTION)) {
            return;
        }
        scheduledTaskGuard.run("trading-cycle-startup", () -> {
            CycleRecord record = cycleOrchestrator.runCycle();
            log.info("Startup cycle finished cycleId={} status={} abortReason={}",
                    record.cycleId(), record.status(), record.abortReason());
        });
    }
}
