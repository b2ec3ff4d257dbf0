package com.tradecycle.backend.service;

import com.tradecycle.backend.trading.model.CycleRecord;
import com.tradecycle.backend.trading.pipeline.CycleOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CycleSchedulerTest {

    private final CycleOrchestrator orchestrator = mock(CycleOrchestrator.class);
    private final ScheduledTaskGuard guard = new ScheduledTaskGuard();

    @Test
    void scheduledRunNeverThrows() {
        when(orchestrator.runCycle()).thenThrow(new IllegalStateException("database down"));
        CycleScheduler scheduler = new CycleScheduler(orchestrator, guard);

        assertThatCode(scheduler::runCycle).doesNotThrowAnyException();
        assertThatCode(scheduler::runCycle).doesNotThrowAnyException();
        verify(orchestrator, times(2)).runCycle();
    }

    @Test
    void manualTriggerReturnsRecord() {
        CycleRecord record = CycleRecord.skipped("c-1", Instant.EPOCH, "cycle_in_progress");
        when(orchestrator.runCycle()).thenReturn(record);

        assertThat(new CycleScheduler(orchestrator, guard).triggerNow()).isSameAs(record);
    }

    @Test
    void manualTriggerReturnsNullOnFailure() {
        when(orchestrator.runCycle()).thenThrow(new IllegalStateException("boom"));

        assertThat(new CycleScheduler(orchestrator, guard).triggerNow()).isNull();
    }

    @Test
    void guardReportsOutcome() {
        assertThat(guard.run("ok", () -> { })).isTrue();
        assertThat(guard.run("fails", () -> {
            throw new OutOfMemoryError("simulated");
        })).isFalse();
    }

    @Test
    void commandLineOptionRunsOneCycle() {
        when(orchestrator.runCycle()).thenReturn(CycleRecord.skipped("c-2", Instant.EPOCH, "cycle_in_progress"));
        CycleCommandRunner runner = new CycleCommandRunner(orchestrator, guard);

        runner.run(new DefaultApplicationArguments("--run-cycle"));

        verify(orchestrator).runCycle();
    }

    @Test
    void startupWithoutOptionDoesNothing() {
        new CycleCommandRunner(orchestrator, guard).run(new DefaultApplicationArguments("--server.port=0"));

        verifyNoInteractions(orchestrator);
    }
}
