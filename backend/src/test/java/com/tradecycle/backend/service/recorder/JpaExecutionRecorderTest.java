package com.tradecycle.backend.service.recorder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradecycle.backend.repository.CycleRecordRepository;
import com.tradecycle.backend.trading.model.CycleRecord;
import com.tradecycle.backend.trading.model.CycleStatus;
import com.tradecycle.backend.trading.model.Decision;
import com.tradecycle.backend.trading.model.DecisionItem;
import com.tradecycle.backend.trading.model.ExecutionResult;
import com.tradecycle.backend.trading.model.RiskVerdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static com.tradecycle.backend.util.TestSnapshots.NOW;
import static com.tradecycle.backend.util.TestSnapshots.failedInstrument;
import static com.tradecycle.backend.util.TestSnapshots.instrument;
import static com.tradecycle.backend.util.TestSnapshots.openLong;
import static com.tradecycle.backend.util.TestSnapshots.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
class JpaExecutionRecorderTest {

    @Autowired
    private CycleRecordRepository repository;

    private JpaExecutionRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new JpaExecutionRecorder(repository, new ObjectMapper().findAndRegisterModules());
    }

    @Test
    void storesAndReloadsFullCycle() {
        DecisionItem item = openLong("BTC", "0.1", "49500", "52000", 0.9);
        CycleRecord record = CycleRecord.builder()
                .cycleId("cycle-1")
                .startedAt(NOW)
                .finishedAt(NOW.plusSeconds(42))
                .status(CycleStatus.COMPLETED_WITH_ERRORS)
                .snapshot(snapshot(List.of(instrument("BTC", "50000"), failedInstrument("ETH"))))
                .decision(new Decision(List.of(item), "trend up", "trail stop if BTC > 52k"))
                .verdicts(List.of(RiskVerdict.clamped(item, "size_clamped", new BigDecimal("0.020"), null)))
                .executions(List.of(ExecutionResult.failed("BTC", item.action(), "unprotected_position_closed")))
                .errors(List.of("instrument_unavailable: ETH (timeout)"))
                .build();

        recorder.append(record);

        CycleRecord loaded = recorder.findById("cycle-1").orElseThrow();
        assertThat(loaded.status()).isEqualTo(CycleStatus.COMPLETED_WITH_ERRORS);
        assertThat(loaded.duration().toSeconds()).isEqualTo(42);
        assertThat(loaded.snapshot().instruments()).hasSize(2);
        assertThat(loaded.snapshot().isTradable("ETH")).isFalse();
        assertThat(loaded.snapshot().instrument("BTC").orElseThrow().indicators()).containsEntry("rsi_14", 55.0);
        assertThat(loaded.decision()).isEqualTo(record.decision());
        assertThat(loaded.verdicts().get(0).effectiveItem().quantity()).isEqualByComparingTo("0.02");
        assertThat(loaded.executions()).isEqualTo(record.executions());
        assertThat(loaded.errors()).containsExactly("instrument_unavailable: ETH (timeout)");

        assertThat(repository.findById("cycle-1")).get().satisfies(entity -> {
            assertThat(entity.getExecutionCount()).isEqualTo(1);
            assertThat(entity.getFailedExecutionCount()).isEqualTo(1);
            assertThat(entity.getStrategyForNextCycle()).isEqualTo("trail stop if BTC > 52k");
        });
    }

    @Test
    void recordsAreAppendOnly() {
        CycleRecord record = aborted("cycle-2", NOW, "decision_timeout");
        recorder.append(record);

        assertThatThrownBy(() -> recorder.append(record)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void skippedCyclesAreNotStored() {
        assertThatThrownBy(() -> recorder.append(CycleRecord.skipped("cycle-3", NOW, "cycle_in_progress")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(repository.count()).isZero();
    }

    @Test
    void listsNewestFirstAndFindsLatestCompleted() {
        recorder.append(completed("old", NOW.minusSeconds(600), "first notes"));
        recorder.append(completed("mid", NOW.minusSeconds(300), "latest notes"));
        recorder.append(aborted("new", NOW, "decision_failed: HTTP 500"));

        assertThat(recorder.findRecent(2)).extracting(CycleRecord::cycleId).containsExactly("new", "mid");
        assertThat(recorder.findRecent(0)).isEmpty();
        assertThat(recorder.findLatestCompleted()).get()
                .satisfies(latest -> assertThat(latest.decision().strategyForNextCycle()).isEqualTo("latest notes"));
    }

    @Test
    void abortedCycleWithoutSnapshotRoundTrips() {
        recorder.append(aborted("cycle-4", NOW, "data_integrity: Account state unavailable"));

        CycleRecord loaded = recorder.findById("cycle-4").orElseThrow();
        assertThat(loaded.snapshot()).isNull();
        assertThat(loaded.decision()).isNull();
        assertThat(loaded.executions()).isEmpty();
        assertThat(loaded.abortReason()).startsWith("data_integrity");
    }

    private static CycleRecord completed(String id, Instant startedAt, String notes) {
        return CycleRecord.builder()
                .cycleId(id)
                .startedAt(startedAt)
                .finishedAt(startedAt.plusSeconds(5))
                .status(CycleStatus.COMPLETED)
                .decision(new Decision(List.of(), "flat", notes))
                .build();
    }

    private static CycleRecord aborted(String id, Instant startedAt, String reason) {
        return CycleRecord.builder()
                .cycleId(id)
                .startedAt(startedAt)
                .finishedAt(startedAt.plusSeconds(1))
                .status(CycleStatus.ABORTED)
                .abortReason(reason)
                .build();
    }
}
