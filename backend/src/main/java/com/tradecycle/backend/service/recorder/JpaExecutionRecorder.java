package com.tradecycle.backend.service.recorder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradecycle.backend.model.CycleRecordEntity;
import com.tradecycle.backend.repository.CycleRecordRepository;
import com.tradecycle.backend.trading.model.CycleRecord;
import com.tradecycle.backend.trading.model.CycleStatus;
import com.tradecycle.backend.trading.model.Decision;
import com.tradecycle.backend.trading.model.ExecutionResult;
import com.tradecycle.backend.trading.model.MarketSnapshot;
import com.tradecycle.backend.trading.model.RiskVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaExecutionRecorder implements ExecutionRecorder {

    private static final TypeReference<List<RiskVerdict>> VERDICTS = new TypeReference<>() {};
    private static final TypeReference<List<ExecutionResult>> EXECUTIONS = new TypeReference<>() {};
    private static final TypeReference<List<String>> ERRORS = new TypeReference<>() {};

    private final CycleRecordRepository cycleRecordRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public void append(CycleRecord record) {
        if (record.status() == CycleStatus.SKIPPED) {
            throw new IllegalArgumentException("Skipped cycles are not recorded");
        }
        if (cycleRecordRepository.existsById(record.cycleId())) {
            throw new IllegalStateException("Cycle already recorded: " + record.cycleId());
        }
        Decision decision = record.decision();
        CycleRecordEntity entity = CycleRecordEntity.builder()
                .cycleId(record.cycleId())
                .status(record.status())
                .startedAt(record.startedAt())
                .finishedAt(record.finishedAt())
                .durationMs(record.duration().toMillis())
                .itemCount(decision == null ? 0 : decision.items().size())
                .executionCount(record.executions().size())
                .failedExecutionCount((int) record.executions().stream().filter(result -> !result.succeeded()).count())
                .abortReason(record.abortReason())
                .strategyForNextCycle(decision == null ? null : decision.strategyForNextCycle())
                .snapshotJson(write(record.snapshot()))
                .decisionJson(write(decision))
                .verdictsJson(write(record.verdicts()))
                .executionsJson(write(record.executions()))
                .errorsJson(write(record.errors()))
                .build();
        cycleRecordRepository.save(entity);
        log.info("Cycle recorded cycleId={} status={} executions={}", record.cycleId(), record.status(), record.executions().size());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CycleRecord> findById(String cycleId) {
        return cycleRecordRepository.findById(cycleId).map(this::toRecord);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CycleRecord> findRecent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return cycleRecordRepository.findAllByOrderByStartedAtDesc(PageRequest.of(0, limit)).stream()
                .map(this::toRecord)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CycleRecord> findLatestCompleted() {
        return cycleRecordRepository.findFirstByStatusInOrderByStartedAtDesc(
                        EnumSet.of(CycleStatus.COMPLETED, CycleStatus.COMPLETED_WITH_ERRORS))
                .map(this::toRecord);
    }

    private CycleRecord toRecord(CycleRecordEntity entity) {
        return CycleRecord.builder()
                .cycleId(entity.getCycleId())
                .status(entity.getStatus())
                .startedAt(entity.getStartedAt())
                .finishedAt(entity.getFinishedAt())
                .abortReason(entity.getAbortReason())
                .snapshot(read(entity.getSnapshotJson(), MarketSnapshot.class))
                .decision(read(entity.getDecisionJson(), Decision.class))
                .verdicts(read(entity.getVerdictsJson(), VERDICTS))
                .executions(read(entity.getExecutionsJson(), EXECUTIONS))
                .errors(read(entity.getErrorsJson(), ERRORS))
                .build();
    }

    private String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize cycle record field", e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored cycle record unreadable", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored cycle record unreadable", e);
        }
    }
}
