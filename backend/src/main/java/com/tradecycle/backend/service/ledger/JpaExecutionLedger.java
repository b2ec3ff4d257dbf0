package com.tradecycle.backend.service.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradecycle.backend.model.ExecutionLedgerEntry;
import com.tradecycle.backend.repository.ExecutionLedgerRepository;
import com.tradecycle.backend.trading.model.DecisionAction;
import com.tradecycle.backend.trading.model.ExecutionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaExecutionLedger implements ExecutionLedger {

    private final ExecutionLedgerRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public boolean begin(String key, String cycleId, String instrument, DecisionAction action) {
        Instant now = clock.instant();
        ExecutionLedgerEntry entry = ExecutionLedgerEntry.builder()
                .executionKey(key)
                .cycleId(cycleId)
                .instrument(instrument)
                .action(action.name())
                .status(ExecutionLedgerEntry.Status.IN_PROGRESS)
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            repository.saveAndFlush(entry);
            return true;
        } catch (DataIntegrityViolationException ex) {
            log.info("Execution key already claimed key={}", key);
            return false;
        }
    }

    @Override
    public Optional<ExecutionResult> findCompleted(String key) {
        return repository.findByExecutionKey(key)
                .filter(entry -> entry.getStatus() == ExecutionLedgerEntry.Status.COMPLETED)
                .map(entry -> deserialize(entry.getResultPayload()));
    }

    @Override
    public void complete(String key, ExecutionResult result) {
        ExecutionLedgerEntry entry = repository.findByExecutionKey(key)
                .orElseThrow(() -> new IllegalStateException("No ledger entry for " + key));
        entry.setStatus(ExecutionLedgerEntry.Status.COMPLETED);
        entry.setResultPayload(serialize(result));
        entry.setUpdatedAt(clock.instant());
        repository.save(entry);
    }

    private String serialize(ExecutionResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize execution result", e);
        }
    }

    private ExecutionResult deserialize(String payload) {
        try {
            return objectMapper.readValue(payload, ExecutionResult.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored execution result unreadable", e);
        }
    }
}
