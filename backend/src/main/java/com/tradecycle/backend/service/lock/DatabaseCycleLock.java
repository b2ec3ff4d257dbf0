package com.tradecycle.backend.service.lock;

import com.tradecycle.backend.config.CycleProperties;
import com.tradecycle.backend.model.CycleLease;
import com.tradecycle.backend.repository.CycleLeaseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Lease row per resource, shared by every instance on the same database. A lease that outlives
 * {@code cycle.lock.lease-seconds} (crashed holder) can be taken over.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "cycle.lock.mode", havingValue = "database")
public class DatabaseCycleLock implements CycleLock {

    private final CycleLeaseRepository cycleLeaseRepository;
    private final CycleProperties cycleProperties;
    private final Clock clock;

    @Override
    public boolean tryAcquire(String resourceId, String owner) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(Duration.ofSeconds(cycleProperties.getLock().getLeaseSeconds()));
        CycleLease lease = CycleLease.builder()
                .resourceId(resourceId)
                .owner(owner)
                .acquiredAt(now)
                .expiresAt(expiresAt)
                .build();
        try {
            cycleLeaseRepository.saveAndFlush(lease);
            return true;
        } catch (DataIntegrityViolationException ex) {
            int updated = cycleLeaseRepository.takeOverExpired(resourceId, owner, now, expiresAt);
            if (updated == 1) {
                log.warn("Took over expired cycle lease resource={} owner={}", resourceId, owner);
                return true;
            }
            return false;
        }
    }

    @Override
    public void release(String resourceId, String owner) {
        if (cycleLeaseRepository.deleteByResourceIdAndOwner(resourceId, owner) == 0) {
            log.warn("Cycle lease already gone on release resource={} owner={}", resourceId, owner);
        }
    }
}
