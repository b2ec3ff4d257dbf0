package com.tradecycle.backend.service.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local lock. Enough for a single instance.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "cycle.lock.mode", havingValue = "local", matchIfMissing = true)
public class InMemoryCycleLock implements CycleLock {

    private final ConcurrentHashMap<String, String> holders = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(String resourceId, String owner) {
        String current = holders.putIfAbsent(resourceId, owner);
        if (current != null) {
            log.debug("Lock busy resource={} holder={}", resourceId, current);
            return false;
        }
        return true;
    }

    @Override
    public void release(String resourceId, String owner) {
        if (!holders.remove(resourceId, owner)) {
            log.warn("Release ignored, lock not held resource={} owner={}", resourceId, owner);
        }
    }
}
