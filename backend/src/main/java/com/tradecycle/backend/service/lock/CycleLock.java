package com.tradecycle.backend.service.lock;

/**
 * Single-flight guard for the trading cycle. Acquisition is atomic and never blocks.
 */
public interface CycleLock {

    boolean tryAcquire(String resourceId, String owner);

    void release(String resourceId, String owner);
}
