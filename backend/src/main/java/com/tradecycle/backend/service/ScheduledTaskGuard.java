package com.tradecycle.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Wraps scheduled work so a failing cycle never kills the scheduler thread or the process.
 */
@Service
@Slf4j
public class ScheduledTaskGuard {

    /**
     * @return {@code true} when the task completed normally
     */
    public boolean run(String taskName, Runnable task) {
        long startedAt = System.nanoTime();
        try {
            task.run();
            log.debug("Scheduled task finished task={} tookMs={}", taskName, (System.nanoTime() - startedAt) / 1_000_000);
            return true;
        } catch (Throwable t) {
            log.error("Scheduled task failed task={} after {}ms", taskName, (System.nanoTime() - startedAt) / 1_000_000, t);
            return false;
        }
    }
}
