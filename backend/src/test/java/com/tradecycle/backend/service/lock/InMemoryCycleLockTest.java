package com.tradecycle.backend.service.lock;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCycleLockTest {

    private final InMemoryCycleLock lock = new InMemoryCycleLock();

    @Test
    void secondOwnerIsRefusedUntilRelease() {
        assertThat(lock.tryAcquire("trading-cycle", "a")).isTrue();
        assertThat(lock.tryAcquire("trading-cycle", "b")).isFalse();

        lock.release("trading-cycle", "a");

        assertThat(lock.tryAcquire("trading-cycle", "b")).isTrue();
    }

    @Test
    void releaseByNonOwnerKeepsLock() {
        lock.tryAcquire("trading-cycle", "a");

        lock.release("trading-cycle", "b");

        assertThat(lock.tryAcquire("trading-cycle", "c")).isFalse();
    }

    @Test
    void onlyOneConcurrentCallerWins() throws Exception {
        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                String owner = "owner-" + i;
                Callable<Boolean> attempt = () -> {
                    start.await();
                    return lock.tryAcquire("trading-cycle", owner);
                };
                results.add(pool.submit(attempt));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
