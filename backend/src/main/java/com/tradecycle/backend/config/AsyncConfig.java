package com.tradecycle.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Bounded pool for per-instrument market data fetches. Pool size is the venue-facing concurrency.
     */
    @Bean(name = "marketDataExecutor")
    public ThreadPoolTaskExecutor marketDataExecutor(CycleProperties cycleProperties) {
        int concurrency = cycleProperties.getMarketData().getMaxConcurrency();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(250);
        executor.setThreadNamePrefix("market-data-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Read-only venue and decision calls. Tasks here may be cancelled on timeout or shutdown.
     */
    @Bean(name = "cycleIoExecutor")
    public ThreadPoolTaskExecutor cycleIoExecutor() {
        int processors = Runtime.getRuntime().availableProcessors();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(4, processors));
        executor.setMaxPoolSize(Math.max(16, processors * 2));
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("cycle-io-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Venue-mutating order submissions. In-flight tasks are allowed to finish on shutdown
     * so an entry is never left without its protective orders.
     */
    @Bean(name = "orderExecutor")
    public ThreadPoolTaskExecutor orderExecutor(ExecutionProperties executionProperties) {
        int concurrency = executionProperties.getMaxConcurrentInstruments();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("orders-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(executionProperties.getShutdownAwaitSeconds());
        executor.initialize();
        return executor;
    }
}
