package com.tradecycle.backend.trading.pipeline;

import com.tradecycle.backend.config.CycleProperties;
import com.tradecycle.backend.exception.VenueException;
import com.tradecycle.backend.service.MetricsService;
import com.tradecycle.backend.service.indicator.IndicatorEngine;
import com.tradecycle.backend.service.venue.IndicatorFeed;
import com.tradecycle.backend.service.venue.VenueGateway;
import com.tradecycle.backend.trading.model.InstrumentSnapshot;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Fans instrument fetches out over the bounded market data pool. Each fetch gets its own
 * timeout and retry budget so one slow symbol cannot stall the rest.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultMarketDataCollector implements MarketDataCollector {

    private final VenueGateway venueGateway;
    private final IndicatorEngine indicatorEngine;
    @Qualifier("marketDataRetry")
    private final Retry marketDataRetry;
    @Qualifier("marketDataExecutor")
    private final Executor marketDataExecutor;
    @Qualifier("cycleIoExecutor")
    private final AsyncTaskExecutor cycleIoExecutor;
    private final CycleProperties cycleProperties;
    private final MetricsService metricsService;
    private final Clock clock;

    @Override
    public Map<String, InstrumentSnapshot> collect(List<String> instruments) {
        Map<String, CompletableFuture<InstrumentSnapshot>> pending = new LinkedHashMap<>();
        for (String raw : instruments) {
            String instrument = raw.trim().toUpperCase(Locale.ROOT);
            if (pending.containsKey(instrument)) {
                continue;
            }
            try {
                pending.put(instrument, CompletableFuture.supplyAsync(() -> fetch(instrument), marketDataExecutor));
            } catch (RejectedExecutionException e) {
                log.warn("Market data fetch rejected instrument={}", instrument);
                pending.put(instrument, CompletableFuture.completedFuture(failed(instrument, "rejected")));
            }
        }

        Map<String, InstrumentSnapshot> result = new LinkedHashMap<>();
        pending.forEach((instrument, future) -> result.put(instrument, await(instrument, future)));
        return result;
    }

    InstrumentSnapshot fetch(String instrument) {
        Supplier<IndicatorFeed> load = Retry.decorateSupplier(marketDataRetry, () -> venueGateway.getIndicators(instrument));
        long timeoutMs = cycleProperties.getMarketData().getFetchTimeoutMs();
        Future<IndicatorFeed> future;
        try {
            future = cycleIoExecutor.submit(load::get);
        } catch (RejectedExecutionException e) {
            return failed(instrument, "rejected");
        }
        try {
            IndicatorFeed feed = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (feed == null || feed.price() == null || feed.price().signum() <= 0) {
                return failed(instrument, "invalid_price");
            }
            Map<String, Double> indicators = indicatorEngine.compute(feed);
            log.debug("Collected instrument={} price={} indicators={}", instrument, feed.price(), indicators.size());
            return InstrumentSnapshot.ok(instrument, clock.instant(), feed.price(), indicators);
        } catch (TimeoutException e) {
            future.cancel(true);
            return failed(instrument, "timeout");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String reason = cause instanceof VenueException venue ? venue.describe() : String.valueOf(cause.getMessage());
            return failed(instrument, reason);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failed(instrument, "interrupted");
        } catch (RuntimeException e) {
            return failed(instrument, "indicator_error: " + e.getMessage());
        }
    }

    private InstrumentSnapshot await(String instrument, CompletableFuture<InstrumentSnapshot> future) {
        try {
            return future.join();
        } catch (RuntimeException e) {
            return failed(instrument, String.valueOf(e.getMessage()));
        }
    }

    private InstrumentSnapshot failed(String instrument, String reason) {
        log.warn("Instrument fetch failed instrument={} reason={}", instrument, reason);
        metricsService.incrementInstrumentFetchFailures();
        return InstrumentSnapshot.failed(instrument, clock.instant(), reason);
    }
}
