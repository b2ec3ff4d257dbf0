package com.tradecycle.backend.service;

import com.tradecycle.backend.trading.model.CycleStatus;
import com.tradecycle.backend.trading.model.RiskVerdict;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private Counter ordersPlacedCounter;
    private Counter venueFailuresCounter;
    private Counter unprotectedPositionsCounter;
    private Counter instrumentFetchFailuresCounter;
    private Counter recorderFailuresCounter;
    private Timer cycleDurationTimer;

    @jakarta.annotation.PostConstruct
    void init() {
        ordersPlacedCounter = Counter.builder("orders_placed_total").register(meterRegistry);
        venueFailuresCounter = Counter.builder("venue_failures_total").register(meterRegistry);
        unprotectedPositionsCounter = Counter.builder("unprotected_positions_total").register(meterRegistry);
        instrumentFetchFailuresCounter = Counter.builder("instrument_fetch_failures_total").register(meterRegistry);
        recorderFailuresCounter = Counter.builder("recorder_failures_total").register(meterRegistry);
        cycleDurationTimer = Timer.builder("cycle_duration").register(meterRegistry);
    }

    public void recordCycle(CycleStatus status, Duration duration) {
        meterRegistry.counter("cycles_total", "status", status.name().toLowerCase(Locale.ROOT)).increment();
        if (cycleDurationTimer != null && duration != null) {
            cycleDurationTimer.record(duration);
        }
    }

    public void recordVerdict(RiskVerdict verdict) {
        meterRegistry.counter("risk_verdicts_total",
                "outcome", verdict.outcome().name().toLowerCase(Locale.ROOT)).increment();
    }

    public void incrementOrdersPlaced() {
        if (ordersPlacedCounter != null) {
            ordersPlacedCounter.increment();
        }
    }

    public void incrementVenueFailures() {
        if (venueFailuresCounter != null) {
            venueFailuresCounter.increment();
        }
    }

    public void recordUnprotectedPosition(String instrument) {
        log.error("Unprotected position detected instrument={}", instrument);
        if (unprotectedPositionsCounter != null) {
            unprotectedPositionsCounter.increment();
        }
    }

    public void incrementInstrumentFetchFailures() {
        if (instrumentFetchFailuresCounter != null) {
            instrumentFetchFailuresCounter.increment();
        }
    }

    public void incrementRecorderFailures() {
        if (recorderFailuresCounter != null) {
            recorderFailuresCounter.increment();
        }
    }
}
