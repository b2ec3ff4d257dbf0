package com.tradecycle.backend.config;

import com.tradecycle.backend.exception.VenueException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class VenueResilienceConfig {

    @Bean
    public RateLimiter venueRateLimiter(
            @Value("${venue.rate-limit-per-second:10}") int limitPerSecond,
            @Value("${venue.rate-limit-timeout-ms:2000}") long timeoutMs
    ) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(limitPerSecond)
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .build();
        return RateLimiter.of("venue", config);
    }

    /**
     * Market data reads: only transient I/O is retried. Auth, rejections and malformed
     * responses fail the instrument immediately.
     */
    @Bean
    public Retry marketDataRetry(
            @Value("${cycle.market-data.max-attempts:2}") int maxAttempts,
            @Value("${cycle.market-data.retry-wait-ms:250}") long waitMs
    ) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(Duration.ofMillis(waitMs))
                .retryOnException(VenueResilienceConfig::isTransient)
                .build();
        return Retry.of("market-data", config);
    }

    /**
     * Protective orders and emergency closes. Anything but an auth failure is worth one more try.
     */
    @Bean
    public Retry protectiveOrderRetry(
            @Value("${execution.protective-order-attempts:2}") int maxAttempts,
            @Value("${execution.protective-retry-wait-ms:500}") long waitMs
    ) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(Duration.ofMillis(waitMs))
                .retryOnException(e -> e instanceof VenueException venue
                        && venue.getKind() != VenueException.Kind.AUTH)
                .build();
        return Retry.of("protective-order", config);
    }

    private static boolean isTransient(Throwable e) {
        return e instanceof VenueException venue && venue.isRetryable();
    }
}
