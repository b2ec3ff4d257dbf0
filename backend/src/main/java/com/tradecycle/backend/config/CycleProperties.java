package com.tradecycle.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "cycle")
@Data
@Validated
public class CycleProperties {

    /**
     * Base asset names traded this cycle, e.g. BTC, ETH. Order is kept in the snapshot.
     */
    @NotEmpty
    private List<String> instruments = new ArrayList<>(List.of("BTC", "ETH", "BNB"));

    @Min(5)
    private long intervalSeconds = 300;

    private boolean schedulerEnabled = true;

    /**
     * Abort before the decision call when the futures wallet is empty.
     */
    private boolean requirePositiveBalance = true;

    @Positive
    private long aggregationTimeoutMs = 15000;

    @Positive
    private long decisionTimeoutMs = 240000;

    @Valid
    private MarketData marketData = new MarketData();

    @Valid
    private Lock lock = new Lock();

    @Data
    public static class MarketData {
        @Min(1)
        private int maxConcurrency = 4;

        @Positive
        private long fetchTimeoutMs = 10000;

        // 2 = one retry on transient failure
        @Min(1)
        private int maxAttempts = 2;

        @Min(1)
        private long retryWaitMs = 250;
    }

    @Data
    public static class Lock {
        // local | database
        @NotBlank
        private String mode = "local";

        @NotBlank
        private String resourceId = "trading-cycle";

        @Positive
        private long leaseSeconds = 900;
    }
}
