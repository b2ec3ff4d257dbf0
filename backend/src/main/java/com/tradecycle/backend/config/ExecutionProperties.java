package com.tradecycle.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "execution")
@Data
@Validated
public class ExecutionProperties {

    // Attempts per protective order (stop-loss / take-profit) and per emergency close
    @Min(1)
    private int protectiveOrderAttempts = 2;

    @Min(1)
    private long protectiveRetryWaitMs = 500;

    // Instruments executed in parallel; orders for one instrument are always serialized
    @Min(1)
    private int maxConcurrentInstruments = 4;

    @NotBlank
    @Pattern(regexp = "[a-z]{1,4}")
    private String clientOrderPrefix = "tc";

    @Min(1)
    private int shutdownAwaitSeconds = 60;
}
