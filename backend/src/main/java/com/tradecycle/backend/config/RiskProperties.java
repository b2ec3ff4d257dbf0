package com.tradecycle.backend.config;

import com.tradecycle.backend.trading.model.RiskLimits;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    @NotNull
    @Positive
    private BigDecimal maxPositionSizeUsd = new BigDecimal("1000");

    @Min(1)
    private int maxLeverage = 10;

    @NotNull
    @Positive
    private BigDecimal riskPerTradePct = new BigDecimal("2");

    @Min(0)
    private int maxOpenPositions = 3;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minConfidence = 0.7;

    @NotNull
    @PositiveOrZero
    private BigDecimal minNotionalUsd = new BigDecimal("100");

    @Min(0)
    private int quantityScale = 3;

    /**
     * Immutable copy of the current limits. Taken once per cycle.
     */
    public RiskLimits toLimits() {
        return new RiskLimits(
                maxPositionSizeUsd,
                maxLeverage,
                riskPerTradePct,
                maxOpenPositions,
                minConfidence,
                minNotionalUsd,
                quantityScale
        );
    }
}
