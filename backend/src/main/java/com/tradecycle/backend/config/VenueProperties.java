package com.tradecycle.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "venue")
@Data
@Validated
public class VenueProperties {

    @NotBlank
    private String baseUrl = "https://fapi.binance.com";

    private String apiKey = "";

    private String apiSecret = "";

    @NotBlank
    private String quoteAsset = "USDT";

    @Positive
    private long recvWindowMs = 5000;

    @Positive
    private int connectTimeoutMs = 5000;

    @Positive
    private int readTimeoutMs = 10000;

    @Min(1)
    private int rateLimitPerSecond = 10;

    @Min(0)
    private long rateLimitTimeoutMs = 2000;

    @Min(30)
    private int klineLimit = 100;

    public String symbolOf(String instrument) {
        return instrument.trim().toUpperCase() + quoteAsset;
    }

    public String instrumentOf(String symbol) {
        if (symbol != null && symbol.endsWith(quoteAsset) && symbol.length() > quoteAsset.length()) {
            return symbol.substring(0, symbol.length() - quoteAsset.length());
        }
        return symbol;
    }
}
