package com.tradecycle.backend.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "decision")
@Data
@Validated
public class DecisionProperties {

    @NotBlank
    private String endpoint = "http://localhost:8090/v1/decisions";

    private String apiKey = "";

    @Positive
    private int connectTimeoutMs = 5000;

    @Positive
    private int readTimeoutMs = 240000;
}
