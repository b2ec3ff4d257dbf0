package com.tradecycle.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class VenueHttpConfig {

    @Bean
    public RestTemplate venueRestTemplate(VenueProperties venueProperties) {
        return restTemplate(venueProperties.getConnectTimeoutMs(), venueProperties.getReadTimeoutMs());
    }

    @Bean
    public RestTemplate decisionRestTemplate(DecisionProperties decisionProperties) {
        return restTemplate(decisionProperties.getConnectTimeoutMs(), decisionProperties.getReadTimeoutMs());
    }

    private RestTemplate restTemplate(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }
}
