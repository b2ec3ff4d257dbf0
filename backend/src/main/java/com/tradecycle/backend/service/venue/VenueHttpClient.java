package com.tradecycle.backend.service.venue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradecycle.backend.config.VenueProperties;
import com.tradecycle.backend.exception.VenueException;
import com.tradecycle.backend.service.MetricsService;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.function.Supplier;

/**
 * Rate-limited HTTP access to the futures REST API. Maps every failure to a typed {@link VenueException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VenueHttpClient {

    private static final String API_KEY_HEADER = "X-MBX-APIKEY";
    private static final Set<Integer> AUTH_CODES = Set.of(-2014, -2015, -1022);

    @Qualifier("venueRestTemplate")
    private final RestTemplate venueRestTemplate;
    private final RateLimiter venueRateLimiter;
    private final BinanceRequestSigner requestSigner;
    private final VenueProperties venueProperties;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonNode publicGet(String path, Map<String, String> params) {
        String query = encode(params);
        return execute(HttpMethod.GET, path, query, false);
    }

    public JsonNode signedGet(String path, Map<String, String> params) {
        return signed(HttpMethod.GET, path, params);
    }

    public JsonNode signedPost(String path, Map<String, String> params) {
        return signed(HttpMethod.POST, path, params);
    }

    public JsonNode signedDelete(String path, Map<String, String> params) {
        return signed(HttpMethod.DELETE, path, params);
    }

    private JsonNode signed(HttpMethod method, String path, Map<String, String> params) {
        Map<String, String> all = new LinkedHashMap<>(params);
        all.put("recvWindow", String.valueOf(venueProperties.getRecvWindowMs()));
        all.put("timestamp", String.valueOf(clock.millis()));
        String query = encode(all);
        String signedQuery = query + "&signature=" + requestSigner.sign(query);
        return execute(method, path, signedQuery, true);
    }

    private JsonNode execute(HttpMethod method, String path, String query, boolean withKey) {
        Supplier<JsonNode> call = () -> doRequest(method, path, query, withKey);
        try {
            return RateLimiter.decorateSupplier(venueRateLimiter, call).get();
        } catch (RequestNotPermitted e) {
            metricsService.incrementVenueFailures();
            throw new VenueException(VenueException.Kind.TRANSIENT, "Local venue rate limit exceeded for " + path, e);
        } catch (VenueException e) {
            metricsService.incrementVenueFailures();
            log.warn("Venue request failed method={} path={} kind={} code={} message={}",
                    method, path, e.getKind(), e.getVenueCode(), e.getMessage());
            throw e;
        }
    }

    private JsonNode doRequest(HttpMethod method, String path, String query, boolean withKey) {
        String url = venueProperties.getBaseUrl() + path + (query.isEmpty() ? "" : "?" + query);
        HttpHeaders headers = new HttpHeaders();
        if (withKey) {
            headers.set(API_KEY_HEADER, venueProperties.getApiKey());
        }
        try {
            ResponseEntity<String> response = venueRestTemplate.exchange(
                    URI.create(url), method, new HttpEntity<>(headers), String.class);
            return parse(response.getBody(), path);
        } catch (HttpStatusCodeException e) {
            throw mapStatus(e, path);
        } catch (ResourceAccessException e) {
            throw new VenueException(VenueException.Kind.TRANSIENT, "Venue unreachable for " + path + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new VenueException(VenueException.Kind.UNKNOWN, "Venue call failed for " + path + ": " + e.getMessage(), e);
        }
    }

    private JsonNode parse(String body, String path) {
        if (body == null || body.isBlank()) {
            throw new VenueException(VenueException.Kind.UNKNOWN, "Empty venue response for " + path);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new VenueException(VenueException.Kind.UNKNOWN, "Malformed venue response for " + path, e);
        }
    }

    private VenueException mapStatus(HttpStatusCodeException e, String path) {
        HttpStatusCode status = e.getStatusCode();
        Integer code = null;
        String message = e.getResponseBodyAsString();
        try {
            JsonNode error = objectMapper.readTree(message);
            if (error != null && error.has("code")) {
                code = error.path("code").asInt();
                message = error.path("msg").asText(message);
            }
        } catch (JsonProcessingException parseError) {
            log.debug("Non-JSON venue error body for {}", path);
        }
        String text = "Venue HTTP " + status.value() + " for " + path + ": " + message;
        if (status.is5xxServerError() || status.value() == 429 || status.value() == 418) {
            return new VenueException(VenueException.Kind.TRANSIENT, text, code, e);
        }
        if (status.value() == 401 || status.value() == 403 || (code != null && AUTH_CODES.contains(code))) {
            return new VenueException(VenueException.Kind.AUTH, text, code, e);
        }
        return new VenueException(VenueException.Kind.REJECTED, text, code, e);
    }

    private static String encode(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        params.forEach((key, value) -> {
            if (value != null) {
                joiner.add(key + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
            }
        });
        return joiner.toString();
    }
}
