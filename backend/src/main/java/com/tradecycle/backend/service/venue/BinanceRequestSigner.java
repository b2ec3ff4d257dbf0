package com.tradecycle.backend.service.venue;

import com.tradecycle.backend.config.VenueProperties;
import com.tradecycle.backend.exception.VenueException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

@Component
@RequiredArgsConstructor
public class BinanceRequestSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private final VenueProperties venueProperties;

    /**
     * Hex HMAC-SHA256 of the exact query string sent to the venue.
     */
    public String sign(String queryString) {
        String secret = venueProperties.getApiSecret();
        if (secret == null || secret.isBlank()) {
            throw new VenueException(VenueException.Kind.AUTH, "Venue API secret is not configured");
        }
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(queryString.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new VenueException(VenueException.Kind.UNKNOWN, "Unable to sign venue request", e);
        }
    }
}
