package com.codefarm.shorturl.core;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

@Component
public class ExpiryPolicy {

    public static final int DEFAULT_VALIDITY_MINUTES = 30;

    private final int defaultValidityMinutes;

    public ExpiryPolicy(@Value("${shorturl.default-validity-minutes:30}") int defaultValidityMinutes) {
        if (defaultValidityMinutes <= 0) {
            throw new IllegalArgumentException("Default validity must be positive");
        }
        this.defaultValidityMinutes = defaultValidityMinutes;
    }

    public int defaultValidityMinutes() {
        return defaultValidityMinutes;
    }

    public Instant computeExpiry(Instant now, int validityMinutes) {
        if (validityMinutes <= 0) {
            throw new IllegalArgumentException("Validity must be positive: " + validityMinutes);
        }
        return now.plus(Duration.ofMinutes(validityMinutes));
    }

    /**
     * Strict comparison: a link is still usable at exactly its expiry instant.
     */
    public boolean isExpired(Instant now, Instant expiresAt) {
        return now.isAfter(expiresAt);
    }
}
