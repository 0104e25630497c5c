package com.optionbot.pricing;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Listed expirations settle at the US equity close, 16:00 New York time.
 * Time to expiry is measured from the quote's observation instant, never from the wall clock.
 */
public final class ExpiryCalendar {
    public static final ZoneId EXCHANGE_ZONE = ZoneId.of("America/New_York");
    public static final LocalTime EXPIRY_TIME = LocalTime.of(16, 0);
    public static final double SECONDS_PER_YEAR = 365.0 * 86_400.0;

    private ExpiryCalendar() {
    }

    public static Instant expiryInstant(LocalDate expiration) {
        if (expiration == null) {
            throw new IllegalArgumentException("expiration date is required");
        }
        return expiration.atTime(EXPIRY_TIME).atZone(EXCHANGE_ZONE).toInstant();
    }

    public static double yearsToExpiry(LocalDate expiration, Instant observedAt) {
        if (observedAt == null) {
            throw new IllegalArgumentException("observation instant is required");
        }
        long seconds = Duration.between(observedAt, expiryInstant(expiration)).getSeconds();
        if (seconds <= 0L) {
            return 0.0;
        }
        return seconds / SECONDS_PER_YEAR;
    }
}
