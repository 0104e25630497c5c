package com.optionbot.model;

import java.time.Instant;
import java.util.Locale;

public final class Quote {
    public final String ticker;
    public final double spot;
    public final Instant observedAt;

    public Quote(String ticker, double spot, Instant observedAt) {
        this.ticker = ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
        this.spot = spot;
        this.observedAt = observedAt == null ? Instant.EPOCH : observedAt;
    }

    public boolean hasValidSpot() {
        return Double.isFinite(spot) && spot > 0.0;
    }
}
