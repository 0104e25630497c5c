package com.optionbot.model;

/**
 * Raw engine output for one valuation. Vega is per 1 volatility point, theta per calendar day.
 */
public record PricingResult(
        double fairValue,
        double delta,
        double vega,
        double gamma,
        double theta,
        boolean degenerate
) {
}
