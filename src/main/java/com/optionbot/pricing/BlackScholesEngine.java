package com.optionbot.pricing;

import com.optionbot.model.OptionKind;
import com.optionbot.model.PricingResult;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Closed-form European valuation under the lognormal model.
 *
 * <ul>
 *   <li>d1 = [ln(S/K) + (r + sigma^2/2) * T] / (sigma * sqrt(T)), d2 = d1 - sigma * sqrt(T)</li>
 *   <li>Call = S N(d1) - K e^(-rT) N(d2), Put = K e^(-rT) N(-d2) - S N(-d1)</li>
 *   <li>Vega per 1 volatility point (divided by 100), theta per calendar day (divided by 365)</li>
 * </ul>
 *
 * When T or sigma is not positive the contract is valued at intrinsic, with delta as the
 * in-the-money indicator and the other sensitivities zero.
 */
public class BlackScholesEngine {
    private static final NormalDistribution NORM = new NormalDistribution();

    public PricingResult price(
            double spot,
            double strike,
            double timeToExpiryYears,
            double volatility,
            double riskFreeRate,
            OptionKind kind
    ) {
        validate(spot, strike, timeToExpiryYears, volatility, riskFreeRate, kind);
        if (timeToExpiryYears <= 0.0 || volatility <= 0.0) {
            return intrinsic(spot, strike, kind);
        }

        double sqrtT = Math.sqrt(timeToExpiryYears);
        double volSqrtT = volatility * sqrtT;
        double d1 = (Math.log(spot / strike) + (riskFreeRate + volatility * volatility / 2.0) * timeToExpiryYears) / volSqrtT;
        double d2 = d1 - volSqrtT;

        double nd1 = NORM.density(d1);
        double discount = Math.exp(-riskFreeRate * timeToExpiryYears);

        double value;
        double delta;
        double theta;
        if (kind == OptionKind.CALL) {
            double cdfD1 = NORM.cumulativeProbability(d1);
            double cdfD2 = NORM.cumulativeProbability(d2);
            value = spot * cdfD1 - strike * discount * cdfD2;
            delta = cdfD1;
            theta = (-spot * nd1 * volatility / (2.0 * sqrtT) - riskFreeRate * strike * discount * cdfD2) / 365.0;
        } else {
            double cdfMinusD1 = NORM.cumulativeProbability(-d1);
            double cdfMinusD2 = NORM.cumulativeProbability(-d2);
            value = strike * discount * cdfMinusD2 - spot * cdfMinusD1;
            delta = -cdfMinusD1;
            theta = (-spot * nd1 * volatility / (2.0 * sqrtT) + riskFreeRate * strike * discount * cdfMinusD2) / 365.0;
        }

        double gamma = nd1 / (spot * volSqrtT);
        double vega = spot * nd1 * sqrtT / 100.0;

        // rounding can leave deep out-of-the-money values a hair below zero
        if (!(value > 0.0)) {
            value = 0.0;
        }
        return new PricingResult(value, delta, vega, gamma, theta, false);
    }

    public static double intrinsicValue(double spot, double strike, OptionKind kind) {
        return kind == OptionKind.CALL
                ? Math.max(spot - strike, 0.0)
                : Math.max(strike - spot, 0.0);
    }

    private static PricingResult intrinsic(double spot, double strike, OptionKind kind) {
        double delta;
        if (kind == OptionKind.CALL) {
            delta = spot > strike ? 1.0 : 0.0;
        } else {
            delta = spot < strike ? -1.0 : 0.0;
        }
        return new PricingResult(intrinsicValue(spot, strike, kind), delta, 0.0, 0.0, 0.0, true);
    }

    private static void validate(
            double spot,
            double strike,
            double timeToExpiryYears,
            double volatility,
            double riskFreeRate,
            OptionKind kind
    ) {
        if (kind == null) {
            throw new IllegalArgumentException("option kind is required");
        }
        if (!Double.isFinite(spot) || spot <= 0.0) {
            throw new IllegalArgumentException("spot must be positive and finite: " + spot);
        }
        if (!Double.isFinite(strike) || strike <= 0.0) {
            throw new IllegalArgumentException("strike must be positive and finite: " + strike);
        }
        if (!Double.isFinite(timeToExpiryYears) || timeToExpiryYears < 0.0) {
            throw new IllegalArgumentException("time to expiry must be non-negative: " + timeToExpiryYears);
        }
        if (!Double.isFinite(volatility) || volatility < 0.0) {
            throw new IllegalArgumentException("volatility must be non-negative: " + volatility);
        }
        if (!Double.isFinite(riskFreeRate)) {
            throw new IllegalArgumentException("risk-free rate must be finite: " + riskFreeRate);
        }
    }
}
