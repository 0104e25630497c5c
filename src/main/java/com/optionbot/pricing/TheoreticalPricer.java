package com.optionbot.pricing;

import com.optionbot.model.OptionContract;
import com.optionbot.model.PricingResult;
import com.optionbot.model.Quote;
import com.optionbot.model.TheoreticalResult;

/**
 * Binds one contract to the engine: picks the volatility and measures time to expiry from the quote.
 */
public final class TheoreticalPricer {
    /** Quoted implied volatilities at or above this are treated as feed garbage. */
    public static final double MAX_USABLE_IV = 5.0;

    private final BlackScholesEngine engine;
    private final double riskFreeRate;
    private final double fallbackVolatility;

    public TheoreticalPricer(BlackScholesEngine engine, double riskFreeRate, double fallbackVolatility) {
        this.engine = engine == null ? new BlackScholesEngine() : engine;
        this.riskFreeRate = riskFreeRate;
        this.fallbackVolatility = Double.isFinite(fallbackVolatility) && fallbackVolatility > 0.0
                ? fallbackVolatility
                : 0.0;
    }

    public TheoreticalResult price(OptionContract contract, Quote quote) {
        if (contract == null || quote == null) {
            throw new IllegalArgumentException("contract and quote are required");
        }
        double years = ExpiryCalendar.yearsToExpiry(contract.expiration, quote.observedAt);
        double volatility = volatilityFor(contract);
        PricingResult result = engine.price(quote.spot, contract.strike, years, volatility, riskFreeRate, contract.kind);
        return new TheoreticalResult(
                contract.id(),
                quote.spot,
                result.fairValue(),
                result.delta(),
                result.vega(),
                result.gamma(),
                result.theta(),
                years,
                volatility,
                result.degenerate()
        );
    }

    /**
     * Quoted IV when usable, else the configured fallback, else 0 (intrinsic pricing).
     */
    public double volatilityFor(OptionContract contract) {
        double iv = contract.impliedVolatility;
        if (Double.isFinite(iv) && iv > 0.0 && iv < MAX_USABLE_IV) {
            return iv;
        }
        return fallbackVolatility;
    }
}
