package com.optionbot.model;

public final class TheoreticalResult {
    public final ContractId contract;
    public final double spot;
    public final double fairValue;
    public final double delta;
    public final double vega;
    public final double gamma;
    public final double theta;
    public final double timeToExpiryYears;
    public final double volatilityUsed;
    public final boolean degenerate;

    public TheoreticalResult(
            ContractId contract,
            double spot,
            double fairValue,
            double delta,
            double vega,
            double gamma,
            double theta,
            double timeToExpiryYears,
            double volatilityUsed,
            boolean degenerate
    ) {
        if (contract == null) {
            throw new IllegalArgumentException("contract identity is required");
        }
        this.contract = contract;
        this.spot = spot;
        this.fairValue = fairValue;
        this.delta = delta;
        this.vega = vega;
        this.gamma = gamma;
        this.theta = theta;
        this.timeToExpiryYears = timeToExpiryYears;
        this.volatilityUsed = volatilityUsed;
        this.degenerate = degenerate;
    }
}
