package com.optionbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class OpportunityRecord {
    public final String ticker;
    public final OptionKind kind;
    public final double strike;
    public final LocalDate expiration;
    public final String contractSymbol;
    public final double spot;
    public final double lastPrice;
    public final double bid;
    public final double ask;
    public final double impliedVolatility;
    public final long openInterest;
    public final long volume;

    public final double theoreticalValue;
    public final double delta;
    public final double vega;
    public final double timeToExpiryYears;
    public final double volatilityUsed;
    public final boolean degeneratePricing;

    public final double marketPrice;
    public final double pricingGap;
    public final double liquidity;
    public final double spreadPenalty;
    public final double sentimentAlignment;
    public final double compositeScore;

    public final boolean riskFlag;
    public final List<String> riskReasons;
    public final RecommendationBucket bucket;
    public final TradeSide side;

    public ContractId id() {
        return new ContractId(ticker, kind, strike, expiration);
    }
}
