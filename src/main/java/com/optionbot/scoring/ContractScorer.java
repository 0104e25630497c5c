package com.optionbot.scoring;

import com.optionbot.model.OpportunityRecord;
import com.optionbot.model.OptionContract;
import com.optionbot.model.RecommendationBucket;
import com.optionbot.model.SentimentSummary;
import com.optionbot.model.TheoreticalResult;
import com.optionbot.model.TradeSide;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns one priced contract plus its ticker's sentiment into an {@link OpportunityRecord}.
 * Every output is a pure function of the three inputs and the policy.
 */
public final class ContractScorer {
    private final ScoringPolicy policy;

    public ContractScorer(ScoringPolicy policy) {
        this.policy = policy == null ? ScoringPolicy.defaults() : policy;
    }

    public ScoringPolicy policy() {
        return policy;
    }

    public OpportunityRecord score(OptionContract contract, TheoreticalResult theoretical, SentimentSummary sentiment) {
        if (contract == null) {
            throw new IllegalStateException("contract is missing");
        }
        if (theoretical == null) {
            throw new IllegalStateException("theoretical result is missing for " + contract.id());
        }
        if (sentiment == null) {
            throw new IllegalStateException("sentiment summary is missing for " + contract.id());
        }
        if (!theoretical.contract.equals(contract.id())) {
            throw new IllegalStateException("theoretical result " + theoretical.contract + " does not belong to " + contract.id());
        }

        double market = contract.marketPrice();
        double gap = pricingGap(theoretical.fairValue, market);
        double gapSign = Math.signum(gap);
        double gapTerm = Math.tanh(gap / ScoringPolicy.GAP_SCALE);
        double liquidity = liquidity(contract.activity());
        double spread = spreadPenalty(contract);
        double spreadTerm = spread / ScoringPolicy.MAX_SPREAD_PENALTY;
        double alignment = alignment(gapSign, contract.kind.sign(), sentiment.effectiveMean());

        double magnitude = Math.max(0.0,
                policy.gapWeight * Math.abs(gapTerm)
                        + policy.liquidityWeight * liquidity
                        - policy.spreadWeight * spreadTerm
                        + policy.sentimentWeight * alignment);
        double composite = 100.0 * gapSign * magnitude;

        List<String> riskReasons = riskReasons(contract, spread, theoretical.timeToExpiryYears);
        if (theoretical.degenerate && theoretical.timeToExpiryYears > 0.0) {
            // intrinsic-only fair value before expiry; the gap is not a real mispricing
            riskReasons.add("no_volatility");
        }
        boolean riskFlag = !riskReasons.isEmpty();
        RecommendationBucket bucket = bucket(composite, riskFlag);

        return OpportunityRecord.builder()
                .ticker(contract.ticker)
                .kind(contract.kind)
                .strike(contract.strike)
                .expiration(contract.expiration)
                .contractSymbol(contract.contractSymbol == null ? "" : contract.contractSymbol)
                .spot(theoretical.spot)
                .lastPrice(contract.lastPrice)
                .bid(contract.bid)
                .ask(contract.ask)
                .impliedVolatility(contract.impliedVolatility)
                .openInterest(contract.openInterest)
                .volume(contract.volume)
                .theoreticalValue(theoretical.fairValue)
                .delta(theoretical.delta)
                .vega(theoretical.vega)
                .timeToExpiryYears(theoretical.timeToExpiryYears)
                .volatilityUsed(theoretical.volatilityUsed)
                .degeneratePricing(theoretical.degenerate)
                .marketPrice(market)
                .pricingGap(gap)
                .liquidity(liquidity)
                .spreadPenalty(spread)
                .sentimentAlignment(alignment)
                .compositeScore(composite)
                .riskFlag(riskFlag)
                .riskReasons(List.copyOf(riskReasons))
                .bucket(bucket)
                .side(side(bucket, riskFlag))
                .build();
    }

    /**
     * Signed relative mispricing; positive means the market price is below fair value.
     */
    static double pricingGap(double fairValue, double marketPrice) {
        double market = Double.isFinite(marketPrice) ? Math.max(0.0, marketPrice) : 0.0;
        double fair = Double.isFinite(fairValue) ? fairValue : 0.0;
        return (fair - market) / Math.max(market, ScoringPolicy.MIN_PRICE_DENOMINATOR);
    }

    static double liquidity(long activity) {
        if (activity <= 0L) {
            return 0.0;
        }
        return Math.min(1.0, Math.log1p(activity) / Math.log1p(ScoringPolicy.LIQUIDITY_SATURATION));
    }

    static double spreadPenalty(OptionContract contract) {
        if (!contract.hasTwoSidedQuote()) {
            return ScoringPolicy.MAX_SPREAD_PENALTY;
        }
        double mid = contract.mid();
        double relative = (contract.ask - contract.bid) / mid;
        return clamp(relative, 0.0, ScoringPolicy.MAX_SPREAD_PENALTY);
    }

    static double alignment(double gapSign, int kindSign, double effectiveMean) {
        double mean = Double.isFinite(effectiveMean) ? effectiveMean : 0.0;
        double strength = clamp(mean / ScoringPolicy.SENTIMENT_SCALE, -1.0, 1.0);
        return gapSign * kindSign * strength;
    }

    static List<String> riskReasons(OptionContract contract, double spread, double years) {
        List<String> reasons = new ArrayList<>();
        if (contract.activity() < ScoringPolicy.MIN_ACTIVITY) {
            reasons.add("low_activity(volume+oi=" + contract.activity() + ")");
        }
        if (spread > ScoringPolicy.MAX_SPREAD_FOR_RISK) {
            reasons.add(String.format(Locale.US, "wide_spread(%.2f)", spread));
        }
        if (years < ScoringPolicy.MIN_YEARS_TO_EXPIRY) {
            reasons.add("expiring_within_1d");
        }
        return reasons;
    }

    static RecommendationBucket bucket(double composite, boolean riskFlag) {
        if (composite >= ScoringPolicy.FAVOR_THRESHOLD) {
            return riskFlag ? RecommendationBucket.NEUTRAL : RecommendationBucket.FAVOR;
        }
        if (composite <= ScoringPolicy.AVOID_THRESHOLD) {
            return RecommendationBucket.AVOID;
        }
        return RecommendationBucket.NEUTRAL;
    }

    static TradeSide side(RecommendationBucket bucket, boolean riskFlag) {
        if (bucket == RecommendationBucket.FAVOR) {
            return TradeSide.BUY;
        }
        if (bucket == RecommendationBucket.AVOID && !riskFlag) {
            return TradeSide.SELL;
        }
        return TradeSide.NONE;
    }

    private static double clamp(double value, double lo, double hi) {
        if (!Double.isFinite(value)) {
            return hi;
        }
        return Math.max(lo, Math.min(hi, value));
    }
}
