package com.optionbot.scoring;

import com.optionbot.model.ContractId;
import com.optionbot.model.OpportunityRecord;
import com.optionbot.model.OptionContract;
import com.optionbot.model.OptionKind;
import com.optionbot.model.Quote;
import com.optionbot.model.RecommendationBucket;
import com.optionbot.model.SentimentMethod;
import com.optionbot.model.SentimentSummary;
import com.optionbot.model.TheoreticalResult;
import com.optionbot.model.TradeSide;
import com.optionbot.pricing.BlackScholesEngine;
import com.optionbot.pricing.TheoreticalPricer;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContractScorerTest {
    private static final LocalDate EXPIRY = LocalDate.of(2026, 3, 20);
    private final ContractScorer scorer = new ContractScorer(ScoringPolicy.defaults());

    @Test
    void score_shouldMatchPinnedComposite() {
        OptionContract contract = contract(OptionKind.CALL, 1.9, 2.1, 500, 500);
        OpportunityRecord record = scorer.score(contract, theoretical(contract, 3.0, 0.1), sentiment(0.25));

        assertEquals(2.0, record.marketPrice, 1e-12);
        assertEquals(0.5, record.pricingGap, 1e-12);
        assertEquals(Math.log1p(1000) / Math.log1p(5000), record.liquidity, 1e-12);
        assertEquals(0.1, record.spreadPenalty, 1e-12);
        assertEquals(0.5, record.sentimentAlignment, 1e-12);
        assertEquals(61.50, record.compositeScore, 0.01);
        assertFalse(record.riskFlag);
        assertEquals(RecommendationBucket.FAVOR, record.bucket);
        assertEquals(TradeSide.BUY, record.side);
        assertEquals(contract.id(), record.id());
    }

    @Test
    void score_shouldBeIdempotent() {
        OptionContract contract = contract(OptionKind.PUT, 3.0, 3.4, 40, 900);
        TheoreticalResult theoretical = theoretical(contract, 2.1, 0.2);
        SentimentSummary sentiment = sentiment(-0.3);

        OpportunityRecord first = scorer.score(contract, theoretical, sentiment);
        OpportunityRecord second = scorer.score(contract, theoretical, sentiment);

        assertEquals(first, second);
    }

    @Test
    void score_shouldGiveNegativeScoreToOverpricedContract() {
        OptionContract contract = contract(OptionKind.CALL, 4.9, 5.1, 2000, 3000);
        OpportunityRecord record = scorer.score(contract, theoretical(contract, 2.0, 0.2), sentiment(0.0));

        assertTrue(record.compositeScore <= -25.0);
        assertEquals(RecommendationBucket.AVOID, record.bucket);
        assertEquals(TradeSide.SELL, record.side);
    }

    @Test
    void score_shouldUseLastPriceWhenQuoteIsOneSided() {
        OptionContract contract = contract(OptionKind.CALL, 0.0, 1.2, 3, 2).toBuilder().lastPrice(1.0).build();
        OpportunityRecord record = scorer.score(contract, theoretical(contract, 1.5, 0.0005), sentiment(0.0));

        assertEquals(1.0, record.marketPrice, 0.0);
        assertEquals(ScoringPolicy.MAX_SPREAD_PENALTY, record.spreadPenalty, 0.0);
        assertTrue(record.riskFlag);
        assertEquals(List.of("low_activity(volume+oi=5)", "wide_spread(5.00)", "expiring_within_1d"), record.riskReasons);
        assertFalse(record.bucket == RecommendationBucket.FAVOR);
    }

    @Test
    void score_shouldUseFloorDenominatorWithoutMarketPrice() {
        OptionContract contract = contract(OptionKind.PUT, 0.0, 0.0, 100, 100).toBuilder().lastPrice(0.0).build();
        OpportunityRecord record = scorer.score(contract, theoretical(contract, 0.05, 0.3), sentiment(0.0));

        assertEquals(0.0, record.marketPrice, 0.0);
        assertEquals(5.0, record.pricingGap, 1e-12);
        assertTrue(Double.isFinite(record.compositeScore));
    }

    @Test
    void score_shouldRejectMissingOrMismatchedInputs() {
        OptionContract contract = contract(OptionKind.CALL, 1.0, 1.1, 100, 100);
        TheoreticalResult theoretical = theoretical(contract, 1.2, 0.2);
        OptionContract other = contract.toBuilder().strike(105.0).build();

        assertThrows(IllegalStateException.class, () -> scorer.score(null, theoretical, sentiment(0.0)));
        assertThrows(IllegalStateException.class, () -> scorer.score(contract, null, sentiment(0.0)));
        assertThrows(IllegalStateException.class, () -> scorer.score(contract, theoretical, null));
        assertThrows(IllegalStateException.class, () -> scorer.score(other, theoretical, sentiment(0.0)));
    }

    @Test
    void alignment_shouldRewardSentimentMatchingTheTrade() {
        // underpriced call, bullish news
        assertEquals(1.0, ContractScorer.alignment(1.0, OptionKind.CALL.sign(), 0.8), 0.0);
        // underpriced put, bullish news
        assertEquals(-1.0, ContractScorer.alignment(1.0, OptionKind.PUT.sign(), 0.8), 0.0);
        assertEquals(0.4, ContractScorer.alignment(-1.0, OptionKind.PUT.sign(), 0.2), 1e-12);
        assertEquals(0.0, ContractScorer.alignment(0.0, OptionKind.CALL.sign(), 0.5), 0.0);
        assertEquals(0.0, ContractScorer.alignment(1.0, OptionKind.CALL.sign(), Double.NaN), 0.0);
    }

    @Test
    void liquidity_shouldSaturateAtOne() {
        assertEquals(0.0, ContractScorer.liquidity(0), 0.0);
        assertEquals(1.0, ContractScorer.liquidity(5000), 1e-12);
        assertEquals(1.0, ContractScorer.liquidity(1_000_000), 0.0);
    }

    @Test
    void bucketAndSide_shouldRespectRiskFlag() {
        assertEquals(RecommendationBucket.FAVOR, ContractScorer.bucket(25.0, false));
        assertEquals(RecommendationBucket.NEUTRAL, ContractScorer.bucket(80.0, true));
        assertEquals(RecommendationBucket.NEUTRAL, ContractScorer.bucket(24.9, false));
        assertEquals(RecommendationBucket.AVOID, ContractScorer.bucket(-25.0, true));

        assertEquals(TradeSide.BUY, ContractScorer.side(RecommendationBucket.FAVOR, false));
        assertEquals(TradeSide.SELL, ContractScorer.side(RecommendationBucket.AVOID, false));
        assertEquals(TradeSide.NONE, ContractScorer.side(RecommendationBucket.AVOID, true));
        assertEquals(TradeSide.NONE, ContractScorer.side(RecommendationBucket.NEUTRAL, false));
    }

    @Test
    void score_shouldBlendSocialMeanIntoAlignment() {
        OptionContract contract = contract(OptionKind.CALL, 1.9, 2.1, 500, 500);
        SentimentSummary withSocial = sentiment(0.0).toBuilder().socialMean(0.5).socialWeight(0.5).build();

        OpportunityRecord record = scorer.score(contract, theoretical(contract, 3.0, 0.1), withSocial);

        assertEquals(0.5, record.sentimentAlignment, 1e-12);
    }

    @Test
    void score_shouldFlagIntrinsicPricingWithoutVolatility() {
        OptionContract contract = contract(OptionKind.CALL, 1.95, 2.05, 800, 1200).toBuilder()
                .strike(110.0)
                .impliedVolatility(Double.NaN)
                .build();
        TheoreticalPricer pricer = new TheoreticalPricer(new BlackScholesEngine(), 0.02, 0.0);
        TheoreticalResult theoretical = pricer.price(contract, new Quote("AAPL", 100.0, Instant.parse("2026-01-20T15:00:00Z")));

        OpportunityRecord record = scorer.score(contract, theoretical, sentiment(0.0));

        assertTrue(record.degeneratePricing);
        assertEquals(0.0, record.theoreticalValue, 0.0);
        assertTrue(record.compositeScore <= -25.0);
        assertTrue(record.riskFlag);
        assertEquals(List.of("no_volatility"), record.riskReasons);
        assertEquals(RecommendationBucket.AVOID, record.bucket);
        assertEquals(TradeSide.NONE, record.side);
    }

    @Test
    void score_shouldNotFlagDegeneratePricingAtExpiry() {
        OptionContract contract = contract(OptionKind.CALL, 1.9, 2.1, 500, 500);
        TheoreticalResult expired = new TheoreticalResult(contract.id(), 102.0, 2.0, 1.0, 0.0, 0.0, 0.0, 0.0, 0.3, true);

        OpportunityRecord record = scorer.score(contract, expired, sentiment(0.0));

        assertFalse(record.riskReasons.contains("no_volatility"));
        assertTrue(record.riskReasons.contains("expiring_within_1d"));
    }

    private static OptionContract contract(OptionKind kind, double bid, double ask, long volume, long openInterest) {
        return OptionContract.builder()
                .ticker("AAPL")
                .kind(kind)
                .strike(100.0)
                .expiration(EXPIRY)
                .contractSymbol("AAPL260320" + (kind == OptionKind.CALL ? "C" : "P") + "00100000")
                .lastPrice((bid + ask) / 2.0)
                .bid(bid)
                .ask(ask)
                .impliedVolatility(0.3)
                .openInterest(openInterest)
                .volume(volume)
                .build();
    }

    private static TheoreticalResult theoretical(OptionContract contract, double fair, double years) {
        ContractId id = contract.id();
        return new TheoreticalResult(id, 100.0, fair, 0.5, 0.1, 0.02, -0.01, years, 0.3, false);
    }

    private static SentimentSummary sentiment(double mean) {
        return SentimentSummary.empty("AAPL", SentimentMethod.LEXICON, "").toBuilder().mean(mean).count(5).build();
    }
}
