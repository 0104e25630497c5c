package com.optionbot.scoring;

import com.optionbot.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * Weights and normalization constants of the opportunity score.
 */
public final class ScoringPolicy {
    private static final Logger LOG = LogManager.getLogger(ScoringPolicy.class);

    public static final double GAP_SCALE = 0.5;
    public static final double MIN_PRICE_DENOMINATOR = 0.01;
    public static final double LIQUIDITY_SATURATION = 5000.0;
    public static final double MAX_SPREAD_PENALTY = 5.0;
    public static final double SENTIMENT_SCALE = 0.5;

    public static final long MIN_ACTIVITY = 10L;
    public static final double MAX_SPREAD_FOR_RISK = 1.0;
    public static final double MIN_YEARS_TO_EXPIRY = 1.0 / 365.0;

    public static final double FAVOR_THRESHOLD = 25.0;
    public static final double AVOID_THRESHOLD = -25.0;

    public static final double DEFAULT_GAP_WEIGHT = 0.50;
    public static final double DEFAULT_LIQUIDITY_WEIGHT = 0.20;
    public static final double DEFAULT_SPREAD_WEIGHT = 0.15;
    public static final double DEFAULT_SENTIMENT_WEIGHT = 0.15;

    public final double gapWeight;
    public final double liquidityWeight;
    public final double spreadWeight;
    public final double sentimentWeight;

    public ScoringPolicy(double gapWeight, double liquidityWeight, double spreadWeight, double sentimentWeight) {
        this.gapWeight = requireWeight("gap", gapWeight);
        this.liquidityWeight = requireWeight("liquidity", liquidityWeight);
        this.spreadWeight = requireWeight("spread", spreadWeight);
        this.sentimentWeight = requireWeight("sentiment", sentimentWeight);
    }

    public static ScoringPolicy defaults() {
        return new ScoringPolicy(DEFAULT_GAP_WEIGHT, DEFAULT_LIQUIDITY_WEIGHT, DEFAULT_SPREAD_WEIGHT, DEFAULT_SENTIMENT_WEIGHT);
    }

    public static ScoringPolicy fromConfig(Config config) {
        ScoringPolicy policy = new ScoringPolicy(
                config.getDouble("score.weight.gap", DEFAULT_GAP_WEIGHT),
                config.getDouble("score.weight.liquidity", DEFAULT_LIQUIDITY_WEIGHT),
                config.getDouble("score.weight.spread", DEFAULT_SPREAD_WEIGHT),
                config.getDouble("score.weight.sentiment", DEFAULT_SENTIMENT_WEIGHT)
        );
        double sum = policy.weightSum();
        if (Math.abs(sum - 1.0) > 1e-9) {
            LOG.warn("score weights sum to {} instead of 1.0; composite range changes accordingly", String.format(Locale.US, "%.4f", sum));
        }
        return policy;
    }

    public double weightSum() {
        return gapWeight + liquidityWeight + spreadWeight + sentimentWeight;
    }

    private static double requireWeight(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new IllegalArgumentException("score weight " + name + " must be a non-negative number: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "gap=%.2f liquidity=%.2f spread=%.2f sentiment=%.2f",
                gapWeight, liquidityWeight, spreadWeight, sentimentWeight);
    }
}
