package com.optionbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SentimentSummary {
    public final String ticker;
    public final double mean;
    public final double std;
    public final int count;
    public final List<ScoredHeadline> topPositive;
    public final List<ScoredHeadline> topNegative;
    public final SentimentMethod methodUsed;
    public final List<Double> scores;
    /** NaN when no social feed covered this ticker. */
    public final double socialMean;
    public final double socialWeight;
    public final String warning;

    public boolean hasSocial() {
        return Double.isFinite(socialMean) && socialWeight > 0.0;
    }

    /**
     * News mean, blended with the social mean when one is present.
     */
    public double effectiveMean() {
        if (!hasSocial()) {
            return mean;
        }
        double w = Math.max(0.0, Math.min(1.0, socialWeight));
        return (1.0 - w) * mean + w * socialMean;
    }

    public boolean hasWarning() {
        return warning != null && !warning.isBlank();
    }

    public static SentimentSummary empty(String ticker, SentimentMethod method, String warning) {
        return SentimentSummary.builder()
                .ticker(ticker)
                .mean(0.0)
                .std(0.0)
                .count(0)
                .topPositive(List.of())
                .topNegative(List.of())
                .methodUsed(method)
                .scores(List.of())
                .socialMean(Double.NaN)
                .socialWeight(0.0)
                .warning(warning == null ? "" : warning)
                .build();
    }
}
