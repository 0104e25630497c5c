package com.optionbot.sentiment;

import com.optionbot.model.Headline;
import com.optionbot.model.HeadlineSet;
import com.optionbot.model.ScoredHeadline;
import com.optionbot.model.SentimentMethod;
import com.optionbot.model.SentimentMode;
import com.optionbot.model.SentimentSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class SentimentAggregator {
    private static final Logger LOG = LogManager.getLogger(SentimentAggregator.class);
    public static final int DEFAULT_TOP_K = 3;

    private final SentimentScorer classifier;
    private final SentimentScorer lexicon;
    private final ScorerSelector selector;
    private final int topK;

    public SentimentAggregator(SentimentScorer classifier, SentimentScorer lexicon, ScorerSelector selector, int topK) {
        if (lexicon == null) {
            throw new IllegalArgumentException("lexicon scorer is required");
        }
        this.classifier = classifier;
        this.lexicon = lexicon;
        this.selector = selector == null ? new ScorerSelector(classifier != null, classifier != null) : selector;
        this.topK = topK <= 0 ? DEFAULT_TOP_K : topK;
    }

    public ScorerSelector selector() {
        return selector;
    }

    public SentimentSummary summarize(HeadlineSet set, SentimentMode mode) {
        String ticker = set == null ? "" : set.ticker;
        List<Headline> headlines = set == null ? List.of() : set.headlines;
        SentimentMode effectiveMode = mode == null ? SentimentMode.AUTO : mode;
        boolean useClassifier = effectiveMode == SentimentMode.AUTO && classifier != null && selector.classifierAllowed();

        if (headlines.isEmpty()) {
            // nothing to score: only claim the classifier once a batch has actually gone through it
            boolean proven = useClassifier && selector.state() == ScorerSelector.State.CLASSIFIER_ACTIVE;
            SentimentMethod method = proven ? SentimentMethod.CLASSIFIER : SentimentMethod.LEXICON;
            return SentimentSummary.empty(ticker, method, lockWarning(effectiveMode));
        }

        String warning = "";
        List<Double> scores = null;
        SentimentMethod method = SentimentMethod.LEXICON;
        if (useClassifier) {
            try {
                scores = classifier.scoreBatch(headlines);
                if (scores == null || scores.size() != headlines.size()) {
                    throw new SentimentScoringException(null, "classifier returned a mismatched score list");
                }
                selector.markClassifierSucceeded();
                method = SentimentMethod.CLASSIFIER;
            } catch (SentimentScoringException e) {
                selector.lockToLexicon(e, e.causeCode());
                LOG.warn("classifier failed for {}, rescoring {} headlines with lexicon: {}", ticker, headlines.size(), e.getMessage());
                warning = "classifier failed, lexicon fallback: " + e.getMessage();
                scores = null;
            } catch (RuntimeException e) {
                selector.lockToLexicon(e, null);
                LOG.warn("classifier error for {}, rescoring {} headlines with lexicon", ticker, headlines.size(), e);
                warning = "classifier failed, lexicon fallback: " + e.getClass().getSimpleName();
                scores = null;
            }
        } else {
            warning = lockWarning(effectiveMode);
        }
        if (scores == null) {
            scores = scoreWithLexicon(headlines);
            method = SentimentMethod.LEXICON;
        }
        return build(ticker, headlines, scores, method, warning);
    }

    private List<Double> scoreWithLexicon(List<Headline> headlines) {
        try {
            return lexicon.scoreBatch(headlines);
        } catch (SentimentScoringException e) {
            throw new IllegalStateException("lexicon scorer failed", e);
        }
    }

    private String lockWarning(SentimentMode mode) {
        if (mode == SentimentMode.FALLBACK_ONLY || classifier == null) {
            return "";
        }
        if (selector.state() == ScorerSelector.State.LEXICON_LOCKED) {
            return "classifier unavailable: " + selector.resolution();
        }
        return "";
    }

    private SentimentSummary build(
            String ticker,
            List<Headline> headlines,
            List<Double> rawScores,
            SentimentMethod method,
            String warning
    ) {
        List<Double> scores = new ArrayList<>(rawScores.size());
        for (Double raw : rawScores) {
            double v = raw == null || !Double.isFinite(raw) ? 0.0 : raw;
            scores.add(Math.max(-1.0, Math.min(1.0, v)));
        }
        int n = scores.size();
        double sum = 0.0;
        for (double s : scores) {
            sum += s;
        }
        double mean = sum / n;
        double sq = 0.0;
        for (double s : scores) {
            sq += (s - mean) * (s - mean);
        }
        double std = Math.sqrt(sq / n);

        List<ScoredHeadline> scored = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            scored.add(new ScoredHeadline(i, headlines.get(i), scores.get(i)));
        }
        return SentimentSummary.builder()
                .ticker(ticker)
                .mean(mean)
                .std(std)
                .count(n)
                .topPositive(topPositive(scored, topK))
                .topNegative(topNegative(scored, topK))
                .methodUsed(method)
                .scores(List.copyOf(scores))
                .socialMean(Double.NaN)
                .socialWeight(0.0)
                .warning(warning == null ? "" : warning)
                .build();
    }

    static List<ScoredHeadline> topPositive(List<ScoredHeadline> scored, int k) {
        List<ScoredHeadline> positives = new ArrayList<>();
        for (ScoredHeadline s : scored) {
            if (s.score() > 0.0) {
                positives.add(s);
            }
        }
        // List.sort is stable: equal scores keep fetch order
        positives.sort(Comparator.comparingDouble(ScoredHeadline::score).reversed());
        return List.copyOf(positives.subList(0, Math.min(k, positives.size())));
    }

    static List<ScoredHeadline> topNegative(List<ScoredHeadline> scored, int k) {
        List<ScoredHeadline> negatives = new ArrayList<>();
        for (ScoredHeadline s : scored) {
            if (s.score() < 0.0) {
                negatives.add(s);
            }
        }
        negatives.sort(Comparator.comparingDouble(ScoredHeadline::score));
        return List.copyOf(negatives.subList(0, Math.min(k, negatives.size())));
    }

    /**
     * Attaches a social mean to a summary; the summary's effective mean then blends the two.
     */
    public static SentimentSummary withSocial(SentimentSummary summary, double socialMean, double weight) {
        if (summary == null || !Double.isFinite(socialMean)) {
            return summary;
        }
        double w = Math.max(0.0, Math.min(1.0, weight));
        double clampedSocial = Math.max(-1.0, Math.min(1.0, socialMean));
        return summary.toBuilder()
                .socialMean(clampedSocial)
                .socialWeight(w)
                .build();
    }
}
