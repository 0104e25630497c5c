package com.optionbot.sentiment;

import com.optionbot.core.diagnostics.CauseCode;
import com.optionbot.model.Headline;
import com.optionbot.model.HeadlineSet;
import com.optionbot.model.ScoredHeadline;
import com.optionbot.model.SentimentMethod;
import com.optionbot.model.SentimentMode;
import com.optionbot.model.SentimentSummary;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SentimentAggregatorTest {

    @Test
    void summarize_shouldReturnZeroSummaryForEmptySet() {
        SentimentAggregator aggregator = new SentimentAggregator(
                new FixedScorer(SentimentMethod.CLASSIFIER, List.of()), new FixedScorer(SentimentMethod.LEXICON, List.of()),
                new ScorerSelector(true, true), 3);

        SentimentSummary summary = aggregator.summarize(HeadlineSet.empty("aapl", "yahoo"), SentimentMode.AUTO);

        assertEquals("AAPL", summary.ticker);
        assertEquals(0, summary.count);
        assertEquals(0.0, summary.mean, 0.0);
        assertEquals(0.0, summary.std, 0.0);
        assertTrue(summary.topPositive.isEmpty());
        assertTrue(summary.topNegative.isEmpty());
        assertEquals(SentimentMethod.LEXICON, summary.methodUsed);
    }

    @Test
    void summarize_shouldReportClassifierForEmptySetOnlyAfterASuccessfulBatch() {
        ScorerSelector selector = new ScorerSelector(true, true);
        SentimentAggregator aggregator = new SentimentAggregator(
                new FixedScorer(SentimentMethod.CLASSIFIER, List.of(0.5)), new FixedScorer(SentimentMethod.LEXICON, List.of(0.1)),
                selector, 3);

        assertEquals(SentimentMethod.LEXICON,
                aggregator.summarize(HeadlineSet.empty("MSFT", "yahoo"), SentimentMode.AUTO).methodUsed);
        aggregator.summarize(new HeadlineSet("AAPL", List.of(new Headline("Apple rallies", "wire", "https://x/1", null)), "yahoo"),
                SentimentMode.AUTO);

        assertEquals(ScorerSelector.State.CLASSIFIER_ACTIVE, selector.state());
        assertEquals(SentimentMethod.CLASSIFIER,
                aggregator.summarize(HeadlineSet.empty("MSFT", "yahoo"), SentimentMode.AUTO).methodUsed);
    }

    @Test
    void summarize_shouldComputeMeanAndPopulationStd() {
        FixedScorer classifier = new FixedScorer(SentimentMethod.CLASSIFIER, List.of(0.5, -0.5, 1.0, 0.0));
        SentimentAggregator aggregator = new SentimentAggregator(
                classifier, new FixedScorer(SentimentMethod.LEXICON, List.of()), new ScorerSelector(true, true), 3);

        SentimentSummary summary = aggregator.summarize(set(4), SentimentMode.AUTO);

        assertEquals(SentimentMethod.CLASSIFIER, summary.methodUsed);
        assertEquals(4, summary.count);
        assertEquals(0.25, summary.mean, 1e-12);
        assertEquals(Math.sqrt(0.3125), summary.std, 1e-12);
        assertEquals(ScorerSelector.State.CLASSIFIER_ACTIVE, aggregator.selector().state());
        assertFalse(summary.hasWarning());
    }

    @Test
    void summarize_shouldRescoreWithLexiconAndLockAfterClassifierFailure() {
        FailingScorer classifier = new FailingScorer();
        FixedScorer lexicon = new FixedScorer(SentimentMethod.LEXICON, List.of(0.2, 0.4));
        ScorerSelector selector = new ScorerSelector(true, true);
        SentimentAggregator aggregator = new SentimentAggregator(classifier, lexicon, selector, 3);

        SentimentSummary first = aggregator.summarize(set(2), SentimentMode.AUTO);
        SentimentSummary second = aggregator.summarize(set(2), SentimentMode.AUTO);

        assertEquals(SentimentMethod.LEXICON, first.methodUsed);
        assertEquals(0.3, first.mean, 1e-12);
        assertTrue(first.hasWarning());
        assertEquals(ScorerSelector.State.LEXICON_LOCKED, selector.state());
        assertEquals(CauseCode.CLASSIFIER_TIMEOUT, selector.resolution().causeCode);
        assertEquals(SentimentMethod.LEXICON, second.methodUsed);
        assertEquals(1, classifier.calls, "locked selector must not retry the classifier");
        assertEquals(2, lexicon.calls);
    }

    @Test
    void summarize_shouldTreatMismatchedScoreCountAsFailure() {
        FixedScorer classifier = new FixedScorer(SentimentMethod.CLASSIFIER, List.of(0.9));
        FixedScorer lexicon = new FixedScorer(SentimentMethod.LEXICON, List.of(-0.1, -0.3));
        SentimentAggregator aggregator = new SentimentAggregator(classifier, lexicon, new ScorerSelector(true, true), 3);

        SentimentSummary summary = aggregator.summarize(set(2), SentimentMode.AUTO);

        assertEquals(SentimentMethod.LEXICON, summary.methodUsed);
        assertEquals(-0.2, summary.mean, 1e-12);
    }

    @Test
    void summarize_shouldSkipClassifierInFallbackOnlyMode() {
        FailingScorer classifier = new FailingScorer();
        FixedScorer lexicon = new FixedScorer(SentimentMethod.LEXICON, List.of(0.1));
        ScorerSelector selector = new ScorerSelector(true, true);
        SentimentAggregator aggregator = new SentimentAggregator(classifier, lexicon, selector, 3);

        SentimentSummary summary = aggregator.summarize(set(1), SentimentMode.FALLBACK_ONLY);

        assertEquals(SentimentMethod.LEXICON, summary.methodUsed);
        assertEquals(0, classifier.calls);
        assertEquals(ScorerSelector.State.UNTRIED, selector.state());
        assertFalse(summary.hasWarning());
    }

    @Test
    void summarize_shouldClampScoresAndTreatNonFiniteAsNeutral() {
        FixedScorer classifier = new FixedScorer(SentimentMethod.CLASSIFIER, List.of(3.0, Double.NaN));
        SentimentAggregator aggregator = new SentimentAggregator(
                classifier, new FixedScorer(SentimentMethod.LEXICON, List.of()), new ScorerSelector(true, true), 3);

        SentimentSummary summary = aggregator.summarize(set(2), SentimentMode.AUTO);

        assertEquals(List.of(1.0, 0.0), summary.scores);
        assertEquals(0.5, summary.mean, 1e-12);
    }

    @Test
    void topLists_shouldKeepFetchOrderForEqualScores() {
        List<Headline> headlines = headlines(6);
        List<ScoredHeadline> scored = List.of(
                new ScoredHeadline(0, headlines.get(0), 0.4),
                new ScoredHeadline(1, headlines.get(1), 0.9),
                new ScoredHeadline(2, headlines.get(2), 0.4),
                new ScoredHeadline(3, headlines.get(3), -0.2),
                new ScoredHeadline(4, headlines.get(4), 0.0),
                new ScoredHeadline(5, headlines.get(5), -0.2));

        List<ScoredHeadline> positive = SentimentAggregator.topPositive(scored, 3);
        List<ScoredHeadline> negative = SentimentAggregator.topNegative(scored, 3);

        assertEquals(List.of(1, 0, 2), positive.stream().map(ScoredHeadline::index).toList());
        assertEquals(List.of(3, 5), negative.stream().map(ScoredHeadline::index).toList());
        assertEquals(1, SentimentAggregator.topPositive(scored, 1).size());
    }

    @Test
    void withSocial_shouldBlendIntoEffectiveMean() {
        SentimentSummary base = SentimentSummary.empty("SPY", SentimentMethod.LEXICON, "").toBuilder().mean(0.4).build();

        SentimentSummary blended = SentimentAggregator.withSocial(base, -0.4, 0.25);

        assertTrue(blended.hasSocial());
        assertEquals(0.2, blended.effectiveMean(), 1e-12);
        assertSame(base, SentimentAggregator.withSocial(base, Double.NaN, 0.25));
        assertEquals(0.4, SentimentAggregator.withSocial(base, 0.9, 0.0).effectiveMean(), 1e-12);
    }

    private static HeadlineSet set(int n) {
        return new HeadlineSet("NVDA", headlines(n), "test");
    }

    private static List<Headline> headlines(int n) {
        List<Headline> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(new Headline("headline " + i, "wire", "https://example.com/" + i, null));
        }
        return out;
    }

    private static final class FixedScorer implements SentimentScorer {
        private final SentimentMethod method;
        private final List<Double> scores;
        private int calls;

        private FixedScorer(SentimentMethod method, List<Double> scores) {
            this.method = method;
            this.scores = scores;
        }

        @Override
        public SentimentMethod method() {
            return method;
        }

        @Override
        public List<Double> scoreBatch(List<Headline> headlines) {
            calls++;
            return scores;
        }
    }

    private static final class FailingScorer implements SentimentScorer {
        private int calls;

        @Override
        public SentimentMethod method() {
            return SentimentMethod.CLASSIFIER;
        }

        @Override
        public List<Double> scoreBatch(List<Headline> headlines) throws SentimentScoringException {
            calls++;
            throw new SentimentScoringException(CauseCode.CLASSIFIER_TIMEOUT, "model did not answer");
        }
    }
}
