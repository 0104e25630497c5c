package com.optionbot.sentiment;

import com.optionbot.model.Headline;
import com.optionbot.model.SentimentMethod;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic rule-based scorer. Sums term valences with negation and intensifier handling,
 * then normalizes the sum with x / sqrt(x^2 + 15).
 */
public final class LexiconScorer implements SentimentScorer {
    static final double NORMALIZATION_ALPHA = 15.0;
    static final int NEGATION_WINDOW = 3;
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^a-z0-9'\\-]+");

    private final SentimentLexicon lexicon;

    public LexiconScorer(SentimentLexicon lexicon) {
        if (lexicon == null) {
            throw new IllegalArgumentException("lexicon is required");
        }
        this.lexicon = lexicon;
    }

    @Override
    public SentimentMethod method() {
        return SentimentMethod.LEXICON;
    }

    @Override
    public List<Double> scoreBatch(List<Headline> headlines) {
        List<Double> out = new ArrayList<>();
        if (headlines == null) {
            return out;
        }
        for (Headline headline : headlines) {
            out.add(score(headline == null ? "" : headline.text));
        }
        return out;
    }

    public double score(String text) {
        List<String> tokens = tokenize(text);
        double sum = 0.0;
        int negateRemaining = 0;
        double pendingBoost = 0.0;
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (lexicon.isNegator(token)) {
                negateRemaining = NEGATION_WINDOW;
                continue;
            }
            Double boost = lexicon.boost(token);
            if (boost != null && i + 1 < tokens.size() && lexicon.valence(tokens.get(i + 1)) != null) {
                pendingBoost += boost;
            } else {
                Double valence = lexicon.valence(token);
                if (valence != null) {
                    double v = valence * (1.0 + pendingBoost);
                    if (negateRemaining > 0) {
                        v = -v;
                    }
                    sum += v;
                    pendingBoost = 0.0;
                }
            }
            if (negateRemaining > 0) {
                negateRemaining--;
            }
        }
        return normalize(sum);
    }

    static double normalize(double sum) {
        if (sum == 0.0 || !Double.isFinite(sum)) {
            return 0.0;
        }
        double value = sum / Math.sqrt(sum * sum + NORMALIZATION_ALPHA);
        return Math.max(-1.0, Math.min(1.0, value));
    }

    static List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        for (String raw : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            String token = stripEdges(raw);
            if (!token.isEmpty()) {
                out.add(token);
            }
        }
        return out;
    }

    private static String stripEdges(String raw) {
        int start = 0;
        int end = raw.length();
        while (start < end && (raw.charAt(start) == '\'' || raw.charAt(start) == '-')) {
            start++;
        }
        while (end > start && (raw.charAt(end - 1) == '\'' || raw.charAt(end - 1) == '-')) {
            end--;
        }
        return raw.substring(start, end);
    }
}
