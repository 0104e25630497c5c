package com.optionbot.sentiment;

import com.optionbot.model.Headline;
import com.optionbot.model.SentimentMethod;

import java.util.List;

/**
 * Scores a batch of headlines. Returned scores are in [-1, 1], one per headline, in input order.
 */
public interface SentimentScorer {

    SentimentMethod method();

    List<Double> scoreBatch(List<Headline> headlines) throws SentimentScoringException;
}
