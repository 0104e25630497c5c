package com.optionbot.model;

import java.util.List;
import java.util.Locale;

/**
 * Headlines for one ticker in fetch order. The order is fixed here and used for tie-breaks downstream.
 */
public final class HeadlineSet {
    public final String ticker;
    public final List<Headline> headlines;
    public final String sourceLabel;

    public HeadlineSet(String ticker, List<Headline> headlines, String sourceLabel) {
        this.ticker = ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
        this.headlines = headlines == null ? List.of() : List.copyOf(headlines);
        this.sourceLabel = sourceLabel == null ? "" : sourceLabel;
    }

    public static HeadlineSet empty(String ticker, String sourceLabel) {
        return new HeadlineSet(ticker, List.of(), sourceLabel);
    }

    public int size() {
        return headlines.size();
    }

    public boolean isEmpty() {
        return headlines.isEmpty();
    }
}
