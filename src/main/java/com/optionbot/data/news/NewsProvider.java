package com.optionbot.data.news;

import com.optionbot.data.DataFetchException;
import com.optionbot.model.Headline;

import java.util.List;

public interface NewsProvider {

    String sourceLabel();

    /**
     * @param tickerOrQuery a ticker for ticker-keyed sources, free text for query sources
     * @return at most {@code count} headlines, in the order the source returned them
     */
    List<Headline> fetchHeadlines(String tickerOrQuery, int count) throws DataFetchException;
}
