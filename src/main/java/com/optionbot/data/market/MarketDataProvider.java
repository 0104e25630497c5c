package com.optionbot.data.market;

import com.optionbot.data.DataFetchException;
import com.optionbot.model.OptionContract;
import com.optionbot.model.Quote;

import java.time.Instant;
import java.util.List;

public interface MarketDataProvider {

    Quote getQuote(String ticker) throws DataFetchException;

    /**
     * Contracts for the nearest {@code maxExpirations} expirations on or after the valuation date.
     */
    List<OptionContract> getOptionChain(String ticker, int maxExpirations, Instant valuationInstant) throws DataFetchException;
}
