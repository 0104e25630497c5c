package com.optionbot.model;

import com.optionbot.config.Config;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RunRequest {
    public final List<String> tickers;
    public final int maxExpirations;
    public final double riskFreeRate;
    public final int headlineCount;
    public final SentimentMode sentimentMode;
    public final String newsSource;
    /** Optional free-text query; {@code {ticker}} is substituted per ticker. */
    public final String query;
    public final int topPerTicker;
    public final int threads;
    public final int fetchTimeoutSec;
    public final int runTimeoutSec;
    public final double fallbackVolatility;

    public static RunRequest fromConfig(Config config) {
        List<String> tickers = new ArrayList<>();
        for (String raw : config.getList("pipeline.tickers")) {
            tickers.add(raw.trim().toUpperCase(Locale.ROOT));
        }
        return RunRequest.builder()
                .tickers(tickers)
                .maxExpirations(Math.max(1, config.getInt("pipeline.max_expirations", 3)))
                .riskFreeRate(config.getDouble("pipeline.risk_free_rate", 0.045))
                .headlineCount(Math.max(0, config.getInt("news.headline_count", 20)))
                .sentimentMode(SentimentMode.parse(config.getString("sentiment.mode", "auto")))
                .newsSource(config.getString("news.source", "yahoo").toLowerCase(Locale.ROOT))
                .query(config.getString("news.query", ""))
                .topPerTicker(Math.max(0, config.getInt("pipeline.top_per_ticker", 0)))
                .threads(Math.max(1, config.getInt("pipeline.threads", 3)))
                .fetchTimeoutSec(Math.max(1, config.getInt("fetch.timeout_sec", 30)))
                .runTimeoutSec(Math.max(0, config.getInt("pipeline.run_timeout_sec", 0)))
                .fallbackVolatility(config.getDouble("pricing.fallback_volatility", 0.0))
                .build();
    }

    /**
     * News lookup key for one ticker: the query with {@code {ticker}} substituted, or the ticker itself.
     */
    public String newsKeyFor(String ticker) {
        if (query == null || query.isBlank()) {
            return ticker;
        }
        return query.replace("{ticker}", ticker).trim();
    }
}
