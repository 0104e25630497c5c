package com.optionbot.data.news;

import com.optionbot.config.Config;
import com.optionbot.data.http.HttpClientEx;

import java.util.Locale;

public final class NewsProviders {
    private NewsProviders() {
    }

    /**
     * @param source one of {@code yahoo}, {@code google}, {@code newsapi}, {@code csv}
     */
    public static NewsProvider create(String source, Config config, HttpClientEx http) {
        String key = source == null ? "" : source.trim().toLowerCase(Locale.ROOT);
        int timeoutSec = config.getInt("fetch.timeout_sec", 30);
        String lang = config.getString("news.lang", "en");
        String region = config.getString("news.region", "US");
        switch (key) {
            case "yahoo":
                return new NewsService(http, NewsService.Feed.YAHOO, lang, region, timeoutSec);
            case "google":
                return new NewsService(http, NewsService.Feed.GOOGLE, lang, region, timeoutSec);
            case "newsapi":
                return new NewsApiClient(
                        http,
                        config.getString("news.newsapi.base_url"),
                        resolveApiKey(config),
                        timeoutSec,
                        new CsvHeadlineSource(config.getPath("news.csv.path")),
                        config.getBoolean("news.cache.enabled", true) ? config.getHours("news.cache.max_age_hours", 24.0) : null
                );
            case "csv":
                return new CsvHeadlineSource(config.getPath("news.csv.path"), config.getHours("news.csv.max_age_hours", 0.0));
            default:
                throw new IllegalArgumentException("unknown news source: " + source + " (yahoo|google|newsapi|csv)");
        }
    }

    /**
     * Whether the source is looked up by ticker; query sources get the request's query instead.
     */
    public static boolean isTickerKeyed(String source) {
        return "yahoo".equalsIgnoreCase(source == null ? "" : source.trim());
    }

    static String resolveApiKey(Config config) {
        String env = System.getenv("NEWS_API_KEY");
        if (env != null && !env.isBlank()) {
            return env.trim();
        }
        return config.getString("news.newsapi.api_key", "");
    }
}
