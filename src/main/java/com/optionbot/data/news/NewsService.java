package com.optionbot.data.news;

import com.optionbot.data.DataFetchException;
import com.optionbot.data.http.HttpClientEx;
import com.optionbot.data.rss.RssParser;
import com.optionbot.model.Headline;
import com.optionbot.model.ScanFailureReason;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * RSS headline sources: Yahoo Finance (keyed by ticker) and Google News (keyed by query).
 */
public class NewsService implements NewsProvider {

    public enum Feed {
        YAHOO("yahoo"),
        GOOGLE("google");

        private final String label;

        Feed(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final HttpClientEx http;
    private final Feed feed;
    private final String lang;
    private final String region;
    private final int timeoutSec;

    public NewsService(HttpClientEx http, Feed feed, String lang, String region, int timeoutSec) {
        this.http = http;
        this.feed = feed == null ? Feed.YAHOO : feed;
        this.lang = lang == null || lang.isBlank() ? "en" : lang.trim();
        this.region = region == null || region.isBlank() ? "US" : region.trim().toUpperCase(Locale.ROOT);
        this.timeoutSec = Math.max(1, timeoutSec);
    }

    @Override
    public String sourceLabel() {
        return feed.label();
    }

    @Override
    public List<Headline> fetchHeadlines(String tickerOrQuery, int count) throws DataFetchException {
        if (count <= 0 || tickerOrQuery == null || tickerOrQuery.isBlank()) {
            return List.of();
        }
        String url = feedUrl(tickerOrQuery.trim());
        String xml;
        try {
            xml = http.getText(url, timeoutSec);
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw DataFetchException.classify(feed.label() + " news fetch", e, ScanFailureReason.OTHER);
        }
        try {
            return toHeadlines(RssParser.parse(xml, count * 2), count);
        } catch (IllegalArgumentException e) {
            throw new DataFetchException(ScanFailureReason.PARSE_ERROR, feed.label() + " feed unparseable", e);
        }
    }

    String feedUrl(String key) {
        if (feed == Feed.YAHOO) {
            String ticker = URLEncoder.encode(key.toUpperCase(Locale.ROOT), StandardCharsets.UTF_8);
            return "https://feeds.finance.yahoo.com/rss/2.0/headline?s=" + ticker
                    + "&region=" + region + "&lang=" + lang + "-" + region;
        }
        String q = URLEncoder.encode(key, StandardCharsets.UTF_8);
        return "https://news.google.com/rss/search?q=" + q + "&hl=" + lang + "&gl=" + region + "&ceid=" + region + ":" + lang;
    }

    /**
     * Drops duplicate titles, keeping the first occurrence and the feed's order.
     */
    static List<Headline> toHeadlines(List<RssParser.RssItem> items, int count) {
        List<Headline> out = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (RssParser.RssItem item : items) {
            if (out.size() >= count) {
                break;
            }
            String key = item.title().toLowerCase(Locale.ROOT);
            if (!seen.add(key)) {
                continue;
            }
            out.add(new Headline(item.title(), item.source(), item.link(), item.publishedAt()));
        }
        return out;
    }
}
