package com.optionbot.data.news;

import com.optionbot.data.DataFetchException;
import com.optionbot.data.http.HttpClientEx;
import com.optionbot.model.Headline;
import com.optionbot.model.ScanFailureReason;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * NewsAPI.ai (Event Registry) article search. Results are appended to the local headline CSV
 * when a cache is configured, so later runs can use the {@code csv} source offline. With a
 * freshness window, rows cached for the same query inside it are served without an API call.
 */
public class NewsApiClient implements NewsProvider {
    private static final Logger LOG = LogManager.getLogger(NewsApiClient.class);
    private static final Pattern OR_SPLIT = Pattern.compile("\\s+OR\\s+", Pattern.CASE_INSENSITIVE);
    static final int MAX_PAGE = 100;

    private final HttpClientEx http;
    private final String baseUrl;
    private final String apiKey;
    private final int timeoutSec;
    private final CsvHeadlineSource cache;
    private final Duration cacheMaxAge;

    public NewsApiClient(HttpClientEx http, String baseUrl, String apiKey, int timeoutSec, CsvHeadlineSource cache) {
        this(http, baseUrl, apiKey, timeoutSec, cache, null);
    }

    /**
     * @param cacheMaxAge how old cached rows may be to answer a query; {@code null} always calls the API
     */
    public NewsApiClient(HttpClientEx http, String baseUrl, String apiKey, int timeoutSec,
                         CsvHeadlineSource cache, Duration cacheMaxAge) {
        this.http = http;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.timeoutSec = Math.max(1, timeoutSec);
        this.cache = cache;
        this.cacheMaxAge = cacheMaxAge == null || cacheMaxAge.isZero() || cacheMaxAge.isNegative() ? null : cacheMaxAge;
    }

    @Override
    public String sourceLabel() {
        return "newsapi";
    }

    @Override
    public List<Headline> fetchHeadlines(String query, int count) throws DataFetchException {
        if (count <= 0 || query == null || query.isBlank()) {
            return List.of();
        }
        if (cache != null && cacheMaxAge != null) {
            List<Headline> cached = cache.cached(query, count, cacheMaxAge);
            if (!cached.isEmpty()) {
                LOG.info("newsapi query='{}' served {} cached headlines from {}", query.trim(), cached.size(), cache.path());
                return cached;
            }
        }
        if (apiKey.isEmpty()) {
            throw new DataFetchException(ScanFailureReason.OTHER, "newsapi source needs NEWS_API_KEY or news.newsapi.api_key");
        }
        String body;
        try {
            body = http.postJson(baseUrl, buildRequest(query.trim(), count).toString(), timeoutSec);
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw DataFetchException.classify("newsapi fetch", e, ScanFailureReason.OTHER);
        }
        List<Headline> out;
        try {
            out = parseArticles(body, count);
        } catch (JSONException e) {
            throw new DataFetchException(ScanFailureReason.PARSE_ERROR, "newsapi reply unparseable", e);
        }
        if (cache != null && !out.isEmpty()) {
            cache.append(query.trim(), out);
        }
        LOG.debug("newsapi query='{}' headlines={}", query, out.size());
        return out;
    }

    JSONObject buildRequest(String query, int count) {
        JSONArray keywords = new JSONArray();
        for (String term : OR_SPLIT.split(query)) {
            if (!term.isBlank()) {
                keywords.put(term.trim());
            }
        }
        JSONObject req = new JSONObject();
        req.put("action", "getArticles");
        req.put("keyword", keywords);
        req.put("keywordOper", "or");
        req.put("lang", "eng");
        req.put("articlesPage", 1);
        req.put("articlesCount", Math.min(MAX_PAGE, Math.max(1, count)));
        req.put("articlesSortBy", "date");
        req.put("articlesSortByAsc", false);
        req.put("resultType", "articles");
        req.put("apiKey", apiKey);
        return req;
    }

    static List<Headline> parseArticles(String body, int count) throws DataFetchException {
        JSONObject root = new JSONObject(body);
        if (root.has("error")) {
            throw new DataFetchException(ScanFailureReason.OTHER, "newsapi error: " + root.opt("error"));
        }
        JSONObject articles = root.optJSONObject("articles");
        JSONArray results = articles == null ? null : articles.optJSONArray("results");
        List<Headline> out = new ArrayList<>();
        if (results == null) {
            return out;
        }
        Set<String> seenUrls = new HashSet<>();
        for (int i = 0; i < results.length() && out.size() < count; i++) {
            JSONObject art = results.optJSONObject(i);
            if (art == null) {
                continue;
            }
            String url = art.optString("url", art.optString("uri", ""));
            if (!url.isEmpty() && !seenUrls.add(url)) {
                continue;
            }
            String title = art.optString("title", "").trim();
            if (title.isEmpty()) {
                continue;
            }
            JSONObject src = art.optJSONObject("source");
            String source = src == null ? art.optString("source", "") : src.optString("title", src.optString("uri", ""));
            out.add(new Headline(title, source, url, parseTimestamp(art.optString("dateTimePub", art.optString("dateTime", "")))));
        }
        return out;
    }

    static ZonedDateTime parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw.trim()).atZoneSameInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
