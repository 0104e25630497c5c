package com.optionbot.sentiment;

import com.optionbot.data.http.HttpClientEx;
import com.optionbot.data.rss.RssParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Crowd sentiment from public RSS feeds, loaded once per run and scored with the lexicon.
 * Items are attributed to tickers through {@code $CASHTAG} mentions. With a rolling window,
 * items published before it are dropped; undated items are kept.
 */
public class SocialSentimentService {
    private static final Logger LOG = LogManager.getLogger(SocialSentimentService.class);
    private static final Pattern CASHTAG = Pattern.compile("\\$([A-Za-z]{1,5})\\b");
    static final int ITEMS_PER_FEED = 50;

    private final HttpClientEx http;
    private final List<String> feedUrls;
    private final LexiconScorer lexicon;
    private final int timeoutSec;
    private final Duration window;

    private Map<String, double[]> byTicker = Map.of();
    private double overallSum;
    private int overallCount;
    private boolean loaded;

    public SocialSentimentService(HttpClientEx http, List<String> feedUrls, LexiconScorer lexicon, int timeoutSec) {
        this(http, feedUrls, lexicon, timeoutSec, null);
    }

    public SocialSentimentService(HttpClientEx http, List<String> feedUrls, LexiconScorer lexicon, int timeoutSec, Duration window) {
        this.http = http;
        this.feedUrls = feedUrls == null ? List.of() : List.copyOf(feedUrls);
        this.lexicon = lexicon;
        this.timeoutSec = Math.max(1, timeoutSec);
        this.window = window == null || window.isZero() || window.isNegative() ? null : window;
    }

    /**
     * Fetches every feed once. A failing feed is logged and skipped.
     *
     * @return number of items scored
     */
    public synchronized int load() {
        Instant cutoff = window == null ? null : Instant.now().minus(window);
        List<String> texts = new ArrayList<>();
        int stale = 0;
        for (String url : feedUrls) {
            try {
                String xml = http.getText(url, timeoutSec);
                for (RssParser.RssItem item : RssParser.parse(xml, ITEMS_PER_FEED)) {
                    if (!withinWindow(item.publishedAt(), cutoff)) {
                        stale++;
                        continue;
                    }
                    texts.add((item.title() + " " + item.description()).trim());
                }
            } catch (IOException | IllegalArgumentException e) {
                LOG.warn("social feed skipped {}: {}", url, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("social feed load interrupted at {}", url);
                break;
            }
        }
        if (stale > 0) {
            LOG.debug("social feeds: {} items older than {}h dropped", stale, window.toHours());
        }
        ingest(texts);
        return overallCount;
    }

    static boolean withinWindow(ZonedDateTime publishedAt, Instant cutoff) {
        return cutoff == null || publishedAt == null || !publishedAt.toInstant().isBefore(cutoff);
    }

    synchronized void ingest(List<String> texts) {
        Map<String, double[]> acc = new HashMap<>();
        double sum = 0.0;
        int count = 0;
        for (String text : texts) {
            if (text == null || text.isBlank()) {
                continue;
            }
            double score = lexicon.score(text);
            sum += score;
            count++;
            for (String ticker : extractCashtags(text)) {
                double[] cell = acc.computeIfAbsent(ticker, ignored -> new double[2]);
                cell[0] += score;
                cell[1] += 1.0;
            }
        }
        this.byTicker = Collections.unmodifiableMap(acc);
        this.overallSum = sum;
        this.overallCount = count;
        this.loaded = true;
        LOG.info("social sentiment items={} tickers={}", count, acc.size());
    }

    /**
     * Average score of items mentioning the ticker, else the overall feed average, else NaN.
     */
    public synchronized double meanFor(String ticker) {
        if (!loaded || overallCount == 0) {
            return Double.NaN;
        }
        double[] cell = ticker == null ? null : byTicker.get(ticker.trim().toUpperCase(Locale.ROOT));
        if (cell != null && cell[1] > 0.0) {
            return cell[0] / cell[1];
        }
        return overallSum / overallCount;
    }

    static Set<String> extractCashtags(String text) {
        Set<String> out = new LinkedHashSet<>();
        Matcher m = CASHTAG.matcher(text == null ? "" : text);
        while (m.find()) {
            out.add(m.group(1).toUpperCase(Locale.ROOT));
        }
        return out;
    }
}
